package br.com.analytics.pipeline.marketing_preprocess_batch.reader;

import br.com.analytics.pipeline.marketing_preprocess_batch.model.ReportColumns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class SchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(SchemaValidator.class);

    static final String DEFAULT_VALUE = "0";

    public ValidatedHeader validate(List<String> header) {
        List<String> columns = new ArrayList<>(header);
        Map<String, String> synthesized = new LinkedHashMap<>();

        for (String field : ReportColumns.IDENTIFYING) {
            if (!columns.contains(field)) {
                log.warn("Required column '{}' is missing from the report, defaulting it to {}", field, DEFAULT_VALUE);
                columns.add(field);
                synthesized.put(field, DEFAULT_VALUE);
            }
        }
        return new ValidatedHeader(columns, synthesized);
    }

    public record ValidatedHeader(
            List<String> columns,
            Map<String, String> synthesizedDefaults
    ) {

        public ValidatedHeader {
            columns = List.copyOf(columns);
            synthesizedDefaults = Map.copyOf(synthesizedDefaults);
        }
    }
}
