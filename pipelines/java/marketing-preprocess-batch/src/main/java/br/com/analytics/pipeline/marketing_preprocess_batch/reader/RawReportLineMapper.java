package br.com.analytics.pipeline.marketing_preprocess_batch.reader;

import br.com.analytics.pipeline.marketing_preprocess_batch.model.RawRow;
import br.com.analytics.pipeline.marketing_preprocess_batch.model.ReportColumns;
import br.com.analytics.pipeline.marketing_preprocess_batch.model.ReportFormat;
import br.com.analytics.pipeline.marketing_preprocess_batch.model.ReportSchema;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.infrastructure.item.file.LineCallbackHandler;
import org.springframework.batch.infrastructure.item.file.LineMapper;
import org.springframework.batch.infrastructure.item.file.transform.DelimitedLineTokenizer;

import java.util.Arrays;
import java.util.List;

public class RawReportLineMapper implements LineMapper<RawRow>, LineCallbackHandler {

    private static final Logger log = LoggerFactory.getLogger(RawReportLineMapper.class);

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final SchemaValidator schemaValidator;
    private final FormatDetector formatDetector;
    private final String groupColumnPrefix;
    private final DelimitedLineTokenizer tokenizer = new DelimitedLineTokenizer();

    private @Nullable ReportSchema schema;

    public RawReportLineMapper(SchemaValidator schemaValidator, FormatDetector formatDetector, String groupColumnPrefix) {
        this.schemaValidator = schemaValidator;
        this.formatDetector = formatDetector;
        this.groupColumnPrefix = groupColumnPrefix;
    }

    @Override
    public void handleLine(String headerLine) {
        String line = headerLine.startsWith(BYTE_ORDER_MARK) ? headerLine.substring(1) : headerLine;
        List<String> header = Arrays.stream(tokenize(line)).map(String::trim).toList();

        SchemaValidator.ValidatedHeader validated = schemaValidator.validate(header);
        ReportFormat format = formatDetector.detect(validated.columns());
        this.schema = ReportSchema.of(validated.columns(), validated.synthesizedDefaults(), groupColumnPrefix, format);

        log.info("Report header has {} columns, {} group columns, format {}",
                header.size(), schema.groupColumnIndexes().size(), format);
        if (format == ReportFormat.LONG && !schema.hasColumn(ReportColumns.REGION)) {
            log.warn("Report is not in wide format and has no '{}' column, every record will fall back to defaults",
                    ReportColumns.REGION);
        }
    }

    @Override
    public RawRow mapLine(String line, int lineNumber) {
        if (schema == null) {
            throw new IllegalStateException("Data line " + lineNumber + " read before the report header");
        }
        return new RawRow(lineNumber, schema, List.of(tokenize(line)));
    }

    @Nullable ReportSchema getSchema() {
        return schema;
    }

    private String[] tokenize(String line) {
        return tokenizer.tokenize(line).getValues();
    }
}
