package br.com.analytics.pipeline.marketing_preprocess_batch.writer;

import org.springframework.batch.infrastructure.item.file.transform.FieldExtractor;
import org.springframework.batch.infrastructure.item.file.transform.LineAggregator;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.stream.Collectors;

public class CsvLineAggregator<T> implements LineAggregator<T> {

    private static final String DELIMITER = ",";
    private static final String QUOTE = "\"";

    private final FieldExtractor<T> fieldExtractor;

    public CsvLineAggregator(FieldExtractor<T> fieldExtractor) {
        this.fieldExtractor = fieldExtractor;
    }

    @Override
    public String aggregate(T item) {
        return Arrays.stream(fieldExtractor.extract(item))
                .map(CsvLineAggregator::format)
                .collect(Collectors.joining(DELIMITER));
    }

    static String format(Object value) {
        if (value == null) {
            return "";
        }
        String text = value instanceof BigDecimal decimal ? decimal.toPlainString() : value.toString();
        if (text.contains(DELIMITER) || text.contains(QUOTE) || text.contains("\n") || text.contains("\r")) {
            return QUOTE + text.replace(QUOTE, QUOTE + QUOTE) + QUOTE;
        }
        return text;
    }
}
