package br.com.analytics.pipeline.marketing_preprocess_batch.model;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public record ReportSchema(
        List<String> columns,
        Map<String, String> synthesizedDefaults,
        List<Integer> groupColumnIndexes,
        ReportFormat format
) {

    public ReportSchema {
        columns = List.copyOf(columns);
        synthesizedDefaults = Map.copyOf(synthesizedDefaults);
        groupColumnIndexes = List.copyOf(groupColumnIndexes);
    }

    public static ReportSchema of(List<String> columns, Map<String, String> synthesizedDefaults,
                                  String groupColumnPrefix, ReportFormat format) {
        List<Integer> groupIndexes = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).startsWith(groupColumnPrefix)) {
                groupIndexes.add(i);
            }
        }
        return new ReportSchema(columns, synthesizedDefaults, groupIndexes, format);
    }

    public int indexOf(String column) {
        return columns.indexOf(column);
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public @Nullable String synthesizedDefault(String column) {
        return synthesizedDefaults.get(column);
    }
}
