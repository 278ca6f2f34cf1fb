package br.com.analytics.pipeline.marketing_preprocess_batch.model;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

public record RawRow(
        long lineNumber,
        ReportSchema schema,
        List<String> values
) {

    public RawRow {
        values = List.copyOf(values);
    }

    /**
     * Cell of the named column, the synthesized default for a column the report lacked,
     * or {@code null} when the cell is blank or beyond the end of a short line.
     */
    public @Nullable String value(String column) {
        String synthesized = schema.synthesizedDefault(column);
        if (synthesized != null) {
            return synthesized;
        }
        int index = schema.indexOf(column);
        return index < 0 ? null : cell(index);
    }

    /** Group cells in header order; blank cells are kept as {@code null} so positions survive. */
    public List<@Nullable String> groupCells() {
        List<@Nullable String> cells = new ArrayList<>(schema.groupColumnIndexes().size());
        for (int index : schema.groupColumnIndexes()) {
            cells.add(cell(index));
        }
        return cells;
    }

    public boolean isBlank() {
        return values.stream().allMatch(String::isBlank);
    }

    private @Nullable String cell(int index) {
        if (index >= values.size()) {
            return null;
        }
        String cell = values.get(index).trim();
        return cell.isEmpty() ? null : cell;
    }
}
