package br.com.analytics.pipeline.marketing_preprocess_batch;

import br.com.analytics.pipeline.marketing_preprocess_batch.model.RawRow;
import br.com.analytics.pipeline.marketing_preprocess_batch.model.ReportFormat;
import br.com.analytics.pipeline.marketing_preprocess_batch.model.ReportSchema;
import br.com.analytics.pipeline.marketing_preprocess_batch.model.StagedRecord;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

public final class ReportFixtures {

    public static final List<String> IDENTIFYING_HEADER =
            List.of("date", "users_active", "total_sales", "new_customers", "report_generated");

    private ReportFixtures() {
    }

    public static ReportSchema wideSchema(int groupColumns) {
        List<String> columns = new ArrayList<>(IDENTIFYING_HEADER);
        for (int i = 1; i <= groupColumns; i++) {
            columns.add("col_" + i);
        }
        return ReportSchema.of(columns, Map.of(), "col_", ReportFormat.WIDE);
    }

    /** A row of the standard identifying values followed by the given group cells ("" for blank). */
    public static RawRow wideRow(String... groupCells) {
        List<String> values = new ArrayList<>(List.of("2024-01-01", "10", "500", "2", "True"));
        values.addAll(Arrays.asList(groupCells));
        return new RawRow(2, wideSchema(Math.max(6, groupCells.length)), values);
    }

    public static StagedRecord staged(String date, String region, String regionalSales, String productId) {
        return new StagedRecord(2, date, "10", "500", "2", "True", region, regionalSales, productId);
    }

    public static StagedRecord staged(String region) {
        return staged("2024-01-01", region, "100", "5");
    }
}
