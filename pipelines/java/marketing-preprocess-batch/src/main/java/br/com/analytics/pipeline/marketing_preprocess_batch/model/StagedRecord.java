package br.com.analytics.pipeline.marketing_preprocess_batch.model;

import org.jspecify.annotations.Nullable;

import static br.com.analytics.pipeline.marketing_preprocess_batch.model.ReportColumns.*;

public record StagedRecord(
        long sourceLine,
        @Nullable String date,
        @Nullable String usersActive,
        @Nullable String totalSales,
        @Nullable String newCustomers,
        @Nullable String reportGenerated,
        @Nullable String region,
        @Nullable String regionalSales,
        @Nullable String productId
) {

    public static StagedRecord fromRow(RawRow row, @Nullable String region,
                                       @Nullable String regionalSales, @Nullable String productId) {
        return new StagedRecord(
                row.lineNumber(),
                row.value(DATE),
                row.value(USERS_ACTIVE),
                row.value(TOTAL_SALES),
                row.value(NEW_CUSTOMERS),
                row.value(REPORT_GENERATED),
                region,
                regionalSales,
                productId
        );
    }

    public @Nullable String value(String column) {
        return switch (column) {
            case DATE -> date;
            case USERS_ACTIVE -> usersActive;
            case TOTAL_SALES -> totalSales;
            case NEW_CUSTOMERS -> newCustomers;
            case REPORT_GENERATED -> reportGenerated;
            case REGION -> region;
            case REGIONAL_SALES -> regionalSales;
            case PRODUCT_ID -> productId;
            default -> throw new IllegalArgumentException("Unknown column: " + column);
        };
    }

    public StagedRecord with(String column, @Nullable String value) {
        return new StagedRecord(
                sourceLine,
                DATE.equals(column) ? value : date,
                USERS_ACTIVE.equals(column) ? value : usersActive,
                TOTAL_SALES.equals(column) ? value : totalSales,
                NEW_CUSTOMERS.equals(column) ? value : newCustomers,
                REPORT_GENERATED.equals(column) ? value : reportGenerated,
                REGION.equals(column) ? value : region,
                REGIONAL_SALES.equals(column) ? value : regionalSales,
                PRODUCT_ID.equals(column) ? value : productId
        );
    }
}
