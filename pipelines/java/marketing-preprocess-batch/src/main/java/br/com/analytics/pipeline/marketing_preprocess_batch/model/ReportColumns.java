package br.com.analytics.pipeline.marketing_preprocess_batch.model;

import java.util.List;

public final class ReportColumns {

    public static final String DATE = "date";
    public static final String USERS_ACTIVE = "users_active";
    public static final String TOTAL_SALES = "total_sales";
    public static final String NEW_CUSTOMERS = "new_customers";
    public static final String REPORT_GENERATED = "report_generated";
    public static final String REGION = "region";
    public static final String REGIONAL_SALES = "regional_sales";
    public static final String PRODUCT_ID = "product_id";

    /** Fields shared by every group of a source row. */
    public static final List<String> IDENTIFYING = List.of(
            DATE, USERS_ACTIVE, TOTAL_SALES, NEW_CUSTOMERS, REPORT_GENERATED);

    /** Output order expected by downstream consumers. Do not reorder. */
    public static final List<String> OUTPUT = List.of(
            DATE, USERS_ACTIVE, TOTAL_SALES, NEW_CUSTOMERS, REPORT_GENERATED,
            REGION, REGIONAL_SALES, PRODUCT_ID);

    public static final List<String> NUMERIC = List.of(
            USERS_ACTIVE, TOTAL_SALES, NEW_CUSTOMERS, REGIONAL_SALES, PRODUCT_ID);

    public static final List<String> INTEGER = List.of(
            USERS_ACTIVE, NEW_CUSTOMERS, PRODUCT_ID);

    private ReportColumns() {
    }
}
