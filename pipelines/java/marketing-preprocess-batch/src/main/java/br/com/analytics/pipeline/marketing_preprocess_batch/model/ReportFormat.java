package br.com.analytics.pipeline.marketing_preprocess_batch.model;

public enum ReportFormat {
    /** Repeating region/sales/product groups spread across {@code col_*} columns. */
    WIDE,
    /** One region per row in dedicated columns. */
    LONG
}
