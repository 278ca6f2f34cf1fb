package br.com.analytics.pipeline.marketing_preprocess_batch.model;

public enum RemediationCondition {
    EMPTY_TABLE,
    UNPARSEABLE_DATE,
    UNRECOGNIZED_CATEGORY,
    NON_NUMERIC_VALUE
}
