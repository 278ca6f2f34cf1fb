package br.com.analytics.pipeline.marketing_preprocess_batch.model;

import java.util.List;

public record RemediationResult(
        List<LongRecord> records,
        RemediationReport report
) {

    public RemediationResult {
        records = List.copyOf(records);
    }
}
