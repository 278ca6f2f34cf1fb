package br.com.analytics.pipeline.marketing_preprocess_batch.model;

import java.util.List;

public record RemediationWarning(
        RemediationCondition condition,
        String column,
        int affectedRows,
        List<StagedRecord> sample
) {

    public RemediationWarning {
        sample = List.copyOf(sample);
    }
}
