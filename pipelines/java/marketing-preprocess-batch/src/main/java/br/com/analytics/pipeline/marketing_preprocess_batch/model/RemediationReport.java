package br.com.analytics.pipeline.marketing_preprocess_batch.model;

import java.util.List;

public record RemediationReport(
        List<RemediationWarning> warnings
) {

    public RemediationReport {
        warnings = List.copyOf(warnings);
    }

    public boolean isEmpty() {
        return warnings.isEmpty();
    }

    public int totalAffectedRows() {
        return warnings.stream().mapToInt(RemediationWarning::affectedRows).sum();
    }
}
