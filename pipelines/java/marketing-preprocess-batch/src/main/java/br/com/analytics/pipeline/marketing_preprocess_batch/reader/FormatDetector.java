package br.com.analytics.pipeline.marketing_preprocess_batch.reader;

import br.com.analytics.pipeline.marketing_preprocess_batch.model.ReportFormat;

import java.util.List;

public class FormatDetector {

    private final String wideFormatSentinel;

    public FormatDetector(String wideFormatSentinel) {
        this.wideFormatSentinel = wideFormatSentinel;
    }

    public ReportFormat detect(List<String> columns) {
        return columns.contains(wideFormatSentinel) ? ReportFormat.WIDE : ReportFormat.LONG;
    }
}
