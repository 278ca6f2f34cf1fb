package br.com.analytics.pipeline.marketing_preprocess_batch.reader;

import br.com.analytics.pipeline.marketing_preprocess_batch.model.ReportFormat;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormatDetectorTest {

    private final FormatDetector detector = new FormatDetector("col_6");

    @Test
    void sentinelColumnMeansWide() {
        assertEquals(ReportFormat.WIDE,
                detector.detect(List.of("date", "col_1", "col_2", "col_3", "col_4", "col_5", "col_6", "col_7")));
    }

    @Test
    void withoutSentinelTheReportIsLong() {
        assertEquals(ReportFormat.LONG, detector.detect(List.of("date", "region", "regional_sales", "product_id")));
        assertEquals(ReportFormat.LONG, detector.detect(List.of("date", "col_1", "col_2", "col_3")));
    }
}
