package br.com.analytics.pipeline.marketing_preprocess_batch.processor;

import br.com.analytics.pipeline.marketing_preprocess_batch.model.RawRow;
import br.com.analytics.pipeline.marketing_preprocess_batch.model.ReportFormat;
import br.com.analytics.pipeline.marketing_preprocess_batch.model.StagedRecord;
import org.springframework.batch.infrastructure.item.ItemProcessor;

import java.util.List;

import static br.com.analytics.pipeline.marketing_preprocess_batch.model.ReportColumns.*;

public class UnpivotProcessor implements ItemProcessor<RawRow, List<StagedRecord>> {

    private final AdaptiveUnpivoter unpivoter;

    public UnpivotProcessor(AdaptiveUnpivoter unpivoter) {
        this.unpivoter = unpivoter;
    }

    @Override
    public List<StagedRecord> process(RawRow row) {
        if (row.isBlank()) {
            return null;
        }
        if (row.schema().format() == ReportFormat.WIDE) {
            return unpivoter.unpivot(row);
        }
        return List.of(StagedRecord.fromRow(row, row.value(REGION), row.value(REGIONAL_SALES), row.value(PRODUCT_ID)));
    }
}
