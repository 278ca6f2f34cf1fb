package br.com.analytics.pipeline.marketing_preprocess_batch.writer;

import br.com.analytics.pipeline.marketing_preprocess_batch.model.StagedRecord;
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.batch.infrastructure.item.ItemWriter;

import java.util.List;

public class StagedRecordCollector implements ItemWriter<List<StagedRecord>> {

    private final StagingTable stagingTable;

    public StagedRecordCollector(StagingTable stagingTable) {
        this.stagingTable = stagingTable;
    }

    @Override
    public void write(Chunk<? extends List<StagedRecord>> chunk) {
        for (List<StagedRecord> records : chunk) {
            stagingTable.addAll(records);
        }
    }
}
