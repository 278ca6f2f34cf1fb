package br.com.analytics.pipeline.marketing_preprocess_batch.writer;

import br.com.analytics.pipeline.marketing_preprocess_batch.model.StagedRecord;

import java.util.ArrayList;
import java.util.List;

public class StagingTable {

    private final List<StagedRecord> records = new ArrayList<>();

    public void addAll(List<StagedRecord> batch) {
        records.addAll(batch);
    }

    public List<StagedRecord> snapshot() {
        return List.copyOf(records);
    }
}
