package br.com.analytics.pipeline.marketing_preprocess_batch.processor;

import br.com.analytics.pipeline.marketing_preprocess_batch.model.DailySales;
import br.com.analytics.pipeline.marketing_preprocess_batch.model.LongRecord;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class DailySalesAggregator {

    public List<DailySales> aggregate(List<LongRecord> records) {
        Map<LocalDate, BigDecimal> aggregatedData = new TreeMap<>();
        for (LongRecord record : records) {
            aggregatedData.putIfAbsent(record.date(), record.totalSales());
        }
        return aggregatedData.entrySet().stream()
                .map(e -> new DailySales(e.getKey(), e.getValue()))
                .toList();
    }
}
