package br.com.analytics.pipeline.marketing_preprocess_batch.writer;

import br.com.analytics.pipeline.marketing_preprocess_batch.model.DailySales;
import org.springframework.batch.infrastructure.item.file.transform.FieldExtractor;

import java.util.List;

public class DailySalesWriter extends CsvFileWriter<DailySales> {

    @Override
    protected List<String> header() {
        return List.of("ds", "y");
    }

    @Override
    protected FieldExtractor<DailySales> fieldExtractor() {
        return s -> new Object[]{s.ds(), s.y()};
    }
}
