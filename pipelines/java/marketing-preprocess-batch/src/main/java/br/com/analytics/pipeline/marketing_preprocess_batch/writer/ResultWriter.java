package br.com.analytics.pipeline.marketing_preprocess_batch.writer;

import br.com.analytics.pipeline.marketing_preprocess_batch.model.LongRecord;
import br.com.analytics.pipeline.marketing_preprocess_batch.model.ReportColumns;
import org.springframework.batch.infrastructure.item.file.transform.FieldExtractor;

import java.util.List;

public class ResultWriter extends CsvFileWriter<LongRecord> {

    @Override
    protected List<String> header() {
        return ReportColumns.OUTPUT;
    }

    @Override
    protected FieldExtractor<LongRecord> fieldExtractor() {
        return r -> new Object[]{
                r.date(),
                r.usersActive(),
                r.totalSales(),
                r.newCustomers(),
                r.reportGenerated(),
                r.region(),
                r.regionalSales(),
                r.productId()
        };
    }
}
