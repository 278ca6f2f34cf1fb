package br.com.analytics.pipeline.marketing_preprocess_batch.reader;

import br.com.analytics.pipeline.marketing_preprocess_batch.model.LongRecord;
import org.springframework.batch.infrastructure.item.file.mapping.FieldSetMapper;
import org.springframework.batch.infrastructure.item.file.transform.FieldSet;

import java.time.LocalDate;

import static br.com.analytics.pipeline.marketing_preprocess_batch.model.ReportColumns.*;

public class LongRecordFieldSetMapper implements FieldSetMapper<LongRecord> {

    @Override
    public LongRecord mapFieldSet(FieldSet fieldSet) {
        return new LongRecord(
                LocalDate.parse(fieldSet.readString(DATE)),
                fieldSet.readLong(USERS_ACTIVE),
                fieldSet.readBigDecimal(TOTAL_SALES),
                fieldSet.readLong(NEW_CUSTOMERS),
                fieldSet.readString(REPORT_GENERATED),
                fieldSet.readString(REGION),
                fieldSet.readBigDecimal(REGIONAL_SALES),
                fieldSet.readLong(PRODUCT_ID)
        );
    }
}
