package br.com.analytics.pipeline.marketing_preprocess_batch.tasklet;

import br.com.analytics.pipeline.marketing_preprocess_batch.model.DailySales;
import br.com.analytics.pipeline.marketing_preprocess_batch.model.LongRecord;
import br.com.analytics.pipeline.marketing_preprocess_batch.model.ReportColumns;
import br.com.analytics.pipeline.marketing_preprocess_batch.processor.DailySalesAggregator;
import br.com.analytics.pipeline.marketing_preprocess_batch.reader.LongRecordFieldSetMapper;
import br.com.analytics.pipeline.marketing_preprocess_batch.writer.DailySalesWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.item.ExecutionContext;
import org.springframework.batch.infrastructure.item.file.FlatFileItemReader;
import org.springframework.batch.infrastructure.item.file.builder.FlatFileItemReaderBuilder;
import org.springframework.batch.infrastructure.item.file.separator.DefaultRecordSeparatorPolicy;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;
import org.springframework.core.io.FileSystemResource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class DailySalesExportTasklet implements Tasklet {

    private static final Logger log = LoggerFactory.getLogger(DailySalesExportTasklet.class);

    static final String DAILY_SALES_FILE = "daily_sales.csv";

    private final DailySalesAggregator aggregator;
    private final DailySalesWriter writer;
    private final Path outputDirectory;

    public DailySalesExportTasklet(DailySalesAggregator aggregator, DailySalesWriter writer, Path outputDirectory) {
        this.aggregator = aggregator;
        this.writer = writer;
        this.outputDirectory = outputDirectory;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        String processedFile = contribution.getStepExecution().getJobParameters()
                .getString(RemediationTasklet.OUTPUT_FILE_PARAMETER);
        if (processedFile == null) {
            throw new IllegalStateException("Missing job parameter '" + RemediationTasklet.OUTPUT_FILE_PARAMETER + "'");
        }

        List<LongRecord> records = readProcessed(Path.of(processedFile));
        List<DailySales> series = aggregator.aggregate(records);

        Path destination = outputDirectory.resolve(DAILY_SALES_FILE);
        int written = writer.write(series, destination);
        contribution.incrementWriteCount(written);

        log.info("Daily sales series of {} points written to {}", written, destination);
        return RepeatStatus.FINISHED;
    }

    private List<LongRecord> readProcessed(Path processedFile) throws Exception {
        FlatFileItemReader<LongRecord> reader = new FlatFileItemReaderBuilder<LongRecord>()
                .name("processedRecordReader")
                .resource(new FileSystemResource(processedFile))
                .linesToSkip(1)
                .recordSeparatorPolicy(new DefaultRecordSeparatorPolicy())
                .delimited()
                .names(ReportColumns.OUTPUT.toArray(String[]::new))
                .fieldSetMapper(new LongRecordFieldSetMapper())
                .saveState(false)
                .build();

        List<LongRecord> records = new ArrayList<>();
        reader.open(new ExecutionContext());
        try {
            LongRecord record;
            while ((record = reader.read()) != null) {
                records.add(record);
            }
        } finally {
            reader.close();
        }
        return records;
    }
}
