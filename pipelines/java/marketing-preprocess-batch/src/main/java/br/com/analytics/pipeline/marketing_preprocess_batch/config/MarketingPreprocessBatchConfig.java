package br.com.analytics.pipeline.marketing_preprocess_batch.config;

import br.com.analytics.pipeline.marketing_preprocess_batch.model.RawRow;
import br.com.analytics.pipeline.marketing_preprocess_batch.model.StagedRecord;
import br.com.analytics.pipeline.marketing_preprocess_batch.processor.AdaptiveUnpivoter;
import br.com.analytics.pipeline.marketing_preprocess_batch.processor.DailySalesAggregator;
import br.com.analytics.pipeline.marketing_preprocess_batch.processor.UnpivotProcessor;
import br.com.analytics.pipeline.marketing_preprocess_batch.quality.DataQualityRemediator;
import br.com.analytics.pipeline.marketing_preprocess_batch.reader.FormatDetector;
import br.com.analytics.pipeline.marketing_preprocess_batch.reader.RawReportLineMapper;
import br.com.analytics.pipeline.marketing_preprocess_batch.reader.SchemaValidator;
import br.com.analytics.pipeline.marketing_preprocess_batch.tasklet.DailySalesExportTasklet;
import br.com.analytics.pipeline.marketing_preprocess_batch.tasklet.RemediationTasklet;
import br.com.analytics.pipeline.marketing_preprocess_batch.writer.DailySalesWriter;
import br.com.analytics.pipeline.marketing_preprocess_batch.writer.ResultWriter;
import br.com.analytics.pipeline.marketing_preprocess_batch.writer.StagedRecordCollector;
import br.com.analytics.pipeline.marketing_preprocess_batch.writer.StagingTable;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.step.Step;
import org.springframework.batch.core.configuration.annotation.JobScope;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.job.builder.SimpleJobBuilder;
import org.springframework.batch.core.job.parameters.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.infrastructure.item.ItemProcessor;
import org.springframework.batch.infrastructure.item.ItemWriter;
import org.springframework.batch.infrastructure.item.file.FlatFileItemReader;
import org.springframework.batch.infrastructure.item.file.builder.FlatFileItemReaderBuilder;
import org.springframework.batch.infrastructure.item.file.separator.DefaultRecordSeparatorPolicy;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.FileSystemResource;
import org.springframework.transaction.PlatformTransactionManager;

import java.nio.file.Path;
import java.util.List;

@Configuration
@EnableConfigurationProperties({PreprocessingProperties.class, ForecastingProperties.class})
public class MarketingPreprocessBatchConfig {

    public static final String JOB_NAME = "marketingPreprocessJob";
    public static final String INPUT_FILE_PARAMETER = "input.file";

    private final JobRepository jobRepository;
    private final PlatformTransactionManager transactionManager;
    private final PreprocessingProperties properties;

    public MarketingPreprocessBatchConfig(JobRepository jobRepository, PlatformTransactionManager transactionManager,
                                          PreprocessingProperties properties) {
        this.jobRepository = jobRepository;
        this.transactionManager = transactionManager;
        this.properties = properties;
    }

    @Bean
    public SchemaValidator schemaValidator() {
        return new SchemaValidator();
    }

    @Bean
    public FormatDetector formatDetector() {
        return new FormatDetector(properties.wideFormatSentinel());
    }

    @Bean
    @StepScope
    public FlatFileItemReader<RawRow> rawRowReader(
            @Value("#{jobParameters['" + INPUT_FILE_PARAMETER + "']}") String inputFile,
            SchemaValidator schemaValidator,
            FormatDetector formatDetector
    ) {
        RawReportLineMapper lineMapper =
                new RawReportLineMapper(schemaValidator, formatDetector, properties.groupColumnPrefix());

        return new FlatFileItemReaderBuilder<RawRow>()
                .name("rawRowReader")
                .resource(new FileSystemResource(inputFile))
                .encoding("UTF-8")
                .linesToSkip(1)
                .skippedLinesCallback(lineMapper)
                .recordSeparatorPolicy(new DefaultRecordSeparatorPolicy())
                .lineMapper(lineMapper)
                .build();
    }

    @Bean
    public AdaptiveUnpivoter adaptiveUnpivoter() {
        return new AdaptiveUnpivoter();
    }

    @Bean
    public ItemProcessor<RawRow, List<StagedRecord>> unpivotProcessor(AdaptiveUnpivoter adaptiveUnpivoter) {
        return new UnpivotProcessor(adaptiveUnpivoter);
    }

    @Bean
    @JobScope
    public StagingTable stagingTable() {
        return new StagingTable();
    }

    @Bean
    public ItemWriter<List<StagedRecord>> stagedRecordCollector(StagingTable stagingTable) {
        return new StagedRecordCollector(stagingTable);
    }

    @Bean
    public DataQualityRemediator dataQualityRemediator() {
        return new DataQualityRemediator(properties.vocabularySize(), properties.unknownRegion(), properties.sampleSize());
    }

    @Bean
    public ResultWriter resultWriter() {
        return new ResultWriter();
    }

    @Bean
    public RemediationTasklet remediationTasklet(StagingTable stagingTable, DataQualityRemediator dataQualityRemediator,
                                                 ResultWriter resultWriter) {
        return new RemediationTasklet(stagingTable, dataQualityRemediator, resultWriter);
    }

    @Bean
    public DailySalesExportTasklet dailySalesExportTasklet(ForecastingProperties forecastingProperties) {
        return new DailySalesExportTasklet(new DailySalesAggregator(), new DailySalesWriter(),
                Path.of(forecastingProperties.outputPath()));
    }

    @Bean
    public Step unpivotStep(
            FlatFileItemReader<RawRow> reader,
            ItemProcessor<RawRow, List<StagedRecord>> processor,
            ItemWriter<List<StagedRecord>> writer
    ) {
        return new StepBuilder("unpivotStep", jobRepository)
                .<RawRow, List<StagedRecord>>chunk(properties.chunkSize())
                .transactionManager(transactionManager)
                .reader(reader)
                .processor(processor)
                .writer(writer)
                .build();
    }

    @Bean
    public Step remediationStep(RemediationTasklet remediationTasklet) {
        return new StepBuilder("remediationStep", jobRepository)
                .tasklet(remediationTasklet, transactionManager)
                .build();
    }

    @Bean
    public Step dailySalesStep(DailySalesExportTasklet dailySalesExportTasklet) {
        return new StepBuilder("dailySalesStep", jobRepository)
                .tasklet(dailySalesExportTasklet, transactionManager)
                .build();
    }

    @Bean
    public Job marketingPreprocessJob(
            @Qualifier("unpivotStep") Step unpivotStep,
            @Qualifier("remediationStep") Step remediationStep,
            @Qualifier("dailySalesStep") Step dailySalesStep,
            ForecastingProperties forecastingProperties
    ) {
        SimpleJobBuilder builder = new JobBuilder(JOB_NAME, jobRepository)
                .incrementer(new RunIdIncrementer())
                .start(unpivotStep)
                .next(remediationStep);
        if (forecastingProperties.enabled()) {
            builder = builder.next(dailySalesStep);
        }
        return builder.build();
    }
}
