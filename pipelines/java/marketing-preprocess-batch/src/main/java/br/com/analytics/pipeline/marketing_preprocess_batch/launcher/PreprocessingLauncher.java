package br.com.analytics.pipeline.marketing_preprocess_batch.launcher;

import br.com.analytics.pipeline.marketing_preprocess_batch.config.MarketingPreprocessBatchConfig;
import br.com.analytics.pipeline.marketing_preprocess_batch.exception.InputNotFoundException;
import br.com.analytics.pipeline.marketing_preprocess_batch.exception.PreprocessingException;
import br.com.analytics.pipeline.marketing_preprocess_batch.tasklet.RemediationTasklet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.JobExecution;
import org.springframework.batch.core.job.parameters.JobParameters;
import org.springframework.batch.core.job.parameters.JobParametersBuilder;
import org.springframework.batch.core.launch.JobOperator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

@Component
public class PreprocessingLauncher {

    private static final Logger log = LoggerFactory.getLogger(PreprocessingLauncher.class);

    static final String RUN_TIMESTAMP_PARAMETER = "run.timestamp";

    private final JobOperator jobOperator;
    private final Job marketingPreprocessJob;

    public PreprocessingLauncher(JobOperator jobOperator, Job marketingPreprocessJob) {
        this.jobOperator = jobOperator;
        this.marketingPreprocessJob = marketingPreprocessJob;
    }

    public JobExecution run(Path input, Path output) {
        if (!Files.isRegularFile(input)) {
            throw new InputNotFoundException(input);
        }

        JobParameters parameters = new JobParametersBuilder()
                .addString(MarketingPreprocessBatchConfig.INPUT_FILE_PARAMETER, input.toAbsolutePath().toString())
                .addString(RemediationTasklet.OUTPUT_FILE_PARAMETER, output.toAbsolutePath().toString())
                .addLocalDateTime(RUN_TIMESTAMP_PARAMETER, LocalDateTime.now())
                .toJobParameters();

        log.info("Starting {} for {} -> {}", marketingPreprocessJob.getName(), input, output);

        JobExecution execution;
        try {
            execution = jobOperator.start(marketingPreprocessJob, parameters);
        } catch (Exception e) {
            throw new PreprocessingException("Could not launch " + marketingPreprocessJob.getName() + ": " + e.getMessage(), e);
        }

        if (execution.getStatus() != BatchStatus.COMPLETED) {
            String cause = execution.getAllFailureExceptions().stream()
                    .map(Throwable::getMessage)
                    .findFirst()
                    .orElse(execution.getExitStatus().getExitDescription());
            throw new PreprocessingException(marketingPreprocessJob.getName() + " finished with status "
                    + execution.getStatus() + ": " + cause);
        }

        log.info("{} completed", marketingPreprocessJob.getName());
        return execution;
    }
}
