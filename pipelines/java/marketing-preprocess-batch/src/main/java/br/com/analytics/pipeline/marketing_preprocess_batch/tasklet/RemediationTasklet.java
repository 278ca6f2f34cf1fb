package br.com.analytics.pipeline.marketing_preprocess_batch.tasklet;

import br.com.analytics.pipeline.marketing_preprocess_batch.model.RemediationResult;
import br.com.analytics.pipeline.marketing_preprocess_batch.model.StagedRecord;
import br.com.analytics.pipeline.marketing_preprocess_batch.quality.DataQualityRemediator;
import br.com.analytics.pipeline.marketing_preprocess_batch.writer.ResultWriter;
import br.com.analytics.pipeline.marketing_preprocess_batch.writer.StagingTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.item.ExecutionContext;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

import java.nio.file.Path;
import java.util.List;

public class RemediationTasklet implements Tasklet {

    private static final Logger log = LoggerFactory.getLogger(RemediationTasklet.class);

    public static final String OUTPUT_FILE_PARAMETER = "output.file";
    public static final String WARNINGS_KEY = "remediation.warnings";
    public static final String RECORDS_KEY = "remediation.records";

    private final StagingTable stagingTable;
    private final DataQualityRemediator remediator;
    private final ResultWriter resultWriter;

    public RemediationTasklet(StagingTable stagingTable, DataQualityRemediator remediator, ResultWriter resultWriter) {
        this.stagingTable = stagingTable;
        this.remediator = remediator;
        this.resultWriter = resultWriter;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        String outputFile = contribution.getStepExecution().getJobParameters().getString(OUTPUT_FILE_PARAMETER);
        if (outputFile == null) {
            throw new IllegalStateException("Missing job parameter '" + OUTPUT_FILE_PARAMETER + "'");
        }

        List<StagedRecord> staged = stagingTable.snapshot();
        log.info("Starting remediation of {} unpivoted records", staged.size());

        RemediationResult result = remediator.remediate(staged);

        int written = resultWriter.write(result.records(), Path.of(outputFile));
        contribution.incrementWriteCount(written);

        ExecutionContext executionContext = contribution.getStepExecution().getExecutionContext();
        executionContext.putInt(WARNINGS_KEY, result.report().warnings().size());
        executionContext.putInt(RECORDS_KEY, written);

        if (result.report().isEmpty()) {
            log.info("Wrote {} cleaned records to {}, no repairs needed", written, outputFile);
        } else {
            log.info("Wrote {} cleaned records to {} ({} rows touched by {} repairs)",
                    written, outputFile, result.report().totalAffectedRows(), result.report().warnings().size());
        }
        return RepeatStatus.FINISHED;
    }
}
