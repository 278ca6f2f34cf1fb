package br.com.analytics.pipeline.marketing_preprocess_batch;

import br.com.analytics.pipeline.marketing_preprocess_batch.tasklet.RemediationTasklet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.JobExecution;
import org.springframework.batch.core.job.parameters.JobParameters;
import org.springframework.batch.core.job.parameters.JobParametersBuilder;
import org.springframework.batch.core.launch.JobOperator;
import org.springframework.batch.core.step.StepExecution;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(
        classes = MarketingPreprocessBatchApplication.class,
        properties = {
                "finmark.cli.enabled=false",
                "finmark.forecasting.enabled=true"
        })
class MarketingPreprocessJobTest {

    private static final String WIDE_HEADER =
            "date,users_active,total_sales,new_customers,report_generated,col_1,col_2,col_3,col_4,col_5,col_6";
    private static final String OUTPUT_HEADER =
            "date,users_active,total_sales,new_customers,report_generated,region,regional_sales,product_id";

    private static final AtomicLong RUN_ID = new AtomicLong();

    @TempDir
    static Path forecastingDir;

    @DynamicPropertySource
    static void forecastingOutput(DynamicPropertyRegistry registry) {
        registry.add("finmark.forecasting.output-path", () -> forecastingDir.toString());
    }

    @Autowired
    private JobOperator jobOperator;

    @Autowired
    private Job marketingPreprocessJob;

    @TempDir
    Path tempDir;

    @Test
    void wideReportIsUnpivotedRemediatedAndWritten() throws Exception {
        Path input = write("marketing_summary.csv",
                WIDE_HEADER,
                "2024-01-01,10,500,2,True,East,100,5,West,200,6",
                "2024-01-02,12,600,3,True,East,,5,North,150,7",
                "not-a-date,1,1,1,True,East,1,1,,,",
                "2024-01-03,15,N/A,4,False,South,300,8,Atlantis,50,9");
        Path output = tempDir.resolve("processed/marketing_summary_cleaned.csv");

        JobExecution execution = launch(input, output);

        assertEquals(BatchStatus.COMPLETED, execution.getStatus());
        assertEquals(List.of(
                OUTPUT_HEADER,
                "2024-01-01,10,500,2,True,East,100,5",
                "2024-01-01,10,500,2,True,West,200,6",
                "2024-01-02,12,600,3,True,East,0,5",
                "2024-01-02,12,600,3,True,North,150,7",
                "2024-01-03,15,0,4,False,South,300,8",
                "2024-01-03,15,0,4,False,Unknown,50,9"), Files.readAllLines(output));

        StepExecution remediation = step(execution, "remediationStep");
        assertEquals(3, remediation.getExecutionContext().getInt(RemediationTasklet.WARNINGS_KEY));
        assertEquals(6, remediation.getExecutionContext().getInt(RemediationTasklet.RECORDS_KEY));
        assertEquals(4, step(execution, "unpivotStep").getReadCount());

        assertEquals(List.of("ds,y", "2024-01-01,500", "2024-01-02,600", "2024-01-03,0"),
                Files.readAllLines(forecastingDir.resolve("daily_sales.csv")));
    }

    @Test
    void processedOutputRunsThroughUnchanged() throws Exception {
        Path input = write("marketing_summary.csv",
                WIDE_HEADER,
                "2024-01-01,10,500,2,True,East,100,5,West,200,6",
                "2024-01-02,12,abc,3,True,\"North, Upper\",150,7,,,");
        Path first = tempDir.resolve("first.csv");
        Path second = tempDir.resolve("second.csv");

        assertEquals(BatchStatus.COMPLETED, launch(input, first).getStatus());
        JobExecution rerun = launch(first, second);

        assertEquals(BatchStatus.COMPLETED, rerun.getStatus());
        assertEquals(Files.readString(first), Files.readString(second));
        assertTrue(Files.readString(first).contains("\"North, Upper\""));
        assertEquals(0, step(rerun, "remediationStep").getExecutionContext().getInt(RemediationTasklet.WARNINGS_KEY));
    }

    @Test
    void missingIdentifyingColumnIsDefaulted() throws Exception {
        Path input = write("no_users.csv",
                "date,total_sales,new_customers,report_generated,col_1,col_2,col_3,col_4,col_5,col_6",
                "2024-01-01,500,2,True,East,100,5,,,");
        Path output = tempDir.resolve("out.csv");

        assertEquals(BatchStatus.COMPLETED, launch(input, output).getStatus());
        assertEquals(List.of(OUTPUT_HEADER, "2024-01-01,0,500,2,True,East,100,5"), Files.readAllLines(output));
    }

    @Test
    void headerOnlyReportProducesHeaderOnlyOutput() throws Exception {
        Path input = write("empty.csv", WIDE_HEADER);
        Path output = tempDir.resolve("out.csv");

        JobExecution execution = launch(input, output);

        assertEquals(BatchStatus.COMPLETED, execution.getStatus());
        assertEquals(List.of(OUTPUT_HEADER), Files.readAllLines(output));
        assertEquals(1, step(execution, "remediationStep").getExecutionContext().getInt(RemediationTasklet.WARNINGS_KEY));
    }

    private JobExecution launch(Path input, Path output) throws Exception {
        JobParameters parameters = new JobParametersBuilder()
                .addLong("run.id", RUN_ID.incrementAndGet())
                .addString("input.file", input.toString())
                .addString("output.file", output.toString())
                .toJobParameters();
        return jobOperator.start(marketingPreprocessJob, parameters);
    }

    private Path write(String name, String... lines) throws Exception {
        return Files.write(tempDir.resolve(name), List.of(lines));
    }

    private static StepExecution step(JobExecution execution, String name) {
        return execution.getStepExecutions().stream()
                .filter(s -> s.getStepName().equals(name))
                .findFirst()
                .orElseThrow();
    }
}
