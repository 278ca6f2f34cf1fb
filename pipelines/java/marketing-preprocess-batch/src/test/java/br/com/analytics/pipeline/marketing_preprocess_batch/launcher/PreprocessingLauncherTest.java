package br.com.analytics.pipeline.marketing_preprocess_batch.launcher;

import br.com.analytics.pipeline.marketing_preprocess_batch.exception.InputNotFoundException;
import br.com.analytics.pipeline.marketing_preprocess_batch.exception.PreprocessingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.JobExecution;
import org.springframework.batch.core.job.parameters.JobParameters;
import org.springframework.batch.core.launch.JobOperator;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PreprocessingLauncherTest {

    @Mock
    private JobOperator jobOperator;

    @Mock
    private Job job;

    @TempDir
    Path tempDir;

    private PreprocessingLauncher launcher;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(job.getName()).thenReturn("marketingPreprocessJob");
        launcher = new PreprocessingLauncher(jobOperator, job);
    }

    @Test
    void missingInputIsReportedWithoutLaunching() {
        Path missing = tempDir.resolve("does-not-exist.csv");

        InputNotFoundException e = assertThrows(InputNotFoundException.class,
                () -> launcher.run(missing, tempDir.resolve("out.csv")));

        assertEquals(missing, e.input());
        verifyNoInteractions(jobOperator);
    }

    @Test
    void launchesWithFileParameters() throws Exception {
        Path input = Files.writeString(tempDir.resolve("in.csv"), "date\n");
        Path output = tempDir.resolve("out.csv");
        JobExecution execution = mock(JobExecution.class);
        when(execution.getStatus()).thenReturn(BatchStatus.COMPLETED);
        when(jobOperator.start(eq(job), any(JobParameters.class))).thenReturn(execution);

        assertSame(execution, launcher.run(input, output));

        ArgumentCaptor<JobParameters> parameters = ArgumentCaptor.forClass(JobParameters.class);
        verify(jobOperator).start(eq(job), parameters.capture());
        assertEquals(input.toAbsolutePath().toString(), parameters.getValue().getString("input.file"));
        assertEquals(output.toAbsolutePath().toString(), parameters.getValue().getString("output.file"));
    }

    @Test
    void failedExecutionBecomesPreprocessingException() throws Exception {
        Path input = Files.writeString(tempDir.resolve("in.csv"), "date\n");
        JobExecution execution = mock(JobExecution.class);
        when(execution.getStatus()).thenReturn(BatchStatus.FAILED);
        when(execution.getAllFailureExceptions()).thenReturn(List.of(new IllegalStateException("disk full")));
        when(jobOperator.start(eq(job), any(JobParameters.class))).thenReturn(execution);

        PreprocessingException e = assertThrows(PreprocessingException.class,
                () -> launcher.run(input, tempDir.resolve("out.csv")));

        assertTrue(e.getMessage().contains("disk full"));
    }

    @Test
    void launchFailureIsWrapped() throws Exception {
        Path input = Files.writeString(tempDir.resolve("in.csv"), "date\n");
        when(jobOperator.start(eq(job), any(JobParameters.class)))
                .thenThrow(new IllegalStateException("repository unavailable"));

        PreprocessingException e = assertThrows(PreprocessingException.class,
                () -> launcher.run(input, tempDir.resolve("out.csv")));

        assertTrue(e.getMessage().contains("repository unavailable"));
    }
}
