package br.com.analytics.pipeline.marketing_preprocess_batch.launcher;

import br.com.analytics.pipeline.marketing_preprocess_batch.exception.InputNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
@ConditionalOnProperty(name = "finmark.cli.enabled", havingValue = "true", matchIfMissing = true)
public class PreprocessingCommandLineRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(PreprocessingCommandLineRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final PreprocessingLauncher launcher;

    private int exitCode = EXIT_OK;

    public PreprocessingCommandLineRunner(PreprocessingLauncher launcher) {
        this.launcher = launcher;
    }

    @Override
    public void run(String... args) {
        if (args.length < 2) {
            log.error("Usage: marketing-preprocess-batch <input-file> <output-file>");
            exitCode = EXIT_USAGE;
            return;
        }

        try {
            launcher.run(Path.of(args[0]), Path.of(args[1]));
            exitCode = EXIT_OK;
        } catch (InputNotFoundException e) {
            log.error("Error: the file was not found at {}", e.input());
            exitCode = EXIT_FAILURE;
        } catch (RuntimeException e) {
            log.error("An unexpected error occurred: {}", e.getMessage(), e);
            exitCode = EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
