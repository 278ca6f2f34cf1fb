package br.com.analytics.pipeline.marketing_preprocess_batch.exception;

import java.nio.file.Path;

public class InputNotFoundException extends PreprocessingException {

    private final Path input;

    public InputNotFoundException(Path input) {
        super("Input file not found: " + input);
        this.input = input;
    }

    public Path input() {
        return input;
    }
}
