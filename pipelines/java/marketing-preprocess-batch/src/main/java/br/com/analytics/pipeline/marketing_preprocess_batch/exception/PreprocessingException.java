package br.com.analytics.pipeline.marketing_preprocess_batch.exception;

public class PreprocessingException extends RuntimeException {

    public PreprocessingException(String message) {
        super(message);
    }

    public PreprocessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
