package br.com.analytics.pipeline.marketing_preprocess_batch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "finmark.preprocessing")
public record PreprocessingProperties(
        @DefaultValue("col_") String groupColumnPrefix,
        @DefaultValue("col_6") String wideFormatSentinel,
        @DefaultValue("4") int vocabularySize,
        @DefaultValue("Unknown") String unknownRegion,
        @DefaultValue("10") int sampleSize,
        @DefaultValue("500") int chunkSize
) {
}
