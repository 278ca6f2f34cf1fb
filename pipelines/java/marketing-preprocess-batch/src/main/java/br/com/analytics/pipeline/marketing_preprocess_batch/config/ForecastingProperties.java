package br.com.analytics.pipeline.marketing_preprocess_batch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "finmark.forecasting")
public record ForecastingProperties(
        @DefaultValue("false") boolean enabled,
        @DefaultValue("output/forecasting") String outputPath
) {
}
