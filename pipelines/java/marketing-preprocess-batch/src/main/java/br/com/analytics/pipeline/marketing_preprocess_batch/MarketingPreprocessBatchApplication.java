package br.com.analytics.pipeline.marketing_preprocess_batch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MarketingPreprocessBatchApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(MarketingPreprocessBatchApplication.class, args)));
    }
}
