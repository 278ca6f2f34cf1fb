package br.com.analytics.pipeline.marketing_preprocess_batch.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record DailySales(
        LocalDate ds,
        BigDecimal y
) {
}
