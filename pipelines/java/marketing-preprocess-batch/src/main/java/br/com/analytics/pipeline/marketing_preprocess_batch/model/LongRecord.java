package br.com.analytics.pipeline.marketing_preprocess_batch.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record LongRecord(
        LocalDate date,
        Long usersActive,
        BigDecimal totalSales,
        Long newCustomers,
        String reportGenerated,
        String region,
        BigDecimal regionalSales,
        Long productId
) {
}
