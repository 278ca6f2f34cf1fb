package br.com.analytics.pipeline.marketing_preprocess_batch.quality;

import br.com.analytics.pipeline.marketing_preprocess_batch.model.CellValue;
import br.com.analytics.pipeline.marketing_preprocess_batch.model.LongRecord;
import br.com.analytics.pipeline.marketing_preprocess_batch.model.RemediationCondition;
import br.com.analytics.pipeline.marketing_preprocess_batch.model.RemediationReport;
import br.com.analytics.pipeline.marketing_preprocess_batch.model.RemediationResult;
import br.com.analytics.pipeline.marketing_preprocess_batch.model.RemediationWarning;
import br.com.analytics.pipeline.marketing_preprocess_batch.model.StagedRecord;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static br.com.analytics.pipeline.marketing_preprocess_batch.model.ReportColumns.*;

/**
 * Detects, reports and repairs bad values of a long-format table, column by column.
 *
 * <p>Passes run in a fixed order: empty-table guard, date repair (unparseable rows are dropped),
 * region repair against the inferred vocabulary, numeric coercion, defaulting, and finally the
 * integer casts. Each pass returns a new list; every repair is recorded in the returned
 * {@link RemediationReport} and logged with a bounded sample of the affected rows.
 */
public class DataQualityRemediator {

    private static final Logger log = LoggerFactory.getLogger(DataQualityRemediator.class);

    static final BigDecimal DEFAULT_REGIONAL_SALES = BigDecimal.ZERO;
    static final String DEFAULT_PRODUCT_ID = "-1";
    static final String DEFAULT_COUNT = "0";

    private final int vocabularySize;
    private final String unknownRegion;
    private final int sampleSize;

    public DataQualityRemediator(int vocabularySize, String unknownRegion, int sampleSize) {
        this.vocabularySize = vocabularySize;
        this.unknownRegion = unknownRegion;
        this.sampleSize = sampleSize;
    }

    public RemediationResult remediate(List<StagedRecord> records) {
        List<RemediationWarning> warnings = new ArrayList<>();

        if (records.isEmpty()) {
            log.warn("Nothing to remediate: the table has no rows");
            warnings.add(new RemediationWarning(RemediationCondition.EMPTY_TABLE, "*", 0, List.of()));
            return new RemediationResult(List.of(), new RemediationReport(warnings));
        }

        List<StagedRecord> cleaned = repairDates(records, warnings);
        cleaned = repairRegions(cleaned, warnings);
        cleaned = repairNumerics(cleaned, warnings);
        cleaned = applyDefaults(cleaned);

        List<LongRecord> finalized = cleaned.stream().map(DataQualityRemediator::finalizeTypes).toList();
        log.info("Remediation complete: {} records kept out of {}, {} warnings",
                finalized.size(), records.size(), warnings.size());
        return new RemediationResult(finalized, new RemediationReport(warnings));
    }

    List<StagedRecord> repairDates(List<StagedRecord> records, List<RemediationWarning> warnings) {
        List<StagedRecord> kept = new ArrayList<>(records.size());
        List<StagedRecord> dropped = new ArrayList<>();

        for (StagedRecord record : records) {
            LocalDate date = LenientDateParser.parse(record.date());
            if (date == null) {
                dropped.add(record);
            } else {
                kept.add(record.with(DATE, date.toString()));
            }
        }

        if (!dropped.isEmpty()) {
            warn(warnings, RemediationCondition.UNPARSEABLE_DATE, DATE, dropped,
                    "rows with an unparseable date were dropped");
        }
        return kept;
    }

    List<StagedRecord> repairRegions(List<StagedRecord> records, List<RemediationWarning> warnings) {
        RegionVocabulary vocabulary = RegionVocabulary.infer(records, vocabularySize, unknownRegion);
        log.debug("Inferred region vocabulary: {}", vocabulary.regions());

        List<StagedRecord> repaired = new ArrayList<>(records.size());
        List<StagedRecord> affected = new ArrayList<>();

        for (StagedRecord record : records) {
            String region = record.region();
            if (!isMissing(region) && !vocabulary.accepts(region)) {
                affected.add(record);
                repaired.add(record.with(REGION, unknownRegion));
            } else {
                repaired.add(record);
            }
        }

        if (!affected.isEmpty()) {
            warn(warnings, RemediationCondition.UNRECOGNIZED_CATEGORY, REGION, affected,
                    "region values outside " + vocabulary.regions() + " were rewritten to '" + unknownRegion + "'");
        }
        return repaired;
    }

    List<StagedRecord> repairNumerics(List<StagedRecord> records, List<RemediationWarning> warnings) {
        List<StagedRecord> current = records;
        for (String column : NUMERIC) {
            boolean integer = INTEGER.contains(column);
            current = coerceColumn(current, column, integer ? DataQualityRemediator::coerceInteger : DataQualityRemediator::coerceDecimal, warnings);
        }
        return current;
    }

    private List<StagedRecord> coerceColumn(List<StagedRecord> records, String column,
                                            Function<String, @Nullable String> coercion,
                                            List<RemediationWarning> warnings) {
        List<StagedRecord> coerced = new ArrayList<>(records.size());
        List<StagedRecord> corrupted = new ArrayList<>();

        for (StagedRecord record : records) {
            String before = record.value(column);
            if (isMissing(before)) {
                coerced.add(record.with(column, null));
                continue;
            }
            String after = coercion.apply(before);
            if (after == null) {
                corrupted.add(record);
            }
            coerced.add(record.with(column, after));
        }

        if (!corrupted.isEmpty()) {
            warn(warnings, RemediationCondition.NON_NUMERIC_VALUE, column, corrupted,
                    "non-numeric values were coerced to missing");
        }
        return coerced;
    }

    List<StagedRecord> applyDefaults(List<StagedRecord> records) {
        return records.stream()
                .map(r -> new StagedRecord(
                        r.sourceLine(),
                        r.date(),
                        orDefault(r.usersActive(), DEFAULT_COUNT),
                        orDefault(r.totalSales(), DEFAULT_COUNT),
                        orDefault(r.newCustomers(), DEFAULT_COUNT),
                        orDefault(r.reportGenerated(), ""),
                        orDefault(r.region(), unknownRegion),
                        orDefault(r.regionalSales(), DEFAULT_REGIONAL_SALES.toPlainString()),
                        orDefault(r.productId(), DEFAULT_PRODUCT_ID)))
                .toList();
    }

    private void warn(List<RemediationWarning> warnings, RemediationCondition condition, String column,
                      List<StagedRecord> affected, String description) {
        List<StagedRecord> sample = affected.subList(0, Math.min(sampleSize, affected.size()));
        RemediationWarning warning = new RemediationWarning(condition, column, affected.size(), sample);
        warnings.add(warning);

        log.warn("{} in column '{}': {} {}", condition, column, affected.size(), description);
        for (StagedRecord record : warning.sample()) {
            log.warn("  sample: {}", record);
        }
    }

    private static @Nullable String coerceDecimal(String raw) {
        BigDecimal value = CellValue.parseNumber(raw);
        return value == null ? null : value.toPlainString();
    }

    private static @Nullable String coerceInteger(String raw) {
        BigDecimal value = CellValue.parseNumber(raw);
        if (value == null) {
            return null;
        }
        try {
            return Long.toString(value.setScale(0, RoundingMode.DOWN).longValueExact());
        } catch (ArithmeticException e) {
            return null;
        }
    }

    private static String orDefault(@Nullable String value, String fallback) {
        return isMissing(value) ? fallback : value;
    }

    private static boolean isMissing(@Nullable String value) {
        return value == null || value.isBlank();
    }

    private static LongRecord finalizeTypes(StagedRecord record) {
        return new LongRecord(
                LocalDate.parse(record.date()),
                Long.parseLong(record.usersActive()),
                new BigDecimal(record.totalSales()),
                Long.parseLong(record.newCustomers()),
                record.reportGenerated(),
                record.region(),
                new BigDecimal(record.regionalSales()),
                Long.parseLong(record.productId())
        );
    }
}
