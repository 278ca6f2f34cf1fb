package br.com.analytics.pipeline.marketing_preprocess_batch.quality;

import br.com.analytics.pipeline.marketing_preprocess_batch.model.StagedRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class RegionVocabulary {

    private final Set<String> regions;
    private final String unknownRegion;

    private RegionVocabulary(Set<String> regions, String unknownRegion) {
        this.regions = regions;
        this.unknownRegion = unknownRegion;
    }

    public static RegionVocabulary infer(List<StagedRecord> records, int size, String unknownRegion) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (StagedRecord record : records) {
            String region = record.region();
            if (region != null && !region.isBlank() && !region.equals(unknownRegion)) {
                counts.merge(region, 1, Integer::sum);
            }
        }

        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(counts.entrySet());
        ranked.sort(Map.Entry.<String, Integer>comparingByValue().reversed());

        Set<String> regions = new LinkedHashSet<>();
        for (Map.Entry<String, Integer> entry : ranked.subList(0, Math.min(size, ranked.size()))) {
            regions.add(entry.getKey());
        }
        return new RegionVocabulary(regions, unknownRegion);
    }

    public boolean accepts(String region) {
        return regions.contains(region) || region.equals(unknownRegion);
    }

    /** Trusted regions, most frequent first. */
    public List<String> regions() {
        return List.copyOf(regions);
    }
}
