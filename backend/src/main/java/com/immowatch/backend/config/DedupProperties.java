package com.immowatch.backend.config;

import com.immowatch.backend.dedup.exception.ConfigurationException;
import com.immowatch.backend.dedup.model.DetectionConfig;
import com.immowatch.backend.dedup.model.SimilarityFeature;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Default settings of the duplicate detection runs, bound from the {@code dedup} section of application.yml.
 */
@Component
@ConfigurationProperties(prefix = "dedup")
@Data
public class DedupProperties {

    private double similarityThreshold = DetectionConfig.DEFAULT_THRESHOLD;

    // Keys: city, price, surface, rooms, text
    private Map<String, Double> featureWeights = new LinkedHashMap<>(Map.of(
            "city", 0.25,
            "price", 0.25,
            "surface", 0.25,
            "rooms", 0.10,
            "text", 0.15
    ));

    private double priceBucketSize = DetectionConfig.DEFAULT_PRICE_BUCKET;
    private double surfaceBucketSize = DetectionConfig.DEFAULT_SURFACE_BUCKET;
    private int maxBlockSize = DetectionConfig.DEFAULT_MAX_BLOCK_SIZE;

    // Raw spelling -> canonical spelling, e.g. "Paris 15ème" -> "Paris 15e"
    private Map<String, String> cityAliases = new LinkedHashMap<>();

    private double priceTolerance = 0.05;
    private double surfaceTolerance = 0.05;
    private double textMatchThreshold = 0.5;
    private boolean parallelScoring = false;

    public DetectionConfig toDetectionConfig() {
        return DetectionConfig.builder()
                .similarityThreshold(similarityThreshold)
                .featureWeights(parseWeights(featureWeights))
                .priceBucketSize(priceBucketSize)
                .surfaceBucketSize(surfaceBucketSize)
                .maxBlockSize(maxBlockSize)
                .cityAliases(Map.copyOf(cityAliases))
                .priceTolerance(priceTolerance)
                .surfaceTolerance(surfaceTolerance)
                .textMatchThreshold(textMatchThreshold)
                .parallelScoring(parallelScoring)
                .build();
    }

    /**
     * Maps "city"/"price"/... keys onto features. Unknown keys are a configuration error.
     */
    public static Map<SimilarityFeature, Double> parseWeights(Map<String, Double> raw) {
        Map<SimilarityFeature, Double> weights = new EnumMap<>(SimilarityFeature.class);
        if (raw == null) {
            return weights;
        }
        for (Map.Entry<String, Double> entry : raw.entrySet()) {
            SimilarityFeature feature = SimilarityFeature.fromKey(entry.getKey());
            if (feature == null) {
                throw new ConfigurationException("Unknown similarity feature '" + entry.getKey() + "'");
            }
            weights.put(feature, entry.getValue());
        }
        return weights;
    }
}
