package com.immowatch.backend.dedup.model;

import com.immowatch.backend.dedup.exception.ConfigurationException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Settings of one detection run. Unset values fall back to the defaults below.
 */
@Value
@Builder(toBuilder = true)
public class DetectionConfig {

    public static final double DEFAULT_THRESHOLD = 0.75;
    public static final double DEFAULT_PRICE_BUCKET = 10_000;
    public static final double DEFAULT_SURFACE_BUCKET = 5;
    public static final int DEFAULT_MAX_BLOCK_SIZE = 500;

    @Builder.Default
    double similarityThreshold = DEFAULT_THRESHOLD;

    @Builder.Default
    Map<SimilarityFeature, Double> featureWeights = defaultWeights();

    @Builder.Default
    double priceBucketSize = DEFAULT_PRICE_BUCKET;

    @Builder.Default
    double surfaceBucketSize = DEFAULT_SURFACE_BUCKET;

    @Builder.Default
    int maxBlockSize = DEFAULT_MAX_BLOCK_SIZE;

    @Builder.Default
    Map<String, String> cityAliases = Collections.emptyMap();

    // Relative tolerances used to call a price or surface a "match" in the evidence
    @Builder.Default
    double priceTolerance = 0.05;

    @Builder.Default
    double surfaceTolerance = 0.05;

    @Builder.Default
    double textMatchThreshold = 0.5;

    @Builder.Default
    boolean parallelScoring = false;

    public static DetectionConfig defaults() {
        return DetectionConfig.builder().build();
    }

    public static Map<SimilarityFeature, Double> defaultWeights() {
        Map<SimilarityFeature, Double> weights = new EnumMap<>(SimilarityFeature.class);
        for (SimilarityFeature feature : SimilarityFeature.values()) {
            weights.put(feature, feature.getDefaultWeight());
        }
        return Collections.unmodifiableMap(weights);
    }

    /**
     * Weight of a feature; features missing from the map weigh nothing.
     */
    public double weightOf(SimilarityFeature feature) {
        Double weight = featureWeights.get(feature);
        return weight == null ? 0.0 : weight;
    }

    public double totalWeight() {
        double sum = 0.0;
        for (SimilarityFeature feature : SimilarityFeature.values()) {
            sum += weightOf(feature);
        }
        return sum;
    }

    /**
     * Checks every setting, throwing on the first invalid one.
     *
     * @throws ConfigurationException when the run cannot start with these settings
     */
    public void validate() {
        if (Double.isNaN(similarityThreshold) || similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new ConfigurationException("similarity threshold must be within [0,1], got " + similarityThreshold);
        }
        if (featureWeights == null) {
            throw new ConfigurationException("feature weights must be provided");
        }
        for (Map.Entry<SimilarityFeature, Double> entry : featureWeights.entrySet()) {
            Double weight = entry.getValue();
            if (weight == null || weight.isNaN() || weight < 0.0) {
                throw new ConfigurationException("weight of " + entry.getKey().getKey() + " must be >= 0, got " + weight);
            }
        }
        if (totalWeight() <= 0.0) {
            throw new ConfigurationException("feature weights sum to zero");
        }
        if (!(priceBucketSize > 0)) {
            throw new ConfigurationException("price bucket size must be > 0, got " + priceBucketSize);
        }
        if (!(surfaceBucketSize > 0)) {
            throw new ConfigurationException("surface bucket size must be > 0, got " + surfaceBucketSize);
        }
        if (maxBlockSize <= 0) {
            throw new ConfigurationException("max block size must be > 0, got " + maxBlockSize);
        }
        checkFraction("price tolerance", priceTolerance);
        checkFraction("surface tolerance", surfaceTolerance);
        if (Double.isNaN(textMatchThreshold) || textMatchThreshold < 0.0 || textMatchThreshold > 1.0) {
            throw new ConfigurationException("text match threshold must be within [0,1], got " + textMatchThreshold);
        }
        if (cityAliases == null) {
            throw new ConfigurationException("city alias table must not be null");
        }
    }

    private static void checkFraction(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value >= 1.0) {
            throw new ConfigurationException(name + " must be within [0,1), got " + value);
        }
    }
}
