package com.immowatch.backend.dedup.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-feature values behind a composite score. A {@code null} entry means the feature was
 * excluded because one side did not report it. City is never excluded.
 */
@Value
@Builder
public class FeatureBreakdown {
    boolean cityMatch;
    Double priceCloseness;
    Double surfaceCloseness;
    Boolean roomMatch;
    Double textSimilarity;

    /**
     * The value fed into the weighted sum for a feature, or {@code null} when excluded.
     */
    public Double valueOf(SimilarityFeature feature) {
        switch (feature) {
            case CITY:
                return cityMatch ? 1.0 : 0.0;
            case PRICE:
                return priceCloseness;
            case SURFACE:
                return surfaceCloseness;
            case ROOMS:
                return roomMatch == null ? null : (roomMatch ? 1.0 : 0.0);
            case TEXT:
                return textSimilarity;
            default:
                throw new IllegalArgumentException("Unknown feature " + feature);
        }
    }

    public boolean isIncluded(SimilarityFeature feature) {
        return valueOf(feature) != null;
    }
}
