package com.immowatch.backend.dedup.model;

import lombok.Getter;

@Getter
public enum SimilarityFeature {
    CITY("city", 0.25),
    PRICE("price", 0.25),
    SURFACE("surface", 0.25),
    ROOMS("rooms", 0.10),
    TEXT("text", 0.15);

    private final String key;
    private final double defaultWeight;

    SimilarityFeature(String key, double defaultWeight) {
        this.key = key;
        this.defaultWeight = defaultWeight;
    }

    /**
     * Resolve a feature from its configuration key ("city", "price", ...) or enum name.
     */
    public static SimilarityFeature fromKey(String key) {
        if (key == null) return null;
        String normalized = key.trim().toLowerCase();
        for (SimilarityFeature feature : values()) {
            if (feature.key.equals(normalized) || feature.name().equalsIgnoreCase(normalized)) {
                return feature;
            }
        }
        return null;
    }
}
