package com.immowatch.backend.dedup.engine;

import com.immowatch.backend.dedup.model.CandidatePair;
import com.immowatch.backend.dedup.model.DetectionConfig;
import com.immowatch.backend.dedup.model.FeatureBreakdown;
import com.immowatch.backend.dedup.model.NormalizedListing;
import com.immowatch.backend.dedup.model.SimilarityFeature;
import com.immowatch.backend.dedup.model.SimilarityScore;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Weighted composite similarity between two normalized listings.
 * <p>
 * Price, surface, rooms and text drop out of the sum when either side lacks them, and the remaining
 * weights are rescaled so the score stays in [0,1]. City always counts: an unknown city scores 0.
 * The result does not depend on argument order.
 */
@Slf4j
public class SimilarityScorer {

    private final DetectionConfig config;

    public SimilarityScorer(DetectionConfig config) {
        this.config = config;
    }

    public SimilarityScore score(NormalizedListing a, NormalizedListing b) {
        CandidatePair pair = CandidatePair.of(a.getId(), b.getId());

        FeatureBreakdown breakdown = FeatureBreakdown.builder()
                .cityMatch(a.hasCity() && b.hasCity() && a.getCity().equals(b.getCity()))
                .priceCloseness(a.hasPrice() && b.hasPrice() ? closeness(a.getPrice(), b.getPrice()) : null)
                .surfaceCloseness(a.hasSurface() && b.hasSurface() ? closeness(a.getSurface(), b.getSurface()) : null)
                .roomMatch(a.getRooms() != null && b.getRooms() != null ? a.getRooms().equals(b.getRooms()) : null)
                .textSimilarity(jaccard(a.getTokens(), b.getTokens()))
                .build();

        double weighted = 0.0;
        double includedWeight = 0.0;
        for (SimilarityFeature feature : SimilarityFeature.values()) {
            Double value = breakdown.valueOf(feature);
            if (value == null) {
                continue;
            }
            double weight = config.weightOf(feature);
            weighted += weight * value;
            includedWeight += weight;
        }
        double score = includedWeight > 0.0 ? Math.min(1.0, Math.max(0.0, weighted / includedWeight)) : 0.0;

        SimilarityScore result = SimilarityScore.builder()
                .pair(pair)
                .score(score)
                .breakdown(breakdown)
                .matchedFeatures(matchedFeatures(a, b, breakdown))
                .build();
        log.debug("Scored {} -> {} {}", pair, result.formatScore(), breakdown);
        return result;
    }

    /**
     * Scores every pair, keyed and ordered by pair.
     */
    public Map<CandidatePair, SimilarityScore> scoreAll(Collection<CandidatePair> pairs,
                                                        Map<String, NormalizedListing> listingsById) {
        Map<CandidatePair, SimilarityScore> scores = new TreeMap<>();
        for (CandidatePair pair : pairs) {
            NormalizedListing first = listingsById.get(pair.getFirst());
            NormalizedListing second = listingsById.get(pair.getSecond());
            if (first == null || second == null) {
                throw new IllegalArgumentException("Candidate pair " + pair + " references an unknown listing");
            }
            scores.put(pair, score(first, second));
        }
        return scores;
    }

    /**
     * {@code 1 - min(1, |a - b| / max(a, b))} for two positive values.
     */
    static double closeness(double a, double b) {
        double max = Math.max(a, b);
        if (max <= 0.0) {
            return 0.0;
        }
        return 1.0 - Math.min(1.0, Math.abs(a - b) / max);
    }

    /**
     * Token-set Jaccard, or {@code null} when either side has no tokens.
     */
    static Double jaccard(Set<String> a, Set<String> b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return null;
        }
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        int intersection = 0;
        for (String token : smaller) {
            if (larger.contains(token)) {
                intersection++;
            }
        }
        int union = a.size() + b.size() - intersection;
        return (double) intersection / union;
    }

    private Set<SimilarityFeature> matchedFeatures(NormalizedListing a, NormalizedListing b, FeatureBreakdown breakdown) {
        Set<SimilarityFeature> matched = EnumSet.noneOf(SimilarityFeature.class);
        if (breakdown.isCityMatch()) {
            matched.add(SimilarityFeature.CITY);
        }
        if (a.hasPrice() && b.hasPrice() && (a.priceWithinBand(b.getPrice()) || b.priceWithinBand(a.getPrice()))) {
            matched.add(SimilarityFeature.PRICE);
        }
        if (breakdown.getSurfaceCloseness() != null
                && breakdown.getSurfaceCloseness() >= 1.0 - config.getSurfaceTolerance()) {
            matched.add(SimilarityFeature.SURFACE);
        }
        if (Boolean.TRUE.equals(breakdown.getRoomMatch())) {
            matched.add(SimilarityFeature.ROOMS);
        }
        if (breakdown.getTextSimilarity() != null && breakdown.getTextSimilarity() >= config.getTextMatchThreshold()) {
            matched.add(SimilarityFeature.TEXT);
        }
        return Collections.unmodifiableSet(matched);
    }
}
