package com.immowatch.backend.dedup.model;

import java.util.Set;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SimilarityScore {
    CandidatePair pair;
    double score;
    FeatureBreakdown breakdown;
    Set<SimilarityFeature> matchedFeatures;

    public boolean exceedsThreshold(double threshold) {
        return score >= threshold;
    }

    public String formatScore() {
        return String.format("%.1f%%", score * 100.0);
    }
}
