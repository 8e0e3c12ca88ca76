package com.immowatch.backend.dedup.model;

import java.util.Set;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PairEvidence {
    String firstId;
    String secondId;
    double score;
    boolean accepted;
    FeatureBreakdown breakdown;
    Set<SimilarityFeature> matchedFeatures;
}
