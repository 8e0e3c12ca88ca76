package com.immowatch.backend.dedup.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * What the dashboard receives per cluster: members, the listing to display, the weakest scored
 * link as confidence and the pair-level breakdowns.
 */
@Value
@Builder
public class EvidenceSummary {
    List<String> memberIds;
    String canonicalId;
    double confidence;
    List<PairEvidence> pairEvidence;

    public boolean isDuplicateGroup() {
        return memberIds.size() > 1;
    }
}
