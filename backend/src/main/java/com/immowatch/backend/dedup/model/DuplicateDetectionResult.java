package com.immowatch.backend.dedup.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DuplicateDetectionResult {
    List<EvidenceSummary> summaries;
    List<OversizedBlockWarning> warnings;
    List<RejectedListing> rejected;
    int acceptedCount;
    int candidatePairCount;

    public long duplicateGroupCount() {
        return summaries.stream().filter(EvidenceSummary::isDuplicateGroup).count();
    }
}
