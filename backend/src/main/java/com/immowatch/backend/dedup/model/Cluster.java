package com.immowatch.backend.dedup.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Listings believed to describe one property. Members are sorted; a single-member cluster is a unique listing.
 */
@Value
@Builder
public class Cluster {
    List<String> memberIds;
    String canonicalId;
    double confidence;

    public int size() {
        return memberIds.size();
    }

    public boolean isSingleton() {
        return memberIds.size() == 1;
    }
}
