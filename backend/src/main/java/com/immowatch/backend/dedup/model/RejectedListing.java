package com.immowatch.backend.dedup.model;

import lombok.Value;

@Value
public class RejectedListing {
    String listingId;
    String reason;
}
