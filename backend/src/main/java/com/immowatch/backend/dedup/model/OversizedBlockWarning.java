package com.immowatch.backend.dedup.model;

import lombok.Value;

/**
 * Raised alongside results when a blocking key gathered more listings than the configured maximum.
 * The block was still compared in full.
 */
@Value
public class OversizedBlockWarning {
    String blockKey;
    int blockSize;
    int maxBlockSize;
    // Pairs the block emitted; a city-wide block only pairs its sparse listings
    long pairCount;
}
