package com.immowatch.backend.dedup.exception;

import lombok.Getter;

/**
 * A single listing that cannot enter the engine. Only that record is skipped.
 */
@Getter
public class InvalidListingException extends RuntimeException {

    private final String listingId;

    public InvalidListingException(String listingId, String message) {
        super(message);
        this.listingId = listingId;
    }
}
