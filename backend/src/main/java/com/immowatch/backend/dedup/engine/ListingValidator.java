package com.immowatch.backend.dedup.engine;

import com.immowatch.backend.dedup.exception.InvalidListingException;
import com.immowatch.backend.dedup.model.Listing;

/**
 * Entry checks a listing must pass before normalization.
 * A missing kind is accepted: scraped rows often carry none and no similarity feature reads it.
 */
public class ListingValidator {

    public void validate(Listing listing) {
        if (listing == null) {
            throw new InvalidListingException(null, "listing is null");
        }
        String id = listing.getId();
        if (id == null || id.isBlank()) {
            throw new InvalidListingException(null, "listing has no identifier");
        }
        if (listing.getSource() == null) {
            throw new InvalidListingException(id, "listing has no source");
        }
    }
}
