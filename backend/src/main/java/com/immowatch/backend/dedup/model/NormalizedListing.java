package com.immowatch.backend.dedup.model;

import com.immowatch.backend.model.enums.ListingSource;
import java.time.LocalDateTime;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Comparable form of a {@link Listing}. {@code null} in city, price, surface or rooms means unknown.
 */
@Value
@Builder
public class NormalizedListing {
    String id;
    ListingSource source;
    String city;
    Double price;
    Double priceLow;
    Double priceHigh;
    Double surface;
    Integer rooms;
    Set<String> tokens;
    int knownFieldCount;
    LocalDateTime ingestedAt;

    public boolean hasPrice() {
        return price != null;
    }

    public boolean hasSurface() {
        return surface != null;
    }

    public boolean hasCity() {
        return city != null;
    }

    /**
     * True when the given price lies inside this listing's tolerance band.
     */
    public boolean priceWithinBand(double other) {
        return price != null && other >= priceLow && other <= priceHigh;
    }
}
