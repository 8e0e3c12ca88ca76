package com.immowatch.backend.dedup;

import com.immowatch.backend.dedup.model.CandidatePair;
import com.immowatch.backend.dedup.model.FeatureBreakdown;
import com.immowatch.backend.dedup.model.Listing;
import com.immowatch.backend.dedup.model.NormalizedListing;
import com.immowatch.backend.dedup.model.SimilarityScore;
import com.immowatch.backend.model.enums.AdvertiserType;
import com.immowatch.backend.model.enums.ListingKind;
import com.immowatch.backend.model.enums.ListingSource;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Set;

/**
 * Listing fixtures shared by the engine tests.
 */
public final class TestListings {

    public static final LocalDateTime T0 = LocalDateTime.of(2024, 3, 1, 9, 0);

    private TestListings() {
    }

    /**
     * A sale listing with every field filled in.
     */
    public static Listing.ListingBuilder listing(String id, String city, Integer price, Double surface, Integer rooms) {
        return Listing.builder()
                .id(id)
                .source(id.startsWith("lb") ? ListingSource.LEBONCOIN : ListingSource.SELOGER)
                .title("Appartement " + rooms + " pieces " + surface + " m2")
                .city(city)
                .price(price == null ? null : BigDecimal.valueOf(price))
                .surface(surface)
                .rooms(rooms)
                .kind(ListingKind.SALE)
                .advertiser(AdvertiserType.AGENCY)
                .ingestedAt(T0);
    }

    public static NormalizedListing.NormalizedListingBuilder normalized(String id) {
        return NormalizedListing.builder()
                .id(id)
                .source(ListingSource.SELOGER)
                .city("paris")
                .tokens(Set.of())
                .knownFieldCount(3)
                .ingestedAt(T0);
    }

    public static SimilarityScore score(String a, String b, double value) {
        return SimilarityScore.builder()
                .pair(CandidatePair.of(a, b))
                .score(value)
                .breakdown(FeatureBreakdown.builder().cityMatch(true).build())
                .matchedFeatures(Set.of())
                .build();
    }
}
