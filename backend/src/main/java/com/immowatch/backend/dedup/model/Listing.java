package com.immowatch.backend.dedup.model;

import com.immowatch.backend.model.enums.AdvertiserType;
import com.immowatch.backend.model.enums.ListingKind;
import com.immowatch.backend.model.enums.ListingSource;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * A listing as handed over by the ingestion side. Numeric fields are {@code null}
 * when the source did not report them; they are never defaulted to zero.
 */
@Value
@Builder(toBuilder = true)
public class Listing {
    String id;
    ListingSource source;
    String title;
    String city;
    BigDecimal price;
    Double surface;
    Integer rooms;
    ListingKind kind;
    AdvertiserType advertiser;
    String description;
    LocalDateTime ingestedAt;

    String url;
    String postalCode;
    String propertyType;
}
