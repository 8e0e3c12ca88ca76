package com.immowatch.backend.listing.dto;

import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A scraped listing row as produced by the SeLoger and LeBoncoin scrapers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListingDTO {
    private String id;
    private String source; // "seloger" or "leboncoin"; resolved from url when absent
    @Size(max = 500)
    private String title;
    @Size(max = 1000)
    private String url;
    private BigDecimal price;
    @Size(max = 120)
    private String city;
    @Size(max = 10)
    private String postalCode;
    private String listingType; // "sale" or "rent"
    private String propertyType;
    private Integer rooms;
    private Double surface;
    private String agencyOrPrivate;
    private String description;
    private LocalDateTime scrapedAt;
}
