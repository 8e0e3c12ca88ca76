package com.immowatch.backend.listing.entity;

import com.immowatch.backend.model.enums.AdvertiserType;
import com.immowatch.backend.model.enums.ListingKind;
import com.immowatch.backend.model.enums.ListingSource;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "listings")
public class ListingEntity {
    // Stable SHA-1 of source|url|title unless the scraper supplied its own id
    @Id
    @Column(length = 64)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ListingSource source;

    @Column(length = 500)
    private String title;

    @Column(unique = true, length = 1000)
    private String url;

    @Column(precision = 14, scale = 2)
    private BigDecimal price;

    @Column(length = 120)
    private String city;

    @Column(length = 10)
    private String postalCode;

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private ListingKind kind;

    @Column(length = 50)
    private String propertyType;

    private Integer rooms;

    private Double surface;

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private AdvertiserType advertiser;

    @Column(length = 10000)
    private String description;

    private LocalDateTime scrapedAt;

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
