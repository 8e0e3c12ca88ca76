package com.immowatch.backend.listing.controller;

import com.immowatch.backend.listing.dto.IngestionResultDTO;
import com.immowatch.backend.listing.dto.ListingDTO;
import com.immowatch.backend.listing.entity.ListingEntity;
import com.immowatch.backend.listing.service.ListingIngestionService;
import com.immowatch.backend.model.enums.MockDataMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the listing store
 */
@Slf4j
@RestController
@RequestMapping("/api/listings")
@RequiredArgsConstructor
@Validated
public class ListingController {

    private final ListingIngestionService ingestionService;

    /**
     * Upsert a batch of scraped listings
     */
    @PostMapping
    public ResponseEntity<?> ingestListings(@RequestBody List<@Valid ListingDTO> rows) {
        try {
            IngestionResultDTO result = ingestionService.upsertListings(rows);
            return ResponseEntity.ok(Map.of(
                    "message", "Listings stored",
                    "result", result,
                    "timestamp", System.currentTimeMillis()
            ));
        } catch (Exception e) {
            log.error("❌ Listing ingestion failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                    "error", "Listing ingestion failed",
                    "message", String.valueOf(e.getMessage()),
                    "timestamp", System.currentTimeMillis()
            ));
        }
    }

    /**
     * Stored listings, newest scrape first
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> getListings(
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int size) {
        Page<ListingEntity> listings = ingestionService.getListings(
                PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "scrapedAt")));
        return ResponseEntity.ok(Map.of(
                "listings", listings.getContent(),
                "currentPage", listings.getNumber(),
                "totalPages", listings.getTotalPages(),
                "totalElements", listings.getTotalElements()
        ));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        return ResponseEntity.ok(ingestionService.getListingStats());
    }

    /**
     * Seed the store with synthetic listings containing cross-source duplicates.
     * {@code mode=exact} copies properties as-is, {@code mode=enhanced} perturbs the copies.
     */
    @PostMapping("/mock")
    public ResponseEntity<?> seedMockListings(
            @RequestParam(defaultValue = "300") @Min(1) @Max(10000) int total,
            @RequestParam(defaultValue = "0.4") @DecimalMin("0.0") @DecimalMax("1.0") double duplicateRatio,
            @RequestParam(defaultValue = "42") long seed,
            @RequestParam(defaultValue = "enhanced") String mode) {
        MockDataMode mockMode = MockDataMode.fromLabel(mode);
        if (mockMode == null) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Unknown mock mode",
                    "message", "mode must be 'exact' or 'enhanced', got '" + mode + "'",
                    "timestamp", System.currentTimeMillis()
            ));
        }
        log.info("🎲 Seeding {} {} mock listings (duplicate ratio {}, seed {})", total, mockMode, duplicateRatio, seed);
        try {
            IngestionResultDTO result = ingestionService.seedMockListings(mockMode, total, duplicateRatio, seed);
            return ResponseEntity.ok(Map.of(
                    "message", "Mock listings stored",
                    "result", result,
                    "timestamp", System.currentTimeMillis()
            ));
        } catch (Exception e) {
            log.error("❌ Mock seeding failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                    "error", "Mock seeding failed",
                    "message", String.valueOf(e.getMessage()),
                    "timestamp", System.currentTimeMillis()
            ));
        }
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Object>> clearListings() {
        long removed = ingestionService.clear();
        return ResponseEntity.ok(Map.of(
                "message", "Listing store cleared",
                "removed", removed,
                "timestamp", System.currentTimeMillis()
        ));
    }
}
