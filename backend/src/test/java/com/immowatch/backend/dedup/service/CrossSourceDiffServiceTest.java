package com.immowatch.backend.dedup.service;

import com.immowatch.backend.dedup.dto.CrossSourceReport;
import com.immowatch.backend.dedup.dto.FieldDifference;
import com.immowatch.backend.dedup.dto.ListingMismatch;
import com.immowatch.backend.dedup.model.DuplicateDetectionResult;
import com.immowatch.backend.dedup.model.EvidenceSummary;
import com.immowatch.backend.dedup.model.Listing;
import com.immowatch.backend.model.enums.AdvertiserType;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static com.immowatch.backend.dedup.TestListings.listing;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CrossSourceDiffService}.
 */
class CrossSourceDiffServiceTest {

    private final CrossSourceDiffService diffService = new CrossSourceDiffService();

    private static EvidenceSummary summary(String canonical, String... members) {
        return EvidenceSummary.builder()
                .memberIds(List.of(members))
                .canonicalId(canonical)
                .confidence(1.0)
                .pairEvidence(List.of())
                .build();
    }

    private static DuplicateDetectionResult result(EvidenceSummary... summaries) {
        return DuplicateDetectionResult.builder()
                .summaries(List.of(summaries))
                .warnings(List.of())
                .rejected(List.of())
                .build();
    }

    @Test
    void testSplitsClustersBySite() {
        List<Listing> listings = List.of(
                listing("se-1", "Paris", 300000, 50.0, 2).build(),
                listing("lb-1", "Paris", 305000, 50.0, 2).build(),
                listing("se-2", "Lyon", 180000, 40.0, 2).build(),
                listing("lb-3", "Lille", 150000, 35.0, 1).build(),
                listing("lb-4", "Nice", 410000, 60.0, 3).build(),
                listing("lb-5", "Nice", 410000, 60.0, 3).build());

        CrossSourceReport report = diffService.compare(listings, result(
                summary("lb-1", "lb-1", "se-1"),
                summary("se-2", "se-2"),
                summary("lb-3", "lb-3"),
                summary("lb-4", "lb-4", "lb-5")));

        assertEquals(List.of("se-2"), report.getOnlySeloger());
        assertEquals(List.of("lb-3", "lb-4"), report.getOnlyLeboncoin());
        assertEquals(1, report.getSharedProperties());
    }

    @Test
    void testReportsFieldsThatDisagree() {
        List<Listing> listings = List.of(
                listing("se-1", "Paris", 300000, 50.0, 2).url("https://www.seloger.com/annonces/1.htm").build(),
                listing("lb-1", "Paris", 305000, 50.0, 2).url("https://www.leboncoin.fr/ventes/1.htm")
                        .advertiser(AdvertiserType.PRIVATE).build());

        CrossSourceReport report = diffService.compare(listings, result(summary("lb-1", "lb-1", "se-1")));

        assertEquals(1, report.getMismatches().size());
        ListingMismatch mismatch = report.getMismatches().get(0);
        assertEquals("lb-1", mismatch.getCanonicalId());
        assertEquals("se-1", mismatch.getSelogerId());
        assertEquals("lb-1", mismatch.getLeboncoinId());
        assertEquals("https://www.leboncoin.fr/ventes/1.htm", mismatch.getLeboncoinUrl());
        assertEquals(List.of("price", "advertiser"), List.copyOf(mismatch.getDifferences().keySet()));
        assertEquals(new FieldDifference(BigDecimal.valueOf(300000), BigDecimal.valueOf(305000)),
                mismatch.getDifferences().get("price"));
    }

    @Test
    void testEqualValuesAreNotDifferences() {
        Listing seloger = listing("se-1", "Paris", 300000, 50.0, 2).build();
        Listing leboncoin = listing("lb-1", "Paris", 300000, 50.0, 2).price(new BigDecimal("300000.00")).build();

        Map<String, FieldDifference> differences = diffService.differences(seloger, leboncoin);

        assertTrue(differences.isEmpty(), "fields missing on both sides and equal prices are skipped");
    }

    @Test
    void testMissingValueOnOneSideIsADifference() {
        Listing seloger = listing("se-1", "Paris", 300000, 50.0, 2).build();
        Listing leboncoin = listing("lb-1", "Paris", 300000, null, 2).build();

        Map<String, FieldDifference> differences = diffService.differences(seloger, leboncoin);

        assertEquals(new FieldDifference(50.0, null), differences.get("surface"));
    }
}
