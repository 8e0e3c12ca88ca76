package com.immowatch.backend.listing.service;

import com.immowatch.backend.listing.dto.ListingDTO;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link MockListingGenerator}.
 */
class MockListingGeneratorTest {

    private final MockListingGenerator generator = new MockListingGenerator();

    @Test
    void testSameSeedGivesSameRows() {
        assertEquals(generator.generateEnhancedDuplicates(50, 0.4, 42), generator.generateEnhancedDuplicates(50, 0.4, 42));
        assertNotEquals(generator.generateEnhancedDuplicates(50, 0.4, 42), generator.generateEnhancedDuplicates(50, 0.4, 43));
    }

    @Test
    void testRowCountAndUniqueness() {
        List<ListingDTO> rows = generator.generateMockRows(60, 0.3, 1);

        assertEquals(60, rows.size());
        assertEquals(60, rows.stream().map(ListingDTO::getId).distinct().count());
        assertEquals(60, rows.stream().map(ListingDTO::getUrl).distinct().count());
        assertTrue(rows.stream().allMatch(r -> r.getPrice() != null && r.getPrice().signum() > 0));
    }

    @Test
    void testBothSitesAreRepresented() {
        Set<String> sources = generator.generateEnhancedDuplicates(40, 0.5, 9).stream()
                .map(ListingDTO::getSource)
                .collect(Collectors.toSet());

        assertEquals(Set.of("seloger", "leboncoin"), sources);
    }

    @Test
    void testCuratedPairsDescribeSameHomeOnBothSites() {
        List<ListingDTO> rows = generator.generateCuratedDuplicates(5, 7);

        assertEquals(10, rows.size());
        for (int i = 0; i < rows.size(); i += 2) {
            ListingDTO seloger = rows.get(i);
            ListingDTO leboncoin = rows.get(i + 1);
            assertEquals("seloger", seloger.getSource());
            assertEquals("leboncoin", leboncoin.getSource());
            assertEquals(seloger.getCity(), leboncoin.getCity());
            assertEquals(seloger.getPropertyType(), leboncoin.getPropertyType());
            assertNotEquals(seloger.getUrl(), leboncoin.getUrl());
            if (leboncoin.getPrice() != null) {
                assertTrue(seloger.getPrice().subtract(leboncoin.getPrice()).abs().intValue() <= 50);
            }
        }
    }

    @Test
    void testCuratedAndRandomUrlsNeverCollide() {
        Set<String> urls = new HashSet<>();
        generator.generateEnhancedDuplicates(100, 0.4, 42).forEach(r -> assertTrue(urls.add(r.getUrl())));
        generator.generateCuratedDuplicates(4, 42).forEach(r -> assertTrue(urls.add(r.getUrl())));
    }

    @Test
    void testNothingRequested() {
        assertTrue(generator.generateMockRows(0, 0.5, 1).isEmpty());
        assertTrue(generator.generateCuratedDuplicates(0, 1).isEmpty());
    }
}
