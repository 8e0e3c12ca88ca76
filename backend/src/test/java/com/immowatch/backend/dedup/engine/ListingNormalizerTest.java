package com.immowatch.backend.dedup.engine;

import com.immowatch.backend.dedup.model.DetectionConfig;
import com.immowatch.backend.dedup.model.Listing;
import com.immowatch.backend.dedup.model.NormalizedListing;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.immowatch.backend.dedup.TestListings.listing;
import static org.junit.jupiter.api.Assertions.*;

class ListingNormalizerTest {

    private ListingNormalizer normalizer;

    @BeforeEach
    void setUp() {
        DetectionConfig config = DetectionConfig.builder()
                .cityAliases(Map.of("Paris 15ème", "Paris 15e", "Paris XV", "Paris 15e"))
                .build();
        normalizer = new ListingNormalizer(config);
    }

    @Test
    void testCityIsFoldedAndAliased() {
        assertEquals("paris15e", normalizer.canonicalCity("Paris 15ème"));
        assertEquals("paris15e", normalizer.canonicalCity("PARIS 15E"));
        assertEquals("paris15e", normalizer.canonicalCity("paris xv"));
        assertEquals("saintetienne", normalizer.canonicalCity("  Saint-Étienne "));
        assertEquals("lyon", normalizer.canonicalCity("Lyon"));
    }

    @Test
    void testBlankCityIsUnknown() {
        assertNull(normalizer.canonicalCity(null));
        assertNull(normalizer.canonicalCity("   "));
        assertNull(normalizer.canonicalCity("--"));
    }

    @Test
    void testPriceKeepsExactValueAndToleranceBand() {
        NormalizedListing normalized = normalizer.normalize(listing("se-1", "Paris", 300000, 50.0, 2).build());

        assertEquals(300000.0, normalized.getPrice());
        assertEquals(285000.0, normalized.getPriceLow(), 1e-6);
        assertEquals(315000.0, normalized.getPriceHigh(), 1e-6);
        assertTrue(normalized.priceWithinBand(305000));
        assertFalse(normalized.priceWithinBand(330000));
    }

    @Test
    void testMissingNumbersStayUnknown() {
        Listing sparse = listing("se-1", "Paris", null, null, null).build();

        NormalizedListing normalized = normalizer.normalize(sparse);

        assertNull(normalized.getPrice());
        assertNull(normalized.getPriceLow());
        assertNull(normalized.getSurface());
        assertNull(normalized.getRooms());
    }

    @Test
    void testNonPositiveValuesAreUnknownNotZero() {
        Listing listing = listing("se-1", "Paris", 300000, 0.0, -1).price(BigDecimal.ZERO).build();

        NormalizedListing normalized = normalizer.normalize(listing);

        assertNull(normalized.getPrice(), "price 0 is unknown");
        assertNull(normalized.getSurface(), "surface 0 is unknown");
        assertNull(normalized.getRooms(), "negative rooms are unknown");
    }

    @Test
    void testZeroRoomsIsAValidValue() {
        NormalizedListing normalized = normalizer.normalize(listing("se-1", "Paris", 90000, 18.0, 0).build());

        assertEquals(0, normalized.getRooms());
    }

    @Test
    void testTokensComeFromTitleAndDescriptionWithoutMarkupOrStopWords() {
        Listing listing = listing("se-1", "Paris", 300000, 50.0, 2)
                .title("Bel appartement à Paris")
                .description("<p>Appartement <b>lumineux</b> avec balcon, proche de la gare</p>")
                .build();

        Set<String> tokens = normalizer.normalize(listing).getTokens();

        assertEquals(Set.of("bel", "appartement", "paris", "lumineux", "balcon", "proche", "gare"), tokens);
    }

    @Test
    void testDigitsSurviveTokenization() {
        Set<String> tokens = normalizer.tokenize("Studio 1 piece 18 m2", null);

        assertTrue(tokens.contains("1"));
        assertTrue(tokens.contains("18"));
        assertTrue(tokens.contains("m2"));
    }

    @Test
    void testEmptyTextGivesEmptyTokenSet() {
        assertTrue(normalizer.tokenize(null, "  ").isEmpty());
    }

    @Test
    void testKnownFieldCount() {
        Listing full = listing("se-1", "Paris", 300000, 50.0, 2)
                .description("Calme")
                .url("https://www.seloger.com/annonces/1.htm")
                .postalCode("75015")
                .propertyType("apartment")
                .build();
        Listing sparse = listing("se-2", null, null, null, null).title(null).advertiser(null).build();

        assertEquals(10, normalizer.normalize(full).getKnownFieldCount());
        assertEquals(0, normalizer.normalize(sparse).getKnownFieldCount());
    }

    @Test
    void testNormalizationIsRepeatable() {
        Listing listing = listing("se-1", "Paris 15ème", 300000, 50.0, 2).build();

        assertEquals(normalizer.normalize(listing), normalizer.normalize(listing));
    }
}
