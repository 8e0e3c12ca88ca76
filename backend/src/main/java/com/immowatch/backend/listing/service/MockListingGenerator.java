package com.immowatch.backend.listing.service;

import com.immowatch.backend.listing.dto.ListingDTO;
import com.immowatch.backend.model.enums.ListingSource;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Synthetic SeLoger/LeBoncoin rows with known cross-source duplicates, for demos and tests.
 * Every method takes a seed, so the same arguments always give the same rows.
 */
@Slf4j
@Component
public class MockListingGenerator {

    private static final String[][] CITIES = {
            {"Paris", "75000"}, {"Lyon", "69000"}, {"Marseille", "13000"},
            {"Toulouse", "31000"}, {"Bordeaux", "33000"}, {"Lille", "59000"}
    };
    private static final String[] PROPERTY_TYPES = {"apartment", "house", "studio"};
    private static final String[] LISTING_TYPES = {"rent", "sale"};
    private static final LocalDateTime BASE_TIME = LocalDateTime.of(2024, 1, 1, 8, 0);

    /**
     * Half SeLoger, half LeBoncoin, plus exact copies of the first {@code duplicateRatio} share on the other site.
     */
    public List<ListingDTO> generateMockRows(int total, double duplicateRatio, long seed) {
        if (total <= 0) {
            return List.of();
        }
        Random random = new Random(seed);
        List<ListingDTO> base = baseListings(total, seed, random);

        int duplicates = Math.max(0, (int) (base.size() * duplicateRatio));
        List<ListingDTO> rows = new ArrayList<>(base);
        for (int i = 0; i < duplicates; i++) {
            rows.add(cloneOnOtherSite(base.get(i), seed, rows.size(), random));
        }
        Collections.shuffle(rows, random);
        List<ListingDTO> result = new ArrayList<>(rows.subList(0, Math.min(total, rows.size())));
        log.debug("Generated {} mock listings ({} cross-source copies before truncation)", result.size(), duplicates);
        return result;
    }

    /**
     * Like {@link #generateMockRows} but each duplicated property gets one or two copies with
     * small price changes and, now and then, a missing surface, room count or advertiser.
     */
    public List<ListingDTO> generateEnhancedDuplicates(int total, double duplicateRatio, long seed) {
        if (total <= 0) {
            return List.of();
        }
        Random random = new Random(seed);
        List<ListingDTO> base = baseListings(total, seed, random);

        int duplicated = Math.max(0, (int) (base.size() * duplicateRatio));
        List<ListingDTO> rows = new ArrayList<>(base);
        for (int i = 0; i < duplicated; i++) {
            int copies = 1 + random.nextInt(2);
            for (int c = 0; c < copies; c++) {
                ListingDTO clone = cloneOnOtherSite(base.get(i), seed, rows.size(), random);
                if (random.nextDouble() < 0.3) {
                    clone.setPrice(clone.getPrice().add(BigDecimal.valueOf(random.nextInt(101) - 50)).max(BigDecimal.ZERO));
                }
                if (random.nextDouble() < 0.2) {
                    switch (random.nextInt(3)) {
                        case 0:
                            clone.setSurface(null);
                            break;
                        case 1:
                            clone.setRooms(null);
                            break;
                        default:
                            clone.setAgencyOrPrivate(null);
                            break;
                    }
                }
                rows.add(clone);
            }
        }
        Collections.shuffle(rows, random);
        return new ArrayList<>(rows.subList(0, Math.min(total, rows.size())));
    }

    /**
     * {@code numPairs} SeLoger/LeBoncoin pairs of the same home; the LeBoncoin side has a slightly
     * different price and one of price, surface, rooms, postal code or title dropped.
     */
    public List<ListingDTO> generateCuratedDuplicates(int numPairs, long seed) {
        Random random = new Random(seed);
        int[] surfaces = {42, 55, 68, 75, 90};
        int[] prices = {950, 1200, 185000, 320000, 540000};
        int[] priceShifts = {0, 10, 50, -10, -50};

        List<ListingDTO> pairs = new ArrayList<>();
        for (int i = 0; i < numPairs; i++) {
            String[] city = CITIES[random.nextInt(CITIES.length)];
            String property = PROPERTY_TYPES[random.nextInt(PROPERTY_TYPES.length)];
            int rooms = 1 + random.nextInt(4);
            int surface = surfaces[random.nextInt(surfaces.length)];
            int price = prices[random.nextInt(prices.length)];
            String listingType = price < 10_000 ? "rent" : "sale";

            ListingDTO seloger = ListingDTO.builder()
                    .source("seloger")
                    .title(title(property, rooms, surface, city[0]))
                    .url(mockUrl(ListingSource.SELOGER, "curated-" + seed + "-" + pairs.size()))
                    .price(BigDecimal.valueOf(price))
                    .city(city[0])
                    .postalCode(city[1])
                    .listingType(listingType)
                    .propertyType(property)
                    .rooms(rooms)
                    .surface((double) surface)
                    .agencyOrPrivate("agency")
                    .scrapedAt(BASE_TIME.plusMinutes(pairs.size()))
                    .build();
            seloger.setId(ListingIds.stableId(ListingSource.SELOGER, seloger.getUrl(), seloger.getTitle()));
            pairs.add(seloger);

            ListingDTO leboncoin = copyOf(seloger);
            leboncoin.setSource("leboncoin");
            leboncoin.setUrl(mockUrl(ListingSource.LEBONCOIN, "curated-" + seed + "-" + pairs.size()));
            leboncoin.setScrapedAt(BASE_TIME.plusMinutes(pairs.size()));
            leboncoin.setPrice(BigDecimal.valueOf(price + priceShifts[random.nextInt(priceShifts.length)]));
            if (random.nextDouble() < 0.3) {
                leboncoin.setAgencyOrPrivate("private");
            }
            switch (random.nextInt(5)) {
                case 0:
                    leboncoin.setPrice(null);
                    break;
                case 1:
                    leboncoin.setSurface(null);
                    break;
                case 2:
                    leboncoin.setRooms(null);
                    break;
                case 3:
                    leboncoin.setPostalCode(null);
                    break;
                default:
                    leboncoin.setTitle(null);
                    break;
            }
            leboncoin.setId(ListingIds.stableId(ListingSource.LEBONCOIN, leboncoin.getUrl(), leboncoin.getTitle()));
            pairs.add(leboncoin);
        }
        return pairs;
    }

    private List<ListingDTO> baseListings(int total, long seed, Random random) {
        List<ListingDTO> base = new ArrayList<>();
        int selogerCount = Math.max(1, total / 2);
        for (int i = 0; i < selogerCount; i++) {
            base.add(randomListing(ListingSource.SELOGER, seed, base.size(), random));
        }
        for (int i = selogerCount; i < total; i++) {
            base.add(randomListing(ListingSource.LEBONCOIN, seed, base.size(), random));
        }
        return base;
    }

    private ListingDTO randomListing(ListingSource source, long seed, int sequence, Random random) {
        String[] city = CITIES[random.nextInt(CITIES.length)];
        String property = PROPERTY_TYPES[random.nextInt(PROPERTY_TYPES.length)];
        String listingType = LISTING_TYPES[random.nextInt(LISTING_TYPES.length)];
        int rooms = 1 + random.nextInt(5);
        int surface = 18 + random.nextInt(123);
        int price = "rent".equals(listingType)
                ? 400 + random.nextInt(3101)
                : 80_000 + random.nextInt(1_120_001);

        ListingDTO listing = ListingDTO.builder()
                .source(source.name().toLowerCase())
                .title(title(property, rooms, surface, city[0]))
                .url(mockUrl(source, "mock-" + seed + "-" + sequence))
                .price(BigDecimal.valueOf(price))
                .city(city[0])
                .postalCode(city[1])
                .listingType(listingType)
                .propertyType(property)
                .rooms(rooms)
                .surface((double) surface)
                .agencyOrPrivate(random.nextDouble() < 0.6 ? "agency" : "private")
                .scrapedAt(BASE_TIME.plusMinutes(sequence))
                .build();
        listing.setId(ListingIds.stableId(source, listing.getUrl(), listing.getTitle()));
        return listing;
    }

    private ListingDTO cloneOnOtherSite(ListingDTO original, long seed, int sequence, Random random) {
        ListingSource other = "seloger".equals(original.getSource()) ? ListingSource.LEBONCOIN : ListingSource.SELOGER;
        ListingDTO clone = copyOf(original);
        clone.setSource(other.name().toLowerCase());
        clone.setUrl(mockUrl(other, "mock-" + seed + "-" + sequence));
        clone.setScrapedAt(BASE_TIME.plusMinutes(sequence).plusSeconds(random.nextInt(60)));
        clone.setId(ListingIds.stableId(other, clone.getUrl(), clone.getTitle()));
        return clone;
    }

    private static ListingDTO copyOf(ListingDTO dto) {
        return ListingDTO.builder()
                .id(dto.getId())
                .source(dto.getSource())
                .title(dto.getTitle())
                .url(dto.getUrl())
                .price(dto.getPrice())
                .city(dto.getCity())
                .postalCode(dto.getPostalCode())
                .listingType(dto.getListingType())
                .propertyType(dto.getPropertyType())
                .rooms(dto.getRooms())
                .surface(dto.getSurface())
                .agencyOrPrivate(dto.getAgencyOrPrivate())
                .description(dto.getDescription())
                .scrapedAt(dto.getScrapedAt())
                .build();
    }

    private static String title(String property, int rooms, int surface, String city) {
        return Character.toUpperCase(property.charAt(0)) + property.substring(1)
                + " " + rooms + " rooms " + surface + "m2 in " + city;
    }

    private static String mockUrl(ListingSource source, String slug) {
        return source.adUrl("annonces/" + slug + ".htm");
    }
}
