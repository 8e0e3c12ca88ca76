package com.immowatch.backend.dedup.engine;

import com.immowatch.backend.dedup.model.DetectionConfig;
import com.immowatch.backend.dedup.model.Listing;
import com.immowatch.backend.dedup.model.NormalizedListing;
import java.text.Normalizer;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;

/**
 * Turns a {@link Listing} into its comparable form. Pure: the same listing and alias table always
 * give an equal result, and unknown numeric fields stay unknown.
 */
@Slf4j
public class ListingNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private static final Set<String> STOP_WORDS = Set.of(
            // French
            "le", "la", "les", "un", "une", "des", "de", "du", "et", "en", "au", "aux", "pour", "par",
            "avec", "sur", "dans", "ce", "cet", "cette", "ces", "son", "sa", "ses", "est", "ou", "pas",
            "plus", "tres", "qui", "que", "vous", "nous", "il", "elle",
            // English
            "the", "an", "and", "of", "in", "on", "for", "with", "to", "at", "is", "by", "from", "this"
    );

    private final Map<String, String> cityAliases;
    private final double priceTolerance;

    public ListingNormalizer(DetectionConfig config) {
        this.priceTolerance = config.getPriceTolerance();
        Map<String, String> aliases = new HashMap<>();
        config.getCityAliases().forEach((raw, canonical) -> {
            String from = foldCity(raw);
            String to = foldCity(canonical);
            if (from != null && to != null) {
                aliases.put(from, to);
            }
        });
        this.cityAliases = Collections.unmodifiableMap(aliases);
    }

    public NormalizedListing normalize(Listing listing) {
        String city = canonicalCity(listing.getCity());
        Double price = positive(listing.getPrice() == null ? null : listing.getPrice().doubleValue());
        Double surface = positive(listing.getSurface());
        Integer rooms = listing.getRooms() != null && listing.getRooms() >= 0 ? listing.getRooms() : null;

        NormalizedListing normalized = NormalizedListing.builder()
                .id(listing.getId())
                .source(listing.getSource())
                .city(city)
                .price(price)
                .priceLow(price == null ? null : price * (1 - priceTolerance))
                .priceHigh(price == null ? null : price * (1 + priceTolerance))
                .surface(surface)
                .rooms(rooms)
                .tokens(tokenize(listing.getTitle(), listing.getDescription()))
                .knownFieldCount(countKnownFields(listing, city, price, surface, rooms))
                .ingestedAt(listing.getIngestedAt())
                .build();

        log.trace("Normalized {} -> city={}, price={}, surface={}, rooms={}, tokens={}",
                listing.getId(), city, price, surface, rooms, normalized.getTokens().size());
        return normalized;
    }

    /**
     * Folded city name mapped through the alias table, or {@code null} when the city is unknown.
     */
    public String canonicalCity(String rawCity) {
        String folded = foldCity(rawCity);
        if (folded == null) {
            return null;
        }
        return cityAliases.getOrDefault(folded, folded);
    }

    /**
     * Lower-case, accent-free, alphanumeric-only form: "Paris 15ème" becomes "paris15eme".
     */
    static String foldCity(String raw) {
        if (raw == null) {
            return null;
        }
        String folded = NON_ALPHANUMERIC.matcher(fold(raw)).replaceAll("");
        return folded.isEmpty() ? null : folded;
    }

    static String fold(String text) {
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("").toLowerCase(Locale.ROOT);
    }

    Set<String> tokenize(String title, String description) {
        Set<String> tokens = new TreeSet<>();
        addTokens(tokens, title);
        addTokens(tokens, description);
        return Collections.unmodifiableSet(tokens);
    }

    private void addTokens(Set<String> tokens, String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        // Scraped descriptions sometimes keep their markup
        String plain = text.indexOf('<') >= 0 ? Jsoup.parse(text).text() : text;
        for (String token : NON_ALPHANUMERIC.split(fold(plain))) {
            if (token.isEmpty() || STOP_WORDS.contains(token)) {
                continue;
            }
            if (token.length() == 1 && !DIGITS.matcher(token).matches()) {
                continue;
            }
            tokens.add(token);
        }
    }

    private static Double positive(Double value) {
        if (value == null || value.isNaN() || value.isInfinite() || value <= 0) {
            return null;
        }
        return value;
    }

    private static int countKnownFields(Listing listing, String city, Double price, Double surface, Integer rooms) {
        int count = 0;
        if (listing.getTitle() != null && !listing.getTitle().isBlank()) count++;
        if (city != null) count++;
        if (price != null) count++;
        if (surface != null) count++;
        if (rooms != null) count++;
        if (listing.getDescription() != null && !listing.getDescription().isBlank()) count++;
        if (listing.getAdvertiser() != null) count++;
        if (listing.getUrl() != null && !listing.getUrl().isBlank()) count++;
        if (listing.getPostalCode() != null && !listing.getPostalCode().isBlank()) count++;
        if (listing.getPropertyType() != null && !listing.getPropertyType().isBlank()) count++;
        return count;
    }
}
