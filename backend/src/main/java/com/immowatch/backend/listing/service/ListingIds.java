package com.immowatch.backend.listing.service;

import com.immowatch.backend.model.enums.ListingSource;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Identifiers for scraped rows that arrive without one.
 */
public final class ListingIds {

    private ListingIds() {
    }

    /**
     * SHA-1 hex of {@code source|url|title}; the same row scraped twice gets the same id.
     */
    public static String stableId(ListingSource source, String url, String title) {
        String raw = (source == null ? "" : source.name().toLowerCase())
                + "|" + (url == null ? "" : url.trim())
                + "|" + (title == null ? "" : title.trim());
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(raw.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
