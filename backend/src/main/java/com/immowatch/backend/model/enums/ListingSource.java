package com.immowatch.backend.model.enums;

import java.net.URI;
import java.util.Locale;
import java.util.Set;
import lombok.Getter;

/**
 * Property listing sites the scrapers cover. A row is attributed to a site either by the
 * scraper's site label or by the host of the ad url.
 */
@Getter
public enum ListingSource {
    SELOGER("seloger.com", Set.of("seloger", "se_loger")),
    LEBONCOIN("leboncoin.fr", Set.of("leboncoin", "lbc"));

    // Domain the site's ads are served from, any subdomain included
    private final String registeredDomain;
    private final Set<String> siteLabels;

    ListingSource(String registeredDomain, Set<String> siteLabels) {
        this.registeredDomain = registeredDomain;
        this.siteLabels = siteLabels;
    }

    /**
     * Site serving the ad at {@code url}, or null for another site or an unparsable url.
     * A missing scheme is tolerated ("leboncoin.fr/ventes_immobilieres/42.htm").
     */
    public static ListingSource fromAdUrl(String url) {
        String host = hostOf(url);
        if (host == null) return null;
        for (ListingSource source : values()) {
            if (source.servesHost(host)) {
                return source;
            }
        }
        return null;
    }

    /**
     * Site named by a scraper label such as "seloger", "SeLoger", "se_loger", "leboncoin" or "lbc".
     * Dashes and spaces are ignored.
     */
    public static ListingSource fromSiteLabel(String label) {
        if (label == null) return null;
        String key = label.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s-]", "");
        for (ListingSource source : values()) {
            if (source.siteLabels.contains(key)) {
                return source;
            }
        }
        return null;
    }

    public boolean servesHost(String host) {
        String h = host.toLowerCase(Locale.ROOT);
        return h.equals(registeredDomain) || h.endsWith("." + registeredDomain);
    }

    /**
     * Ad page url on this site for a path such as {@code annonces/123.htm}.
     */
    public String adUrl(String path) {
        return "https://www." + registeredDomain + "/" + path;
    }

    private static String hostOf(String url) {
        if (url == null || url.isBlank()) return null;
        String candidate = url.trim();
        if (!candidate.contains("://")) {
            candidate = "https://" + candidate;
        }
        try {
            return URI.create(candidate).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
