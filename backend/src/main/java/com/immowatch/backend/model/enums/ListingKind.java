package com.immowatch.backend.model.enums;

public enum ListingKind {
    SALE,
    RENTAL;

    /**
     * Accepts the scrapers' labels ("sale", "rent", "location", "vente").
     */
    public static ListingKind fromLabel(String label) {
        if (label == null) return null;
        switch (label.trim().toLowerCase()) {
            case "sale":
            case "vente":
            case "achat":
                return SALE;
            case "rent":
            case "rental":
            case "location":
                return RENTAL;
            default:
                return null;
        }
    }
}
