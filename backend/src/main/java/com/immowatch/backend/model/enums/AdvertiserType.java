package com.immowatch.backend.model.enums;

public enum AdvertiserType {
    AGENCY,
    PRIVATE;

    public static AdvertiserType fromLabel(String label) {
        if (label == null) return null;
        switch (label.trim().toLowerCase()) {
            case "agency":
            case "agence":
            case "pro":
                return AGENCY;
            case "private":
            case "particulier":
                return PRIVATE;
            default:
                return null;
        }
    }
}
