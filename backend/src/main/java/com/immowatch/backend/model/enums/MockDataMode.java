package com.immowatch.backend.model.enums;

/**
 * How mock listings copy a property onto the other site.
 */
public enum MockDataMode {
    // field-for-field copies
    EXACT,
    // copies with price drift and dropped fields
    ENHANCED;

    public static MockDataMode fromLabel(String label) {
        if (label == null) return null;
        for (MockDataMode mode : values()) {
            if (mode.name().equalsIgnoreCase(label.trim())) {
                return mode;
            }
        }
        return null;
    }
}
