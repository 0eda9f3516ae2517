package com.esgcredit.model;

import java.util.Locale;

/**
 * Which forecast value a projected eligibility condition compares against.
 */
public enum ProjectionMode {
    FINAL_STEP,
    HORIZON_MEAN;

    public static ProjectionMode fromText(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return FINAL_STEP;
        }
        return ProjectionMode.valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
