package com.esgcredit.model;

import java.util.Locale;

/**
 * The three weighted pillars. Also the forecast metrics.
 */
public enum Pillar {
    ENVIRONMENTAL("E"),
    SOCIAL("S"),
    GOVERNANCE("G");

    private final String code;

    Pillar(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Pillar fromText(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("pillar is null");
        }
        String t = raw.trim();
        for (Pillar p : values()) {
            if (p.code.equalsIgnoreCase(t) || p.name().equalsIgnoreCase(t)) {
                return p;
            }
        }
        throw new IllegalArgumentException("unknown pillar: " + raw);
    }
}
