package com.di.useeio.gwp;

import java.util.Locale;

/**
 * IPCC Assessment Report editions carried by the reference data. {@code ar_version} is free text
 * in the table; these are the values the catalog writes.
 */
public enum ArVersion {
    AR4,
    AR5,
    AR6;

    /** Case-insensitive lookup; "ar5" and " AR5 " both give {@link #AR5}. */
    public static ArVersion fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("AR version must not be blank");
        }
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown AR version: " + code, e);
        }
    }
}
