package com.di.useeio.gwp;

import java.util.List;

/**
 * Gas-name normalization applied before reference rows are written.
 */
public final class GasNames {

    /** Suffixes left on some names by the source workbook's footnote markers. */
    public static final List<String> LEGACY_SUFFIXES = List.of(" a", " b", " c");

    private static final String QUALIFIER_DASH = " – ";

    private GasNames() {
    }

    /**
     * Strips one legacy suffix and rewrites {@code "Methane – fossil"} as {@code "Methane (fossil)"},
     * so that a flow's substance matches the name exactly or with a parenthesized qualifier.
     */
    public static String normalize(String rawName) {
        if (rawName == null) {
            return null;
        }
        String name = rawName.trim();
        for (String suffix : LEGACY_SUFFIXES) {
            if (name.endsWith(suffix)) {
                name = name.substring(0, name.length() - suffix.length());
                break;
            }
        }
        int dash = name.indexOf(QUALIFIER_DASH);
        if (dash > 0) {
            String base = name.substring(0, dash).trim();
            String qualifier = name.substring(dash + QUALIFIER_DASH.length()).trim();
            if (!qualifier.isEmpty()) {
                name = base + " (" + qualifier + ")";
            }
        }
        return name;
    }

    public static boolean hasLegacySuffix(String name) {
        return name != null && LEGACY_SUFFIXES.stream().anyMatch(name::endsWith);
    }
}
