package com.portfolioradar.common;

import java.util.Locale;

/**
 * Canonical form of asset symbols (trimmed, upper case). Every repository lookup goes through this.
 */
public final class Symbols {

    private Symbols() {
    }

    public static String normalize(String symbol) {
        if (symbol == null) {
            return null;
        }
        String s = symbol.strip();
        return s.isEmpty() ? null : s.toUpperCase(Locale.ROOT);
    }
}
