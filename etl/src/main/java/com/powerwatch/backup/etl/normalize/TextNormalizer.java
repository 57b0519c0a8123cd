package com.powerwatch.backup.etl.normalize;

import javax.annotation.Nullable;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form for the free-text fields of both feeds: trimmed, upper case, only {@code [A-Z0-9 ]},
 * single spaces. Output is stable under re-application.
 */
public final class TextNormalizer {

    private static final Pattern DISALLOWED = Pattern.compile("[^A-Z0-9 ]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    /**
     * @param raw text to normalize; null is passed through untouched
     */
    public static @Nullable String normalize(@Nullable String raw) {
        if (raw == null) {
            return null;
        }
        String s = raw.trim().toUpperCase(Locale.ROOT);
        s = DISALLOWED.matcher(s).replaceAll("");
        s = WHITESPACE_RUN.matcher(s).replaceAll(" ");
        // stripping a leading or trailing symbol can expose a space, e.g. "- A"
        return s.strip();
    }
}
