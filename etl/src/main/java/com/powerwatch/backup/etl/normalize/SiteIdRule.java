package com.powerwatch.backup.etl.normalize;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One step of site identifier extraction. Rules are tried in order by {@link SiteIdentifierResolver};
 * a rule that does not recognise the label returns empty.
 */
public interface SiteIdRule {

    String name();

    /**
     * @param label trimmed, upper-cased label
     */
    Optional<String> extract(String label);

    /**
     * Rule returning the first capture group of the first match of {@code pattern}.
     */
    record PatternRule(String name, Pattern pattern) implements SiteIdRule {
        @Override
        public Optional<String> extract(String label) {
            Matcher m = pattern.matcher(label);
            if (m.find()) {
                return Optional.of(m.group(1).trim());
            }
            return Optional.empty();
        }
    }

    /**
     * Rule that always matches, keeping only the letters and digits of the label.
     */
    record StripNonAlphanumericRule() implements SiteIdRule {
        private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^A-Z0-9]");

        @Override
        public String name() {
            return "stripped-label";
        }

        @Override
        public Optional<String> extract(String label) {
            return Optional.of(NON_ALPHANUMERIC.matcher(label).replaceAll(""));
        }
    }
}
