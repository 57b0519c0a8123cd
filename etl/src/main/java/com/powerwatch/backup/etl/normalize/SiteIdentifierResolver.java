package com.powerwatch.backup.etl.normalize;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Extracts the canonical site identifier from the labels both feeds use for a site.
 *
 * Observed shapes:
 * <pre>
 *   "NODEB NAME=TAMREY1591, LOGICRNCID=141"  -> TAMREY1591
 *   "NODEB NAMETAMREY1591 LOGICRNCID141"     -> TAMREY1591  (same label after normalization)
 *   "YUCYAX0519"                             -> YUCYAX0519
 * </pre>
 *
 * Rules are tried in order and the first one that matches wins. The last rule must always match.
 */
public class SiteIdentifierResolver {
    private static final Logger log = LoggerFactory.getLogger(SiteIdentifierResolver.class);

    public static final List<SiteIdRule> DEFAULT_RULES = ImmutableList.of(
        new SiteIdRule.PatternRule("nodeb-name", Pattern.compile("NODEB\\s*NAME=?\\s*([A-Z0-9]+)")),
        new SiteIdRule.PatternRule("name", Pattern.compile("NAME=?\\s*([A-Z0-9]+)")),
        new SiteIdRule.StripNonAlphanumericRule()
    );

    /**
     * Outcome of a resolution, with the rule that produced it.
     */
    public record Resolution(String siteId, String ruleName) {}

    private final List<SiteIdRule> rules;

    public SiteIdentifierResolver() {
        this(DEFAULT_RULES);
    }

    public SiteIdentifierResolver(List<SiteIdRule> rules) {
        Preconditions.checkArgument(!rules.isEmpty(), "At least one site id rule is required");
        this.rules = ImmutableList.copyOf(rules);
    }

    /**
     * @param label free-text site label; null is passed through untouched
     */
    public @Nullable String resolve(@Nullable String label) {
        if (label == null) {
            return null;
        }
        return resolveWithRule(label).siteId();
    }

    public Resolution resolveWithRule(String label) {
        String s = label.trim().toUpperCase(Locale.ROOT);
        for (SiteIdRule rule : rules) {
            Optional<String> siteId = rule.extract(s);
            if (siteId.isPresent()) {
                log.trace("Label '{}' resolved to '{}' by rule {}", label, siteId.get(), rule.name());
                return new Resolution(siteId.get(), rule.name());
            }
        }
        throw new IllegalStateException("No site id rule matched '" + label + "'; the last rule must always match");
    }
}
