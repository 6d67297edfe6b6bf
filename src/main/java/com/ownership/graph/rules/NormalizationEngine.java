package com.ownership.graph.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Applies normalization rules to raw names and addresses.
 * Input is upper-cased first, then rules run in priority order,
 * and the result is trimmed with internal whitespace collapsed.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = rules.stream()
                .sorted(Comparator.comparingInt(NormalizationRule::priority))
                .toList();
    }

    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * Normalizes the raw string with the rules scoped to {@code target}.
     * Null and blank input normalize to the empty string.
     */
    public String normalize(String raw, NormalizationTarget target) {
        if (raw == null || raw.isBlank()) {
            return "";
        }

        String result = raw.toUpperCase(Locale.ROOT);
        for (NormalizationRule rule : rules) {
            if (!rule.appliesTo(target)) {
                continue;
            }
            String before = result;
            result = rule.apply(result);
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("Rule '{}' transformed '{}' -> '{}'", rule.name(), before, result);
            }
        }

        return result.trim().replaceAll("\\s+", " ");
    }
}
