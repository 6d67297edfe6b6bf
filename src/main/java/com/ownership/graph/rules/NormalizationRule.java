package com.ownership.graph.rules;

import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A named, case-insensitive regex rewrite. Rules with lower priority run first.
 *
 * @param targets inputs the rule applies to; empty means every target
 */
public record NormalizationRule(String name, Pattern pattern, String replacement,
                                Set<NormalizationTarget> targets, int priority) {

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
        targets = targets != null ? Set.copyOf(targets) : Set.of();
    }

    public static NormalizationRule of(String name, String regex, String replacement, int priority,
                                       NormalizationTarget... targets) {
        return new NormalizationRule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE),
                replacement, Set.of(targets), priority);
    }

    public boolean appliesTo(NormalizationTarget target) {
        return targets.isEmpty() || targets.contains(target);
    }

    public String apply(String input) {
        return pattern.matcher(input).replaceAll(replacement);
    }
}
