package com.ownership.graph.rules;

import java.util.ArrayList;
import java.util.List;

import static com.ownership.graph.rules.NormalizationTarget.ADDRESS;
import static com.ownership.graph.rules.NormalizationTarget.NAME;

/**
 * Built-in rules for housing registration names and business addresses.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates an engine with the name, address and common rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        List<NormalizationRule> rules = new ArrayList<>();
        rules.addAll(getNameRules());
        rules.addAll(getAddressRules());
        rules.addAll(getCommonRules());
        return new NormalizationEngine(rules);
    }

    public static List<NormalizationRule> getNameRules() {
        return List.of(
                // "O'Brien, LLC." and "OBRIEN LLC" must produce the same key
                NormalizationRule.of("name-punctuation", "[,.'\"‘’“”]", "", 10, NAME)
        );
    }

    public static List<NormalizationRule> getAddressRules() {
        return List.of(
                NormalizationRule.of("address-punctuation", "[,.'\"‘’“”#]", "", 10, ADDRESS),
                // Unit designators and everything after them
                NormalizationRule.of("address-unit-marker", "\\b(APT|APARTMENT|SUITE|STE|UNIT)\\b.*$", "", 20, ADDRESS)
        );
    }

    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                NormalizationRule.of("common-collapse-spaces", "\\s+", " ", 200)
        );
    }
}
