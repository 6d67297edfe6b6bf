package com.ownership.graph.rules;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Classifies a name as a business entity when it contains a corporate-form keyword as a whole word.
 */
public class KeywordEntityClassifier implements EntityClassifier {

    public static final Set<String> DEFAULT_KEYWORDS = Set.of(
            "LLC", "INC", "CORP", "CORPORATION", "CO", "LTD", "LP", "TRUST",
            "REALTY", "PROPERTIES", "MANAGEMENT", "HOLDINGS", "GROUP", "ENTERPRISES",
            "ASSOC", "ASSOCIATES", "PARTNERSHIP", "COMPANY");

    private final Set<String> keywords;
    private final Pattern pattern;

    public KeywordEntityClassifier() {
        this(DEFAULT_KEYWORDS);
    }

    public KeywordEntityClassifier(Set<String> keywords) {
        if (keywords == null || keywords.isEmpty()) {
            throw new IllegalArgumentException("keywords must not be empty");
        }
        this.keywords = keywords.stream()
                .map(k -> k.trim().toUpperCase(Locale.ROOT))
                .filter(k -> !k.isEmpty())
                .collect(Collectors.toCollection(TreeSet::new));
        String alternation = this.keywords.stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        this.pattern = Pattern.compile("\\b(" + alternation + ")\\b", Pattern.CASE_INSENSITIVE);
    }

    @Override
    public boolean isBusinessEntity(String normalizedName) {
        if (normalizedName == null || normalizedName.isBlank()) {
            return false;
        }
        return pattern.matcher(normalizedName).find();
    }

    public Set<String> getKeywords() {
        return Set.copyOf(keywords);
    }
}
