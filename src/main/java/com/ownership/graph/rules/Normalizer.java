package com.ownership.graph.rules;

import com.ownership.graph.core.model.BusinessAddress;
import com.ownership.graph.core.model.NodeKind;

import java.util.Objects;

/**
 * Canonicalizes names and addresses into comparable keys and builds deterministic node ids.
 *
 * <p>Two spellings of the same name or address map to the same key only if they are equal
 * after normalization; near-miss spellings (typos, abbreviations) stay distinct.</p>
 */
public class Normalizer {

    private final NormalizationEngine engine;
    private final EntityClassifier classifier;

    public Normalizer() {
        this(DefaultNormalizationRules.createDefaultEngine(), new KeywordEntityClassifier());
    }

    public Normalizer(NormalizationEngine engine, EntityClassifier classifier) {
        this.engine = Objects.requireNonNull(engine, "engine is required");
        this.classifier = Objects.requireNonNull(classifier, "classifier is required");
    }

    public String normalizeName(String raw) {
        return engine.normalize(raw, NormalizationTarget.NAME);
    }

    public String normalizeAddress(String raw) {
        return engine.normalize(raw, NormalizationTarget.ADDRESS);
    }

    /**
     * Matching key of a contact's business address, or an empty string when it has no street.
     */
    public String addressKey(BusinessAddress address) {
        if (address == null) {
            return "";
        }
        return normalizeAddress(address.toSingleLine());
    }

    public boolean isBusinessEntity(String name) {
        return classifier.isBusinessEntity(normalizeName(name));
    }

    /**
     * Person or Entity for the given name.
     */
    public NodeKind classify(String name) {
        return classifier.classify(normalizeName(name));
    }

    /**
     * {@code kind + ":" + normalizedLabel}. Property labels are BBL keys and pass through unchanged.
     */
    public String makeNodeId(NodeKind kind, String label) {
        Objects.requireNonNull(kind, "kind is required");
        return kind.nodeId(normalizeName(label));
    }

    public EntityClassifier getClassifier() {
        return classifier;
    }
}
