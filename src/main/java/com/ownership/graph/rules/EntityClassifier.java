package com.ownership.graph.rules;

import com.ownership.graph.core.model.NodeKind;

/**
 * Decides whether a contact name denotes a business entity or a natural person.
 *
 * The decision is a heuristic over public filings (a person surnamed "Group" is
 * misclassified by a keyword rule), so it is pluggable.
 */
public interface EntityClassifier {

    /**
     * @param normalizedName a name already passed through {@link Normalizer#normalizeName(String)}
     */
    boolean isBusinessEntity(String normalizedName);

    default NodeKind classify(String normalizedName) {
        return isBusinessEntity(normalizedName) ? NodeKind.ENTITY : NodeKind.PERSON;
    }
}
