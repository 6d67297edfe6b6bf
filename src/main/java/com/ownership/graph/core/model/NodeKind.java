package com.ownership.graph.core.model;

/**
 * The four kinds of node an ownership crawl produces.
 * Each kind carries the lower-case prefix used in deterministic node ids.
 */
public enum NodeKind {
    PERSON("person", "Person"),
    ENTITY("entity", "Entity"),
    ADDRESS("address", "Address"),
    PROPERTY("property", "Property");

    private final String idPrefix;
    private final String label;

    NodeKind(String idPrefix, String label) {
        this.idPrefix = idPrefix;
        this.label = label;
    }

    public String getIdPrefix() {
        return idPrefix;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Builds the node id for an already-normalized label, e.g. {@code entity:ABC REALTY LLC}.
     */
    public String nodeId(String normalizedLabel) {
        return idPrefix + ":" + normalizedLabel;
    }

    /**
     * Person or Entity, the kinds that represent a named contact.
     */
    public boolean isNamed() {
        return this == PERSON || this == ENTITY;
    }
}
