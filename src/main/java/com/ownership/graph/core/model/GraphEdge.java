package com.ownership.graph.core.model;

import java.util.Objects;

/**
 * A directed, labeled relation between two nodes.
 * Edges have no identity of their own: two filings linking the same pair both survive.
 *
 * @param from   id of the originating node (a person or entity)
 * @param to     id of the target node (a property or address)
 * @param source name of the adapter that produced the relation
 * @param role   relation kind, e.g. a contact role or {@link #ROLE_REGISTRATION}
 */
public record GraphEdge(String from, String to, String source, String role) {

    public static final String ROLE_BUSINESS_ADDRESS = "business_address";
    public static final String ROLE_SHARED_BUSINESS_ADDRESS = "shared_business_address";
    public static final String ROLE_REGISTRATION = "registration";

    public GraphEdge {
        Objects.requireNonNull(from, "from is required");
        Objects.requireNonNull(to, "to is required");
        source = source != null ? source : "";
        role = role != null ? role : "";
    }

    /**
     * Returns the endpoint opposite to {@code nodeId}.
     */
    public String otherEnd(String nodeId) {
        return from.equals(nodeId) ? to : from;
    }

    public boolean touches(String nodeId) {
        return from.equals(nodeId) || to.equals(nodeId);
    }
}
