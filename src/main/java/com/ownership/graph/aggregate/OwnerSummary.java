package com.ownership.graph.aggregate;

import com.ownership.graph.core.model.NodeKind;

import java.util.List;

/**
 * A person or business entity of the portfolio.
 *
 * @param name          normalized name
 * @param kind          {@link NodeKind#PERSON} or {@link NodeKind#ENTITY}
 * @param roles         distinct roles of the edges touching the node
 * @param addresses     distinct labels of linked address nodes
 * @param propertyCount edges linking the node to a property; repeated filings count again
 */
public record OwnerSummary(String name, NodeKind kind, List<String> roles, List<String> addresses, int propertyCount) {

    public OwnerSummary {
        roles = roles != null ? List.copyOf(roles) : List.of();
        addresses = addresses != null ? List.copyOf(addresses) : List.of();
    }
}
