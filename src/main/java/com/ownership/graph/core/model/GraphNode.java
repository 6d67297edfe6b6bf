package com.ownership.graph.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A node of the ownership graph: a person, a business entity, a mailing address or a property.
 *
 * Nodes are identified solely by their deterministic id, so two mentions of the same
 * normalized name (or the same BBL) are the same node. Attributes are a free-form string
 * payload filled in as the crawl discovers more about the node.
 */
public final class GraphNode {

    public static final String ATTR_BORO_CODE = "boroCode";
    public static final String ATTR_BLOCK = "block";
    public static final String ATTR_LOT = "lot";
    public static final String ATTR_BOROUGH = "borough";
    public static final String ATTR_STREET_ADDRESS = "streetAddress";
    public static final String ATTR_ZIP = "zip";

    private final String id;
    private final NodeKind kind;
    private final String label;
    private final Map<String, String> attributes;

    private GraphNode(Builder builder) {
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.label = Objects.requireNonNull(builder.label, "label is required");
        this.id = builder.id != null ? builder.id : kind.nodeId(label);
        this.attributes = builder.attributes != null ? Map.copyOf(builder.attributes) : Map.of();
    }

    public String getId() {
        return id;
    }

    public NodeKind getKind() {
        return kind;
    }

    public String getLabel() {
        return label;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    /**
     * Returns the attribute value, or an empty string when absent.
     */
    public String attribute(String key) {
        return attributes.getOrDefault(key, "");
    }

    /**
     * Returns a copy of this node whose attributes are completed with the given ones.
     * Existing non-blank values are kept; blank or missing values are filled in.
     */
    public GraphNode mergedWith(Map<String, String> more) {
        if (more == null || more.isEmpty()) {
            return this;
        }
        Map<String, String> merged = new LinkedHashMap<>(attributes);
        more.forEach((key, value) -> {
            if (value == null || value.isBlank()) {
                return;
            }
            String current = merged.get(key);
            if (current == null || current.isBlank()) {
                merged.put(key, value);
            }
        });
        if (merged.equals(attributes)) {
            return this;
        }
        return toBuilder().attributes(merged).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .kind(kind)
                .label(label)
                .attributes(attributes);
    }

    /**
     * Creates a property node carrying its BBL parts as attributes.
     */
    public static GraphNode property(PropertyId propertyId) {
        Map<String, String> attrs = new LinkedHashMap<>();
        attrs.put(ATTR_BORO_CODE, propertyId.boroCode());
        attrs.put(ATTR_BLOCK, propertyId.block());
        attrs.put(ATTR_LOT, propertyId.lot());
        return builder()
                .kind(NodeKind.PROPERTY)
                .label(propertyId.key())
                .attributes(attrs)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphNode that = (GraphNode) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "GraphNode{" +
                "id='" + id + '\'' +
                ", kind=" + kind +
                ", label='" + label + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private NodeKind kind;
        private String label;
        private Map<String, String> attributes;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(NodeKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder attributes(Map<String, String> attributes) {
            this.attributes = attributes;
            return this;
        }

        public GraphNode build() {
            return new GraphNode(this);
        }
    }
}
