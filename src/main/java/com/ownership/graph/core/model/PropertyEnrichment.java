package com.ownership.graph.core.model;

/**
 * Tax lot and assessment details for one property.
 */
public record PropertyEnrichment(String address, String ownerName, int units, int yearBuilt,
                                 long assessedValue, int floors, long buildingArea, String zoning) {

    public static final PropertyEnrichment EMPTY = new PropertyEnrichment("", "", 0, 0, 0, 0, 0, "");

    public PropertyEnrichment {
        address = address != null ? address : "";
        ownerName = ownerName != null ? ownerName : "";
        zoning = zoning != null ? zoning : "";
    }
}
