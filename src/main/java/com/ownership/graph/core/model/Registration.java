package com.ownership.graph.core.model;

/**
 * A housing registration filing for one property.
 */
public record Registration(String registrationId, String boroCode, String block, String lot,
                           String borough, String houseNumber, String streetName, String zip) {

    public Registration {
        registrationId = registrationId != null ? registrationId : "";
        boroCode = boroCode != null ? boroCode : "";
        block = block != null ? block : "";
        lot = lot != null ? lot : "";
        borough = borough != null ? borough : "";
        houseNumber = houseNumber != null ? houseNumber.trim() : "";
        streetName = streetName != null ? streetName.trim() : "";
        zip = zip != null ? zip : "";
    }

    public PropertyId propertyId() {
        return PropertyId.of(boroCode, block, lot);
    }

    /**
     * House number and street name, or an empty string when the filing has no house number.
     */
    public String streetAddress() {
        if (houseNumber.isEmpty()) {
            return "";
        }
        return (houseNumber + " " + streetName).trim();
    }
}
