package com.ownership.graph.core.model;

/**
 * Business mailing address of a registration contact. Blank parts are empty strings.
 */
public record BusinessAddress(String houseNumber, String streetName, String apartment,
                              String city, String state, String zip) {

    public static final BusinessAddress EMPTY = new BusinessAddress("", "", "", "", "", "");

    public BusinessAddress {
        houseNumber = clean(houseNumber);
        streetName = clean(streetName);
        apartment = clean(apartment);
        city = clean(city);
        state = clean(state);
        zip = clean(zip);
    }

    public boolean hasStreet() {
        return !houseNumber.isEmpty() || !streetName.isEmpty();
    }

    /**
     * Street line followed by city, state and zip, without the apartment.
     * Unit markers would otherwise cut off everything after them during normalization.
     */
    public String toSingleLine() {
        if (!hasStreet()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        append(sb, houseNumber);
        append(sb, streetName);
        append(sb, city);
        append(sb, state);
        append(sb, zip);
        return sb.toString();
    }

    private static void append(StringBuilder sb, String part) {
        if (part.isEmpty()) {
            return;
        }
        if (sb.length() > 0) {
            sb.append(' ');
        }
        sb.append(part);
    }

    private static String clean(String s) {
        return s != null ? s.trim() : "";
    }
}
