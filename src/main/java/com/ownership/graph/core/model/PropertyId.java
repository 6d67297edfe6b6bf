package com.ownership.graph.core.model;

import java.util.Objects;

/**
 * Borough-Block-Lot identifier of a tax parcel.
 * Block and lot are stored without leading zeros, so {@code 1-0100-0001} and {@code 1-100-1} are equal.
 *
 * @param boroCode borough code, {@code 1} (Manhattan) through {@code 5} (Staten Island)
 * @param block    tax block
 * @param lot      tax lot
 */
public record PropertyId(String boroCode, String block, String lot) {

    public PropertyId {
        boroCode = boroCode != null ? boroCode.trim() : "";
        block = stripLeadingZeros(block);
        lot = stripLeadingZeros(lot);
    }

    public static PropertyId of(String boroCode, String block, String lot) {
        return new PropertyId(boroCode, block, lot);
    }

    /**
     * Parses a key of the form {@code boro-block-lot}. Missing parts become empty strings.
     */
    public static PropertyId parse(String key) {
        Objects.requireNonNull(key, "key is required");
        String[] parts = key.split("-", -1);
        return new PropertyId(
                parts.length > 0 ? parts[0] : "",
                parts.length > 1 ? parts[1] : "",
                parts.length > 2 ? parts[2] : "");
    }

    /**
     * The BBL key, {@code boro-block-lot}, used as the property node label.
     */
    public String key() {
        return boroCode + "-" + block + "-" + lot;
    }

    /**
     * The ten digit BBL: borough, block padded to five digits, lot padded to four.
     */
    public String bbl() {
        return boroCode + leftPad(block, 5) + leftPad(lot, 4);
    }

    private static String stripLeadingZeros(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        int i = 0;
        while (i < trimmed.length() - 1 && trimmed.charAt(i) == '0') {
            i++;
        }
        return trimmed.substring(i);
    }

    private static String leftPad(String value, int width) {
        if (value.length() >= width) {
            return value;
        }
        return "0".repeat(width - value.length()) + value;
    }

    public String nodeId() {
        return NodeKind.PROPERTY.nodeId(key());
    }

    @Override
    public String toString() {
        return key();
    }
}
