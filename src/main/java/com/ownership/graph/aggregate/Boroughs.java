package com.ownership.graph.aggregate;

import java.util.List;

/**
 * NYC borough names by borough code.
 */
public final class Boroughs {

    private static final List<String> NAMES =
            List.of("", "Manhattan", "Bronx", "Brooklyn", "Queens", "Staten Island");

    private Boroughs() {
    }

    /**
     * @return the borough name, or an empty string for an unknown code
     */
    public static String name(String boroCode) {
        if (boroCode == null) {
            return "";
        }
        try {
            int code = Integer.parseInt(boroCode.trim());
            return code > 0 && code < NAMES.size() ? NAMES.get(code) : "";
        } catch (NumberFormatException e) {
            return "";
        }
    }
}
