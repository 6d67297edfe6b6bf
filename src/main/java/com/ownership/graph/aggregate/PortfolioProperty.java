package com.ownership.graph.aggregate;

import java.util.List;

/**
 * One property of the portfolio, with tax lot details when they could be found.
 *
 * @param connectedVia labels of up to a few nodes directly linked to the property
 */
public record PortfolioProperty(
        String bbl,
        String address,
        String borough,
        String boroCode,
        String block,
        String lot,
        int units,
        int yearBuilt,
        long assessedValue,
        int numFloors,
        long buildingArea,
        String zoning,
        String ownerName,
        List<String> connectedVia
) {
    public PortfolioProperty {
        connectedVia = connectedVia != null ? List.copyOf(connectedVia) : List.of();
    }
}
