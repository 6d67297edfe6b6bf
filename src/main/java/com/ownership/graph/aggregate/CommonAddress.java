package com.ownership.graph.aggregate;

/**
 * A business mailing address and the number of edges pointing at it.
 */
public record CommonAddress(String address, int count) {
}
