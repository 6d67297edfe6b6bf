package com.ownership.graph.rules;

/**
 * The kind of string a normalization rule is meant for.
 */
public enum NormalizationTarget {
    /** Person and business entity names. */
    NAME,
    /** Business mailing addresses. */
    ADDRESS
}
