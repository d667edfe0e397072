package org.astx.serialization;

/**
 * Selects which form of the structural representation a node produces.
 */
public enum StructMode {
    /**
     * Export form: plain keys, source location and comment included when set.
     * JSON and YAML are always written in this form.
     */
    FULL,
    /**
     * Visualization form: every key carries the node identity token so that
     * structurally identical siblings never share a mapping key. No metadata.
     */
    SIMPLIFIED,
    /**
     * Comparison form: plain keys, no metadata. Used for structural equality.
     */
    SEMANTIC
}
