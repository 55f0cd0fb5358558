package de.unikoblenz.west.argrepair;

/**
 * @brief Where an attack edge came from.
 *
 * Kept for auditing only; all edges are treated identically when extensions are computed.
 */
public enum EdgeProvenance {
    EXPLICIT,
    HEURISTIC,
    PROPOSED
}
