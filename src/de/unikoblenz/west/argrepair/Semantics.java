package de.unikoblenz.west.argrepair;

import java.util.BitSet;
import java.util.List;

/**
 * @brief An acceptability semantics for abstract argumentation frameworks.
 *
 * Supported semantics are listed in _SemanticsKind_:
 *     Conflict-free, Admissible, Complete, Grounded (unique), Preferred (subset-maximal complete),
 *     Stable (conflict-free and attacking everything outside), Stage (range-maximal conflict-free)
 *     and Semi-stable (range-maximal complete).
 */
public interface Semantics {
    /**
     * @brief Computes the extensions of this semantics.
     * @param computation the framework together with the intermediate results shared by all semantics of one request
     * @return the extensions as argument index sets, without duplicates, in no particular order. May be empty.
     */
    public List< BitSet > compute( SemanticsComputation computation );
}
