package de.unikoblenz.west.argrepair;

import java.util.BitSet;
import java.util.List;

/**
 * @brief Admissible sets that are maximal w.r.t. set inclusion.
 *
 * Every preferred extension is complete, so the subset-maximal complete extensions are exactly the preferred ones.
 * All maximal sets are reported; there is no tie-break.
 */
public class PreferredSemantics implements Semantics {
    @Override
    public List< BitSet > compute( SemanticsComputation computation ) {
        return MaximalityFilter.subsetMaximal( computation.complete() );
    }
}
