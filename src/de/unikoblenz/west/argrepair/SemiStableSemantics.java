package de.unikoblenz.west.argrepair;

import java.util.BitSet;
import java.util.List;

/**
 * @brief Complete sets whose range is maximal w.r.t. set inclusion among all complete sets.
 */
public class SemiStableSemantics implements Semantics {
    @Override
    public List< BitSet > compute( SemanticsComputation computation ) {
        return MaximalityFilter.rangeMaximal( computation.graph(), computation.complete() );
    }
}
