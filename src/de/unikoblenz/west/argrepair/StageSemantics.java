package de.unikoblenz.west.argrepair;

import java.util.BitSet;
import java.util.List;

/**
 * @brief Conflict-free sets whose range is maximal w.r.t. set inclusion among all conflict-free sets.
 *
 * A conflict-free set with maximal range cannot be extended by another argument (the added argument would enlarge the range),
 * so only naive sets are collected before the range filter is applied.
 */
public class StageSemantics implements Semantics {
    @Override
    public List< BitSet > compute( SemanticsComputation computation ) {
        final ArgumentGraph graph = computation.graph();

        List< BitSet > naive = computation.enumerator().enumerate( graph, new BitSet(), new BitSet(), new ExtensionEnumerator.CandidateFilter() {
            public boolean accept( BitSet candidate ) {
                return Defense.isNaive( graph, candidate );
            }
        } );

        return MaximalityFilter.rangeMaximal( graph, naive );
    }
}
