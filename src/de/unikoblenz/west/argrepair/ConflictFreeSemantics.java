package de.unikoblenz.west.argrepair;

import java.util.BitSet;
import java.util.List;

/**
 * @brief All conflict-free sets, the empty set included.
 */
public class ConflictFreeSemantics implements Semantics {
    @Override
    public List< BitSet > compute( SemanticsComputation computation ) {
        ArgumentGraph graph = computation.graph();

        return computation.enumerator().enumerate( graph, new BitSet(), new BitSet(), new ExtensionEnumerator.CandidateFilter() {
            public boolean accept( BitSet candidate ) {
                return true;
            }
        } );
    }
}
