package de.unikoblenz.west.argrepair;

import java.util.BitSet;
import java.util.List;

/**
 * @brief Admissible sets that contain exactly the arguments they defend.
 *
 * Every complete extension contains the grounded extension, so candidates are generated by extending the grounded extension
 * with conflict-free combinations of the remaining arguments.
 */
public class CompleteSemantics implements Semantics {
    @Override
    public List< BitSet > compute( SemanticsComputation computation ) {
        return computation.complete();
    }

    /**
     * @brief The uncached enumeration, used by _SemanticsComputation_.
     */
    static List< BitSet > enumerate( SemanticsComputation computation ) {
        final ArgumentGraph graph = computation.graph();

        return computation.enumerator().enumerate( graph, computation.grounded(), new BitSet(), new ExtensionEnumerator.CandidateFilter() {
            public boolean accept( BitSet candidate ) {
                return Defense.isComplete( graph, candidate );
            }
        } );
    }
}
