package de.unikoblenz.west.argrepair;

import java.util.BitSet;
import java.util.List;

/**
 * @brief Conflict-free sets that defend each of their members.
 */
public class AdmissibleSemantics implements Semantics {
    @Override
    public List< BitSet > compute( SemanticsComputation computation ) {
        final ArgumentGraph graph = computation.graph();

        return computation.enumerator().enumerate( graph, new BitSet(), new BitSet(), new ExtensionEnumerator.CandidateFilter() {
            public boolean accept( BitSet candidate ) {
                return Defense.isAdmissible( graph, candidate );
            }
        } );
    }
}
