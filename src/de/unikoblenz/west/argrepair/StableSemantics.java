package de.unikoblenz.west.argrepair;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * @brief Conflict-free sets attacking every argument outside themselves.
 *
 * Every stable extension is complete, so the complete family is filtered. The result may be empty (e.g. for an odd attack cycle);
 * that is a valid answer, not an error.
 */
public class StableSemantics implements Semantics {
    @Override
    public List< BitSet > compute( SemanticsComputation computation ) {
        List< BitSet > stable = new ArrayList< BitSet >();

        for ( BitSet candidate : computation.complete() ) {
            if ( Defense.isStable( computation.graph(), candidate ) ) {
                stable.add( candidate );
            }
        }

        return stable;
    }
}
