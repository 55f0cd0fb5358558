package de.unikoblenz.west.argrepair;

import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * @brief The state of one semantics request: the framework and the intermediate results reused across semantics.
 *
 * The grounded extension and the complete family are computed at most once per request. Instances are confined to the thread
 * serving the request and never shared.
 */
public class SemanticsComputation {
    private final ArgumentGraph graph_;
    private final ExtensionEnumerator enumerator_;
    private BitSet grounded_;
    private Map< Integer, Integer > depth_;
    private List< BitSet > complete_;

    public SemanticsComputation( ArgumentGraph graph, ExtensionEnumerator enumerator ) {
        graph_ = graph;
        enumerator_ = enumerator;
    }

    public ArgumentGraph graph() {
        return graph_;
    }

    public ExtensionEnumerator enumerator() {
        return enumerator_;
    }

    /**
     * @return a copy of the grounded extension
     */
    public BitSet grounded() {
        if ( grounded_ == null ) {
            depth_ = new HashMap< Integer, Integer >();
            grounded_ = GroundedSemantics.leastFixedPoint( graph_, depth_ );
        }

        return ( BitSet ) grounded_.clone();
    }

    /**
     * @return argument index -> round in which it entered the grounded extension
     */
    public Map< Integer, Integer > defenseDepth() {
        grounded();

        return depth_;
    }

    /**
     * @return the complete extensions
     */
    public List< BitSet > complete() {
        if ( complete_ == null ) {
            complete_ = CompleteSemantics.enumerate( this );
        }

        return complete_;
    }
}
