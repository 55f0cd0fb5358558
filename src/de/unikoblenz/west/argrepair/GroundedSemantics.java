package de.unikoblenz.west.argrepair;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Map;

/**
 * @brief The grounded extension: the least fixed point of the characteristic function.
 *
 * Starting from the empty set, F is applied until nothing new is added. F is monotonic on a finite lattice, so this takes at
 * most |A| rounds. The round in which an argument first appears is its defense depth.
 */
public class GroundedSemantics implements Semantics {
    @Override
    public List< BitSet > compute( SemanticsComputation computation ) {
        List< BitSet > extensions = new ArrayList< BitSet >( 1 );
        extensions.add( computation.grounded() );

        return extensions;
    }

    /**
     * @brief Iterate the characteristic function from the empty set to its least fixed point.
     * @param graph the framework
     * @param depth receives, for every member of the result, the round (starting at 1) in which it was added
     * @return the grounded extension
     */
    public static BitSet leastFixedPoint( ArgumentGraph graph, Map< Integer, Integer > depth ) {
        BitSet current = new BitSet( graph.size() );
        int round = 0;

        while ( true ) {
            BitSet next = Defense.characteristic( graph, current );

            if ( next.equals( current ) ) {
                break;
            }

            ++round;

            BitSet wave = ( BitSet ) next.clone();
            wave.andNot( current );

            for ( int a = wave.nextSetBit( 0 ); a >= 0; a = wave.nextSetBit( a + 1 ) ) {
                depth.put( a, round );
            }

            current = next;
        }

        return current;
    }
}
