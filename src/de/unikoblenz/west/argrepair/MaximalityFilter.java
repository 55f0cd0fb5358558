package de.unikoblenz.west.argrepair;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * @brief Keeps the maximal members of a family of argument sets, either by the sets themselves or by their ranges.
 *
 * Both filters only compare pairs of candidates, so the result does not depend on the order in which candidates were found.
 */
public final class MaximalityFilter {
    private MaximalityFilter() {
    }

    /**
     * @return the candidates that are not a proper subset of another candidate (duplicates removed)
     */
    public static List< BitSet > subsetMaximal( List< BitSet > candidates ) {
        List< BitSet > distinct = new ArrayList< BitSet >( new LinkedHashSet< BitSet >( candidates ) );

        return maximal( distinct, distinct );
    }

    /**
     * @return the candidates whose range is not a proper subset of another candidate's range (duplicates removed)
     */
    public static List< BitSet > rangeMaximal( ArgumentGraph graph, List< BitSet > candidates ) {
        List< BitSet > distinct = new ArrayList< BitSet >( new LinkedHashSet< BitSet >( candidates ) );
        List< BitSet > ranges = new ArrayList< BitSet >( distinct.size() );

        for ( BitSet candidate : distinct ) {
            ranges.add( Defense.range( graph, candidate ) );
        }

        return maximal( distinct, ranges );
    }

    /**
     * @brief Keep candidate i iff keys[i] is not a proper subset of any other key.
     */
    private static List< BitSet > maximal( List< BitSet > candidates, List< BitSet > keys ) {
        List< BitSet > kept = new ArrayList< BitSet >();

        Outer: for ( int i = 0; i < candidates.size(); ++i ) {
            BitSet key = keys.get( i );

            for ( int j = 0; j < candidates.size(); ++j ) {
                if ( i != j && isProperSubset( key, keys.get( j ) ) ) {
                    continue Outer;
                }
            }

            kept.add( candidates.get( i ) );
        }

        return kept;
    }

    static boolean isProperSubset( BitSet a, BitSet b ) {
        if ( a.cardinality() >= b.cardinality() ) {
            return false;
        }

        BitSet rest = ( BitSet ) a.clone();
        rest.andNot( b );

        return rest.isEmpty();
    }
}
