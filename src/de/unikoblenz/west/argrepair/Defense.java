package de.unikoblenz.west.argrepair;

import java.util.BitSet;

/**
 * @brief Set-theoretic building blocks of Dung's semantics, on argument index sets.
 *
 * All methods are pure; none of them modifies its arguments.
 */
public final class Defense {
    private Defense() {
    }

    /**
     * @return the set of arguments attacked by some member of _s_
     */
    public static BitSet attackedBy( ArgumentGraph graph, BitSet s ) {
        BitSet attacked = new BitSet( graph.size() );

        for ( int i = s.nextSetBit( 0 ); i >= 0; i = s.nextSetBit( i + 1 ) ) {
            attacked.or( graph.outgoing( i ) );
        }

        return attacked;
    }

    /**
     * @brief A set is conflict-free iff no member attacks a member.
     */
    public static boolean isConflictFree( ArgumentGraph graph, BitSet s ) {
        return !attackedBy( graph, s ).intersects( s );
    }

    /**
     * @brief _s_ defends _a_ iff every attacker of _a_ is attacked by some member of _s_.
     * @param attacked_by_s the precomputed result of _attackedBy( graph, s )_
     */
    public static boolean defends( ArgumentGraph graph, BitSet attacked_by_s, int a ) {
        BitSet undefeated = ( BitSet ) graph.incoming( a ).clone();
        undefeated.andNot( attacked_by_s );

        return undefeated.isEmpty();
    }

    /**
     * @brief The characteristic function F(S) = { a : S defends a }.
     */
    public static BitSet characteristic( ArgumentGraph graph, BitSet s ) {
        BitSet attacked = attackedBy( graph, s );
        BitSet defended = new BitSet( graph.size() );

        for ( int a = 0; a < graph.size(); ++a ) {
            if ( defends( graph, attacked, a ) ) {
                defended.set( a );
            }
        }

        return defended;
    }

    /**
     * @brief Conflict-free and defends each of its members.
     */
    public static boolean isAdmissible( ArgumentGraph graph, BitSet s ) {
        BitSet attacked = attackedBy( graph, s );

        if ( attacked.intersects( s ) ) {
            return false;
        }

        for ( int a = s.nextSetBit( 0 ); a >= 0; a = s.nextSetBit( a + 1 ) ) {
            if ( !defends( graph, attacked, a ) ) {
                return false;
            }
        }

        return true;
    }

    /**
     * @brief Conflict-free and a fixed point of the characteristic function (admissibility follows).
     */
    public static boolean isComplete( ArgumentGraph graph, BitSet s ) {
        return isConflictFree( graph, s ) && characteristic( graph, s ).equals( s );
    }

    /**
     * @brief The range S ∪ S+, i.e. the members together with everything they attack.
     */
    public static BitSet range( ArgumentGraph graph, BitSet s ) {
        BitSet range = attackedBy( graph, s );
        range.or( s );

        return range;
    }

    /**
     * @brief Conflict-free and attacks every argument outside itself.
     */
    public static boolean isStable( ArgumentGraph graph, BitSet s ) {
        return isConflictFree( graph, s ) && range( graph, s ).cardinality() == graph.size();
    }

    /**
     * @brief A naive set is a conflict-free set to which no further argument can be added without conflict.
     */
    public static boolean isNaive( ArgumentGraph graph, BitSet s ) {
        if ( !isConflictFree( graph, s ) ) {
            return false;
        }

        BitSet conflicting = range( graph, s );

        for ( int i = s.nextSetBit( 0 ); i >= 0; i = s.nextSetBit( i + 1 ) ) {
            conflicting.or( graph.incoming( i ) );
        }

        for ( int a = conflicting.nextClearBit( 0 ); a < graph.size(); a = conflicting.nextClearBit( a + 1 ) ) {
            if ( !graph.isSelfAttacking( a ) ) {
                return false;
            }
        }

        return true;
    }
}
