package de.unikoblenz.west.argrepair;

import java.util.ArrayList;
import java.util.List;

/**
 * @brief Find a smallest set of blockers whose defeat achieves the goal.
 *
 * Subsets of the ranked blockers are tried by increasing size (iterative deepening), each size in lexicographic order of
 * rank. A subset is grouped by the fanout policy and verified on its augmented graph; the first subset that verifies is
 * returned, so the plan counters as few blockers as possible. Sizes whose group count exceeds the budget k end the search.
 */
public class ExactRepairStrategy implements RepairStrategy {
    public static final String NAME = "exact";

    @Override
    public RepairOutcome plan( RepairContext context ) {
        List< String > blockers = context.blockers();
        int n = blockers.size();

        if ( context.groupsRequired( 1 ) > context.k() ) {
            return RepairOutcome.infeasible( GreedyRepairStrategy.budgetExhausted( n, context.groupsRequired( n ), context.k() ), context.before() );
        }

        for ( int size = 1; size <= n; ++size ) {
            if ( context.groupsRequired( size ) > context.k() ) {
                ArgRepair.logger.fine( "Exact search stops at subset size " + size + ": " + context.groupsRequired( size ) + " groups exceed k=" + context.k() );
                break;
            }

            int[] chosen = new int[ size ];

            for ( int i = 0; i < size; ++i ) {
                chosen[ i ] = i;
            }

            do {
                List< String > subset = new ArrayList< String >( size );

                for ( int i : chosen ) {
                    subset.add( blockers.get( i ) );
                }

                List< Defender > defenders = context.defendersFor( context.group( subset ) );
                RepairContext.Verification verification = context.verify( defenders );

                if ( verification.satisfied_ ) {
                    return context.planned( defenders, verification, NAME, "smallest sufficient subset counters " + size + " of " + n + " blocker(s) " + subset );
                }
            } while ( nextCombination( chosen, n ) );
        }

        return RepairOutcome.infeasible( "no subset of the " + n + " blockers attackable by at most k=" + context.k() + " defender(s) (fanout=" + context.fanout() + ") achieves the goal", context.before() );
    }

    /**
     * @brief Advance _chosen_ (strictly increasing indices below _n_) to the next combination in lexicographic order.
     * @return false if _chosen_ already was the last combination
     */
    static boolean nextCombination( int[] chosen, int n ) {
        int k = chosen.length;
        int i = k - 1;

        while ( i >= 0 && chosen[ i ] == n - k + i ) {
            --i;
        }

        if ( i < 0 ) {
            return false;
        }

        ++chosen[ i ];

        for ( int j = i + 1; j < k; ++j ) {
            chosen[ j ] = chosen[ j - 1 ] + 1;
        }

        return true;
    }
}
