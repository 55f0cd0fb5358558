package de.unikoblenz.west.argrepair;

import java.util.ArrayList;
import java.util.List;

/**
 * @brief Counter the blockers group by group, most persistent group first.
 *
 * All blockers are partitioned by the fanout policy. If that needs more defenders than the budget allows, the request is
 * infeasible at this k. Otherwise defenders are added one at a time and the goal is re-verified after each, so the plan
 * ends with the first prefix that works. With _force_ set all groups are added and verified once at the end.
 */
public class GreedyRepairStrategy implements RepairStrategy {
    public static final String NAME = "greedy";

    @Override
    public RepairOutcome plan( RepairContext context ) {
        List< String > blockers = context.blockers();
        List< List< String > > groups = context.group( blockers );

        if ( groups.size() > context.k() ) {
            return RepairOutcome.infeasible( budgetExhausted( blockers.size(), groups.size(), context.k() ), context.before() );
        }

        List< Defender > all = context.defendersFor( groups );

        if ( !context.force() ) {
            for ( int n = 1; n < all.size(); ++n ) {
                List< Defender > prefix = new ArrayList< Defender >( all.subList( 0, n ) );
                RepairContext.Verification verification = context.verify( prefix );

                if ( verification.satisfied_ ) {
                    return context.planned( prefix, verification, NAME, "goal met after countering " + countered( prefix ) + " of " + blockers.size() + " blocker(s)" );
                }
            }
        }

        RepairContext.Verification verification = context.verify( all );

        if ( !verification.satisfied_ ) {
            return RepairOutcome.infeasible( "verification failed: " + context.target() + " in " + verification.after_.accepted() + " of " + verification.after_.total() + " " + context.goal().kind() + " extensions after adding " + all.size() + " defender(s)", context.before() );
        }

        return context.planned( all, verification, NAME, "all " + blockers.size() + " blocker(s) countered by " + all.size() + " defender(s)" );
    }

    static int countered( List< Defender > defenders ) {
        int count = 0;

        for ( Defender defender : defenders ) {
            count += defender.attacks().size();
        }

        return count;
    }

    /**
     * @return e.g. "budget exhausted, 2 blockers require at least 1 group but k=0"
     */
    static String budgetExhausted( int blockers, int groups, int k ) {
        return "budget exhausted, " + blockers + " blocker" + ( blockers == 1 ? "" : "s" ) + " require" + ( blockers == 1 ? "s" : "" ) + " at least " + groups + " group" + ( groups == 1 ? "" : "s" ) + " but k=" + k;
    }
}
