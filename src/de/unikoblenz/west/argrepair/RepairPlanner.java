package de.unikoblenz.west.argrepair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * @brief Proposes new, unattacked defender arguments that make a target meet an acceptance goal.
 *
 * The planner never edits existing attacks: a plan is a list of defenders, each attacking some of the target's direct
 * attackers (blockers), and it is only reported once the goal has been re-verified on the augmented graph. The search
 * itself is delegated to the configured strategy.
 */
public class RepairPlanner {
    private final RepairConfig config_;
    private final SemanticsEngine engine_;

    public RepairPlanner() {
        this( RepairConfig.defaults() );
    }

    public RepairPlanner( RepairConfig config ) {
        config_ = config;
        engine_ = new SemanticsEngine( config.engineConfig() );
    }

    public RepairConfig config() {
        return config_;
    }

    /**
     * @brief Plan a repair for _target_.
     * @param graph the framework; it is not modified
     * @param target the argument to rescue
     * @param goal the acceptance goal
     * @param k the maximum number of defenders
     * @param fanout the maximum number of blockers attacked by one defender; 0 means unlimited
     * @param force plan even if the goal already holds
     * @return the outcome; infeasibility and search exhaustion are reported as outcomes, not exceptions
     * @throws IllegalArgumentException if _target_ is unknown or _k_ or _fanout_ is negative
     */
    public RepairOutcome planRepair( ArgumentGraph graph, String target, RepairGoal goal, int k, int fanout, boolean force ) {
        graph.argument( target );

        if ( k < 0 ) {
            throw new IllegalArgumentException( "Budget k must not be negative, got " + k );
        }

        if ( fanout < 0 ) {
            throw new IllegalArgumentException( "Fanout must not be negative, got " + fanout );
        }

        ArgRepair.logger.info( "Planning repair of " + target + " for goal " + goal + " with k=" + k + ", fanout=" + fanout + ( force ? ", forced" : "" ) + " (" + config_.strategy() + ")" );

        // Needs no enumeration
        if ( graph.isSelfAttacking( target ) ) {
            return RepairOutcome.infeasible( "self-attack: no admissible set can contain " + target, null );
        }

        ExtensionFamily family;

        try {
            family = engine_.compute( graph, EnumSet.of( goal.kind(), SemanticsKind.PREFERRED ) );
        }
        catch ( SearchExhaustedException e ) {
            ArgRepair.logger.warning( "Search exhausted while computing the initial extensions: " + e.getMessage() );
            return RepairOutcome.searchExhausted( e.getMessage(), null );
        }

        Coverage before = family.coverage( goal.kind(), target );
        boolean satisfied = goal.isSatisfiedBy( before );

        if ( satisfied && !force ) {
            return alreadySatisfied( graph, target, goal, before, "already accepted: " + target + " in " + before + " " + goal.kind() + " extension(s)" );
        }

        List< String > blockers = rankBlockers( graph, family, target );

        if ( blockers.isEmpty() ) {
            if ( satisfied ) {
                return alreadySatisfied( graph, target, goal, before, "already accepted: " + target + " has no blockers" );
            }

            return RepairOutcome.infeasible( "no blockers: " + target + " is unattacked but the goal is not met (" + before + " " + goal.kind() + " extension(s))", before );
        }

        ArgRepair.logger.fine( "Blockers of " + target + " by persistence: " + blockers );

        RepairContext context = new RepairContext( graph, target, goal, k, fanout, force, blockers, before, engine_, config_ );
        RepairOutcome outcome;

        try {
            outcome = config_.strategy().create().plan( context );
        }
        catch ( SearchExhaustedException e ) {
            ArgRepair.logger.warning( "Repair search exhausted after " + context.iterations() + " verification(s): " + e.getMessage() );
            return RepairOutcome.searchExhausted( e.getMessage(), before );
        }

        ArgRepair.logger.info( "Repair of " + target + ": " + outcome + " (" + context.iterations() + " verification(s))" );

        return outcome;
    }

    private static RepairOutcome alreadySatisfied( ArgumentGraph graph, String target, RepairGoal goal, Coverage before, String reason ) {
        RepairPlan plan = new RepairPlan( target, goal, graph, graph, new ArrayList< Defender >(), before, before, "none" );

        return RepairOutcome.alreadySatisfied( plan, reason );
    }

    /**
     * @brief The direct attackers of _target_, most persistent first: ordered by the number of preferred extensions
     *        containing them (descending), then by argument index.
     * @param family must contain the preferred semantics
     */
    public static List< String > rankBlockers( final ArgumentGraph graph, ExtensionFamily family, String target ) {
        List< String > blockers = graph.attackersOf( target );
        final Map< String, Integer > persistence = new HashMap< String, Integer >();

        for ( String b : blockers ) {
            int count = 0;

            for ( Extension e : family.extensions( SemanticsKind.PREFERRED ) ) {
                if ( e.contains( b ) ) {
                    ++count;
                }
            }

            persistence.put( b, count );
        }

        Collections.sort( blockers, new Comparator< String >() {
            @Override
            public int compare( String a, String b ) {
                int by_persistence = Integer.compare( persistence.get( b ), persistence.get( a ) );

                if ( by_persistence != 0 ) {
                    return by_persistence;
                }

                return Integer.compare( graph.indexOf( a ), graph.indexOf( b ) );
            }
        } );

        return blockers;
    }
}
