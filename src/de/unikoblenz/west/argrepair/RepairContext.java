package de.unikoblenz.west.argrepair;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * @brief One planning request: the target, its goal and budget, the ranked blockers, and the helpers shared by all strategies
 *        (grouping, defender naming, verification, and the iteration/time budget).
 */
public class RepairContext {
    private final ArgumentGraph graph_;
    private final String target_;
    private final RepairGoal goal_;
    private final int k_;
    private final int fanout_;
    private final boolean force_;
    private final List< String > blockers_;
    private final Coverage before_;
    private final SemanticsEngine engine_;
    private final RepairConfig config_;
    private final long deadline_millis_;
    private long iterations_;

    /**
     * @brief Result of re-running the semantics on a candidate augmented graph.
     */
    public static class Verification {
        public final ArgumentGraph augmented_;
        public final Coverage after_;
        public final boolean satisfied_;

        Verification( ArgumentGraph augmented, Coverage after, boolean satisfied ) {
            augmented_ = augmented;
            after_ = after;
            satisfied_ = satisfied;
        }
    }

    public RepairContext( ArgumentGraph graph, String target, RepairGoal goal, int k, int fanout, boolean force, List< String > blockers, Coverage before, SemanticsEngine engine, RepairConfig config ) {
        graph_ = graph;
        target_ = target;
        goal_ = goal;
        k_ = k;
        fanout_ = fanout;
        force_ = force;
        blockers_ = blockers;
        before_ = before;
        engine_ = engine;
        config_ = config;
        deadline_millis_ = config.timeoutMillis() > 0 ? System.currentTimeMillis() + config.timeoutMillis() : 0L;
        iterations_ = 0;
    }

    public ArgumentGraph graph() {
        return graph_;
    }

    public String target() {
        return target_;
    }

    public RepairGoal goal() {
        return goal_;
    }

    /**
     * @return the node budget: the maximum number of defenders
     */
    public int k() {
        return k_;
    }

    /**
     * @return the maximum number of blockers per defender; 0 means unlimited
     */
    public int fanout() {
        return fanout_;
    }

    public boolean force() {
        return force_;
    }

    /**
     * @return the direct attackers of the target, most persistent first
     */
    public List< String > blockers() {
        return blockers_;
    }

    public Coverage before() {
        return before_;
    }

    public long iterations() {
        return iterations_;
    }

    /**
     * @brief Account for one unit of search work.
     * @throws SearchExhaustedException if the iteration cap or the deadline has been reached
     */
    public void tick() {
        if ( iterations_ >= config_.maxIterations() ) {
            throw new SearchExhaustedException( "repair search exceeded " + config_.maxIterations() + " iterations" );
        }

        if ( deadline_millis_ != 0L && System.currentTimeMillis() > deadline_millis_ ) {
            throw new SearchExhaustedException( "repair search exceeded " + config_.timeoutMillis() + " ms" );
        }

        ++iterations_;
    }

    /**
     * @return how many defenders are needed to attack _blocker_count_ blockers under the fanout policy
     */
    public int groupsRequired( int blocker_count ) {
        if ( blocker_count == 0 ) {
            return 0;
        }

        if ( fanout_ <= 0 ) {
            return 1;
        }

        return ( blocker_count + fanout_ - 1 ) / fanout_;
    }

    /**
     * @brief Partition blockers, in order, into consecutive groups of at most _fanout_ members (a single group if fanout is 0).
     */
    public List< List< String > > group( List< String > blockers ) {
        List< List< String > > groups = new ArrayList< List< String > >();

        if ( blockers.isEmpty() ) {
            return groups;
        }

        int size = fanout_ <= 0 ? blockers.size() : fanout_;

        for ( int from = 0; from < blockers.size(); from += size ) {
            groups.add( new ArrayList< String >( blockers.subList( from, Math.min( from + size, blockers.size() ) ) ) );
        }

        return groups;
    }

    /**
     * @brief One defender per group, named with the configured prefix and the first free numbers (R1, R2, ...).
     */
    public List< Defender > defendersFor( List< List< String > > groups ) {
        Set< String > used = new HashSet< String >( graph_.argumentIds() );
        List< Defender > defenders = new ArrayList< Defender >( groups.size() );
        int number = 1;

        for ( List< String > group : groups ) {
            String id = config_.defenderPrefix() + number;

            while ( used.contains( id ) ) {
                ++number;
                id = config_.defenderPrefix() + number;
            }

            used.add( id );
            defenders.add( new Defender( id, group ) );
        }

        return defenders;
    }

    /**
     * @brief Build the augmented graph from explicit edges only and re-run the goal's semantics on it. Counts as one iteration.
     */
    public Verification verify( List< Defender > defenders ) {
        tick();

        ArgumentGraph augmented = graph_.augment( defenders );
        ExtensionFamily family = engine_.compute( augmented, goal_.kind() );
        Coverage after = family.coverage( goal_.kind(), target_ );
        boolean satisfied = goal_.isSatisfiedBy( after );

        ArgRepair.logger.fine( "Verified " + defenders + ": " + target_ + " in " + after + " " + goal_.kind() + " extension(s), goal " + ( satisfied ? "met" : "not met" ) );

        return new Verification( augmented, after, satisfied );
    }

    /**
     * @brief Wrap a successful verification into a PLANNED outcome.
     */
    public RepairOutcome planned( List< Defender > defenders, Verification verification, String strategy, String reason ) {
        RepairPlan plan = new RepairPlan( target_, goal_, graph_, verification.augmented_, defenders, before_, verification.after_, strategy );

        return RepairOutcome.planned( plan, reason );
    }
}
