package de.unikoblenz.west.argrepair;

import java.util.Locale;

/**
 * @brief Settings of the repair planner.
 */
public class RepairConfig {
    public static final long DEFAULT_MAX_ITERATIONS = 10000L;
    public static final String DEFAULT_DEFENDER_PREFIX = "R";

    /**
     * @brief GREEDY groups all blockers by fanout; EXACT searches for the smallest set of blockers whose defeat achieves the goal.
     */
    public enum Strategy {
        GREEDY,
        EXACT;

        public static Strategy fromName( String name ) {
            if ( name != null ) {
                for ( Strategy strategy : values() ) {
                    if ( strategy.name().equalsIgnoreCase( name.trim() ) ) {
                        return strategy;
                    }
                }
            }

            throw new IllegalArgumentException( "Unknown repair strategy: \"" + name + "\". Options: greedy, exact" );
        }

        public RepairStrategy create() {
            return this == EXACT ? new ExactRepairStrategy() : new GreedyRepairStrategy();
        }

        @Override
        public String toString() {
            return name().toLowerCase( Locale.ROOT );
        }
    }

    private final Strategy strategy_;
    private final long max_iterations_;
    private final long timeout_millis_;
    private final String defender_prefix_;
    private final EngineConfig engine_config_;

    /**
     * @param strategy the search strategy
     * @param max_iterations cap on candidate verifications per planning run
     * @param timeout_millis wall-clock limit per planning run; 0 means no limit
     * @param defender_prefix prefix of generated defender ids
     * @param engine_config limits for the semantics computations done while planning
     */
    public RepairConfig( Strategy strategy, long max_iterations, long timeout_millis, String defender_prefix, EngineConfig engine_config ) {
        if ( max_iterations < 0 || timeout_millis < 0 ) {
            throw new IllegalArgumentException( "Iteration cap and timeout must not be negative" );
        }

        if ( !ArgumentGraph.isValidIdentifier( defender_prefix ) ) {
            throw new IllegalArgumentException( "Invalid defender prefix: \"" + defender_prefix + "\"" );
        }

        strategy_ = strategy;
        max_iterations_ = max_iterations;
        timeout_millis_ = timeout_millis;
        defender_prefix_ = defender_prefix;
        engine_config_ = engine_config;
    }

    public static RepairConfig defaults() {
        return new RepairConfig( Strategy.GREEDY, DEFAULT_MAX_ITERATIONS, 0L, DEFAULT_DEFENDER_PREFIX, EngineConfig.defaults() );
    }

    public Strategy strategy() {
        return strategy_;
    }

    public long maxIterations() {
        return max_iterations_;
    }

    public long timeoutMillis() {
        return timeout_millis_;
    }

    public String defenderPrefix() {
        return defender_prefix_;
    }

    public EngineConfig engineConfig() {
        return engine_config_;
    }
}
