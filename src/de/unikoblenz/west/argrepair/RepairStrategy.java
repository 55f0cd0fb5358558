package de.unikoblenz.west.argrepair;

/**
 * @brief A way of choosing defenders for a target.
 *
 * Strategies are only invoked for a target that is not self-attacking and has at least one blocker. Whatever they return as
 * PLANNED must have been verified through _RepairContext.verify_.
 */
public interface RepairStrategy {
    /**
     * @param context the planning request and its shared helpers
     * @return a PLANNED or INFEASIBLE outcome
     * @throws SearchExhaustedException if the iteration or time cap is hit
     */
    public RepairOutcome plan( RepairContext context );
}
