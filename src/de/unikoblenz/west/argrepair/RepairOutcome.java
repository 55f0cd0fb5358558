package de.unikoblenz.west.argrepair;

/**
 * @brief The result of a planning run. Only PLANNED and ALREADY_SATISFIED carry a plan; every status carries a reason.
 */
public class RepairOutcome {
    public enum Status {
        PLANNED,
        ALREADY_SATISFIED,
        INFEASIBLE,
        SEARCH_EXHAUSTED
    }

    private final Status status_;
    private final RepairPlan plan_;
    private final String reason_;
    private final Coverage before_;

    private RepairOutcome( Status status, RepairPlan plan, String reason, Coverage before ) {
        status_ = status;
        plan_ = plan;
        reason_ = reason;
        before_ = before;
    }

    public static RepairOutcome planned( RepairPlan plan, String reason ) {
        return new RepairOutcome( Status.PLANNED, plan, reason, plan.before() );
    }

    public static RepairOutcome alreadySatisfied( RepairPlan plan, String reason ) {
        return new RepairOutcome( Status.ALREADY_SATISFIED, plan, reason, plan.before() );
    }

    public static RepairOutcome infeasible( String reason, Coverage before ) {
        return new RepairOutcome( Status.INFEASIBLE, null, reason, before );
    }

    public static RepairOutcome searchExhausted( String reason, Coverage before ) {
        return new RepairOutcome( Status.SEARCH_EXHAUSTED, null, reason, before );
    }

    public Status status() {
        return status_;
    }

    /**
     * @return true if the goal holds on the returned plan's augmented graph
     */
    public boolean isSuccess() {
        return status_ == Status.PLANNED || status_ == Status.ALREADY_SATISFIED;
    }

    /**
     * @return the plan, or null for INFEASIBLE and SEARCH_EXHAUSTED
     */
    public RepairPlan plan() {
        return plan_;
    }

    public String reason() {
        return reason_;
    }

    /**
     * @return the coverage of the target on the original graph
     */
    public Coverage before() {
        return before_;
    }

    @Override
    public String toString() {
        return status_ + ": " + reason_;
    }
}
