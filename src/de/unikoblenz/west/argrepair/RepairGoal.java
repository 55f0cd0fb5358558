package de.unikoblenz.west.argrepair;

import java.util.Locale;

/**
 * @brief What a repair has to achieve for its target: acceptance under a semantics, in a mode, optionally with a coverage threshold.
 *
 * Skeptical goals always carry an explicit coverage threshold; there is no silent default.
 */
public class RepairGoal {
    private final SemanticsKind kind_;
    private final AcceptanceMode mode_;
    private final Double min_coverage_;

    /**
     * @param kind the semantics
     * @param mode credulous or skeptical
     * @param min_coverage fraction of extensions that must contain the target; optional (null) for credulous goals, required in (0, 1] for skeptical ones
     */
    public RepairGoal( SemanticsKind kind, AcceptanceMode mode, Double min_coverage ) {
        if ( kind == null || mode == null ) {
            throw new IllegalArgumentException( "A repair goal needs a semantics and an acceptance mode" );
        }

        if ( mode == AcceptanceMode.SKEPTICAL && min_coverage == null ) {
            throw new IllegalArgumentException( "Skeptical repair goals require an explicit minimum coverage (use 1.0 for full skeptical acceptance)" );
        }

        if ( min_coverage != null ) {
            double lower = mode == AcceptanceMode.SKEPTICAL ? Double.MIN_VALUE : 0.0;

            if ( min_coverage.isNaN() || min_coverage < lower || min_coverage > 1.0 ) {
                throw new IllegalArgumentException( "Minimum coverage out of range: " + min_coverage );
            }
        }

        kind_ = kind;
        mode_ = mode;
        min_coverage_ = min_coverage;
    }

    public static RepairGoal credulous( SemanticsKind kind ) {
        return new RepairGoal( kind, AcceptanceMode.CREDULOUS, null );
    }

    public static RepairGoal credulous( SemanticsKind kind, double min_coverage ) {
        return new RepairGoal( kind, AcceptanceMode.CREDULOUS, min_coverage );
    }

    public static RepairGoal skeptical( SemanticsKind kind, double min_coverage ) {
        return new RepairGoal( kind, AcceptanceMode.SKEPTICAL, min_coverage );
    }

    public SemanticsKind kind() {
        return kind_;
    }

    public AcceptanceMode mode() {
        return mode_;
    }

    /**
     * @return the coverage threshold, or null if none was given
     */
    public Double minCoverage() {
        return min_coverage_;
    }

    /**
     * @brief Credulous: the target is in at least one extension (and, if a threshold is set, in at least that fraction).
     *        Skeptical: at least one extension exists and the target is in at least the threshold fraction of them.
     */
    public boolean isSatisfiedBy( Coverage coverage ) {
        if ( mode_ == AcceptanceMode.CREDULOUS ) {
            return coverage.accepted() > 0 && ( min_coverage_ == null || coverage.ratio() >= min_coverage_ );
        }

        return coverage.total() > 0 && coverage.ratio() >= min_coverage_;
    }

    @Override
    public String toString() {
        String goal = mode_ + " " + kind_;

        if ( min_coverage_ != null ) {
            goal += String.format( Locale.ROOT, " (coverage >= %.2f)", min_coverage_ );
        }

        return goal;
    }
}
