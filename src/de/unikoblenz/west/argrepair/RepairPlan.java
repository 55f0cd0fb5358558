package de.unikoblenz.west.argrepair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @brief A verified set of new defenders for a target, with the graphs and coverage before and after adding them.
 */
public class RepairPlan {
    private final String target_;
    private final RepairGoal goal_;
    private final ArgumentGraph original_;
    private final ArgumentGraph augmented_;
    private final List< Defender > defenders_;
    private final Coverage before_;
    private final Coverage after_;
    private final String strategy_;

    public RepairPlan( String target, RepairGoal goal, ArgumentGraph original, ArgumentGraph augmented, List< Defender > defenders, Coverage before, Coverage after, String strategy ) {
        target_ = target;
        goal_ = goal;
        original_ = original;
        augmented_ = augmented;
        defenders_ = Collections.unmodifiableList( new ArrayList< Defender >( defenders ) );
        before_ = before;
        after_ = after;
        strategy_ = strategy;
    }

    public String target() {
        return target_;
    }

    public RepairGoal goal() {
        return goal_;
    }

    public ArgumentGraph original() {
        return original_;
    }

    /**
     * @return the original graph plus the defenders and their attacks; identical to _original()_ for an empty plan
     */
    public ArgumentGraph augmented() {
        return augmented_;
    }

    public List< Defender > defenders() {
        return defenders_;
    }

    /**
     * @return defender id -> blockers it attacks, in plan order
     */
    public Map< String, List< String > > defenderEdges() {
        Map< String, List< String > > edges = new LinkedHashMap< String, List< String > >();

        for ( Defender defender : defenders_ ) {
            edges.put( defender.id(), defender.attacks() );
        }

        return edges;
    }

    public boolean isEmpty() {
        return defenders_.isEmpty();
    }

    public Coverage before() {
        return before_;
    }

    public Coverage after() {
        return after_;
    }

    /**
     * @return the name of the strategy that produced the plan, or "none" for an empty plan
     */
    public String strategy() {
        return strategy_;
    }

    @Override
    public String toString() {
        return "RepairPlan[" + target_ + ", " + goal_ + ", defenders=" + defenders_ + ", before=" + before_ + ", after=" + after_ + "]";
    }
}
