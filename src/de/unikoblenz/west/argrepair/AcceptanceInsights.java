package de.unikoblenz.west.argrepair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * @brief Why a target is or is not accepted.
 *
 * Grounded roadblocks are attackers of the target that the grounded extension does not defeat. Persistent attackers belong to every
 * preferred extension, soft attackers to some but not all of them.
 */
public class AcceptanceInsights {
    private final String target_;
    private final List< String > grounded_roadblocks_;
    private final List< String > persistent_attackers_;
    private final List< String > soft_attackers_;

    public AcceptanceInsights( String target, List< String > grounded_roadblocks, List< String > persistent_attackers, List< String > soft_attackers ) {
        target_ = target;
        grounded_roadblocks_ = Collections.unmodifiableList( new ArrayList< String >( grounded_roadblocks ) );
        persistent_attackers_ = Collections.unmodifiableList( new ArrayList< String >( persistent_attackers ) );
        soft_attackers_ = Collections.unmodifiableList( new ArrayList< String >( soft_attackers ) );
    }

    public String target() {
        return target_;
    }

    public List< String > groundedRoadblocks() {
        return grounded_roadblocks_;
    }

    public List< String > persistentAttackers() {
        return persistent_attackers_;
    }

    public List< String > softAttackers() {
        return soft_attackers_;
    }

    @Override
    public String toString() {
        return "AcceptanceInsights[target=" + target_ + ", grounded_roadblocks=" + grounded_roadblocks_ + ", persistent_attackers=" + persistent_attackers_ + ", soft_attackers=" + soft_attackers_ + "]";
    }
}
