package de.unikoblenz.west.argrepair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * @brief A new, unattacked argument proposed by a repair, together with the existing arguments it is declared to attack.
 */
public class Defender {
    private final String id_;
    private final List< String > attacks_;

    public Defender( String id, List< String > attacks ) {
        id_ = id;
        attacks_ = Collections.unmodifiableList( new ArrayList< String >( attacks ) );
    }

    public String id() {
        return id_;
    }

    /**
     * @return the blockers attacked by this defender, in planning order
     */
    public List< String > attacks() {
        return attacks_;
    }

    @Override
    public boolean equals( Object obj ) {
        if ( !( obj instanceof Defender ) ) {
            return false;
        }

        Defender other = ( Defender ) obj;

        return id_.equals( other.id_ ) && attacks_.equals( other.attacks_ );
    }

    @Override
    public int hashCode() {
        return id_.hashCode() * 31 + attacks_.hashCode();
    }

    @Override
    public String toString() {
        return id_ + " -> " + attacks_;
    }
}
