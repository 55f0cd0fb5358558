package de.unikoblenz.west.argrepair;

/**
 * @brief An argument within an abstract argumentation framework.
 *
 * The identifier is opaque; the index is the argument's position within its graph and is used for all bitset operations.
 */
public class Argument implements Comparable< Argument > {
    private final String id_;
    private final int index_;

    /**
     * @brief Class constructor.
     * @param id the opaque identifier
     * @param index the stable position within the owning graph
     */
    public Argument( String id, int index ) {
        id_ = id;
        index_ = index;
    }

    public String id() {
        return id_;
    }

    public int index() {
        return index_;
    }

    @Override
    public int compareTo( Argument other ) {
        return Integer.compare( index_, other.index_ );
    }

    @Override
    public boolean equals( Object obj ) {
        if ( !( obj instanceof Argument ) ) {
            return false;
        }

        Argument other = ( Argument ) obj;

        return index_ == other.index_ && id_.equals( other.id_ );
    }

    @Override
    public int hashCode() {
        return 31 * id_.hashCode() + index_;
    }

    @Override
    public String toString() {
        return id_;
    }
}
