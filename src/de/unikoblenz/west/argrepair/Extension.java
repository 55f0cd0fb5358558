package de.unikoblenz.west.argrepair;

import java.util.BitSet;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * @brief An immutable set of arguments satisfying some acceptance criterion.
 *
 * Extensions are ordered by cardinality first and then element-wise by argument index, which gives every extension family a deterministic order.
 */
public class Extension implements Comparable< Extension >, Iterable< String > {
    private final BitSet members_;
    private final List< String > ids_;

    /**
     * @brief Class constructor. Copies the member set.
     * @param graph the graph the member indices refer to
     * @param members indices of the member arguments
     */
    public Extension( ArgumentGraph graph, BitSet members ) {
        members_ = ( BitSet ) members.clone();
        ids_ = Collections.unmodifiableList( graph.ids( members_ ) );
    }

    /**
     * @return member identifiers in index order
     */
    public List< String > ids() {
        return ids_;
    }

    /**
     * @return a copy of the member indices
     */
    public BitSet members() {
        return ( BitSet ) members_.clone();
    }

    public int size() {
        return ids_.size();
    }

    public boolean isEmpty() {
        return ids_.isEmpty();
    }

    public boolean contains( String id ) {
        return ids_.contains( id );
    }

    boolean containsIndex( int index ) {
        return members_.get( index );
    }

    /**
     * @return true if every member of this extension is also a member of _other_
     */
    public boolean isSubsetOf( Extension other ) {
        BitSet rest = ( BitSet ) members_.clone();
        rest.andNot( other.members_ );

        return rest.isEmpty();
    }

    /**
     * @return true if this extension is a subset of _other_ and the two are not equal
     */
    public boolean isProperSubsetOf( Extension other ) {
        return isSubsetOf( other ) && members_.cardinality() < other.members_.cardinality();
    }

    @Override
    public Iterator< String > iterator() {
        return ids_.iterator();
    }

    @Override
    public int hashCode() {
        return members_.hashCode();
    }

    @Override
    public boolean equals( Object other ) {
        if ( !( other instanceof Extension ) ) {
            return false;
        }

        return members_.equals( ( ( Extension ) other ).members_ );
    }

    /**
     * @brief Compares by cardinality, then by the first differing member index.
     */
    @Override
    public int compareTo( Extension other ) {
        if ( members_.equals( other.members_ ) ) {
            return 0;
        }

        int by_size = Integer.compare( members_.cardinality(), other.members_.cardinality() );

        if ( by_size != 0 ) {
            return by_size;
        }

        // Same size but different contents, so a differing pair of members must exist
        int i = members_.nextSetBit( 0 );
        int j = other.members_.nextSetBit( 0 );

        while ( i == j ) {
            i = members_.nextSetBit( i + 1 );
            j = other.members_.nextSetBit( j + 1 );
        }

        return Integer.compare( i, j );
    }

    @Override
    public String toString() {
        if ( ids_.isEmpty() ) {
            return "{}";
        }

        StringBuilder as_string = new StringBuilder( "{" );
        Iterator< String > it = ids_.iterator();
        as_string.append( it.next() );

        while ( it.hasNext() ) {
            as_string.append( ", " );
            as_string.append( it.next() );
        }

        as_string.append( "}" );

        return as_string.toString();
    }
}
