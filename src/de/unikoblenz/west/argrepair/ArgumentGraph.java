package de.unikoblenz.west.argrepair;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.ImmutablePair;
import org.apache.commons.lang3.tuple.Pair;

/**
 * @brief An immutable abstract argumentation framework (A, R).
 *
 * Attacks are kept as bitsets indexed by argument position, both forwards (whom an argument attacks) and backwards (who attacks an argument).
 * A graph is never edited after construction; adding arguments produces a new graph (see _augment_).
 */
public class ArgumentGraph {
    // Letters, digits, '_' and '-': none of them is markup in the edge-list or APX formats
    private static final Pattern IDENTIFIER = Pattern.compile( "[\\p{L}\\p{N}_\\-]+" );

    private final List< Argument > arguments_;
    private final Map< String, Argument > by_id_;
    private final BitSet[] attacks_;
    private final BitSet[] attackers_;
    private final Map< Pair< String, String >, EdgeProvenance > edges_;

    private ArgumentGraph( List< Argument > arguments, Map< String, Argument > by_id, BitSet[] attacks, BitSet[] attackers, Map< Pair< String, String >, EdgeProvenance > edges ) {
        arguments_ = Collections.unmodifiableList( arguments );
        by_id_ = by_id;
        attacks_ = attacks;
        attackers_ = attackers;
        edges_ = Collections.unmodifiableMap( edges );
    }

    /**
     * @brief Build a graph from an argument list and an edge list. All edges are tagged as explicit.
     * @param arguments the argument identifiers; their order defines the argument indices
     * @param attacks pairs (attacker, target)
     * @return the new graph
     * @throws MalformedGraphException on duplicate or invalid identifiers, or on attacks referencing unknown arguments
     */
    public static ArgumentGraph build( List< String > arguments, Collection< ? extends Pair< String, String > > attacks ) {
        Map< Pair< String, String >, EdgeProvenance > edges = new LinkedHashMap< Pair< String, String >, EdgeProvenance >();

        for ( Pair< String, String > attack : attacks ) {
            edges.put( attack, EdgeProvenance.EXPLICIT );
        }

        return build( arguments, edges );
    }

    /**
     * @brief Build a graph from an argument list and provenance-tagged edges.
     * @param arguments the argument identifiers; their order defines the argument indices
     * @param attacks pairs (attacker, target) mapped to where they came from
     * @return the new graph
     * @throws MalformedGraphException on duplicate or invalid identifiers, or on attacks referencing unknown arguments
     */
    public static ArgumentGraph build( List< String > arguments, Map< ? extends Pair< String, String >, EdgeProvenance > attacks ) {
        List< Argument > args = new ArrayList< Argument >( arguments.size() );
        Map< String, Argument > by_id = new HashMap< String, Argument >();

        for ( String raw_id : arguments ) {
            String id = checkIdentifier( raw_id );

            if ( by_id.containsKey( id ) ) {
                throw MalformedGraphException.duplicateArgument( id );
            }

            Argument argument = new Argument( id, args.size() );
            args.add( argument );
            by_id.put( id, argument );
        }

        BitSet[] forward = new BitSet[ args.size() ];
        BitSet[] backward = new BitSet[ args.size() ];

        for ( int i = 0; i < args.size(); ++i ) {
            forward[ i ] = new BitSet( args.size() );
            backward[ i ] = new BitSet( args.size() );
        }

        Map< Pair< String, String >, EdgeProvenance > edges = new LinkedHashMap< Pair< String, String >, EdgeProvenance >();

        for ( Map.Entry< ? extends Pair< String, String >, EdgeProvenance > entry : attacks.entrySet() ) {
            String attacker = StringUtils.trim( entry.getKey().getLeft() );
            String target = StringUtils.trim( entry.getKey().getRight() );
            Argument from = by_id.get( attacker );
            Argument to = by_id.get( target );

            if ( from == null ) {
                throw MalformedGraphException.unknownArgumentInAttack( attacker, attacker, target );
            }

            if ( to == null ) {
                throw MalformedGraphException.unknownArgumentInAttack( target, attacker, target );
            }

            forward[ from.index() ].set( to.index() );
            backward[ to.index() ].set( from.index() );

            Pair< String, String > key = ImmutablePair.of( attacker, target );

            // The first provenance recorded for a duplicated edge wins
            if ( !edges.containsKey( key ) ) {
                edges.put( key, entry.getValue() == null ? EdgeProvenance.EXPLICIT : entry.getValue() );
            }
        }

        return new ArgumentGraph( args, by_id, forward, backward, edges );
    }

    /**
     * @return true if _id_ may name an argument, i.e. it is a non-empty run of letters, digits, '_' and '-'
     */
    public static boolean isValidIdentifier( String id ) {
        return id != null && IDENTIFIER.matcher( id ).matches();
    }

    private static String checkIdentifier( String raw_id ) {
        String id = StringUtils.trim( raw_id );

        if ( !isValidIdentifier( id ) ) {
            throw MalformedGraphException.invalidIdentifier( raw_id );
        }

        return id;
    }

    /**
     * @brief Create a new graph consisting of this graph plus the given defenders and their declared attacks.
     *
     * Existing arguments keep their indices, existing edges are left untouched. Defenders are appended in list order and receive no incoming attacks.
     *
     * @param defenders the new arguments
     * @return the augmented graph; _this_ is not modified
     * @throws MalformedGraphException if a defender id already exists or a defender attacks an unknown argument
     */
    public ArgumentGraph augment( List< Defender > defenders ) {
        List< String > ids = new ArrayList< String >( argumentIds() );
        Map< Pair< String, String >, EdgeProvenance > edges = new LinkedHashMap< Pair< String, String >, EdgeProvenance >( edges_ );

        for ( Defender defender : defenders ) {
            ids.add( defender.id() );
        }

        for ( Defender defender : defenders ) {
            for ( String blocker : defender.attacks() ) {
                // Defenders may only attack pre-existing arguments
                if ( !by_id_.containsKey( blocker ) ) {
                    throw MalformedGraphException.unknownArgumentInAttack( blocker, defender.id(), blocker );
                }

                edges.put( ImmutablePair.of( defender.id(), blocker ), EdgeProvenance.EXPLICIT );
            }
        }

        return build( ids, edges );
    }

    /**
     * @return the number of arguments
     */
    public int size() {
        return arguments_.size();
    }

    public List< Argument > arguments() {
        return arguments_;
    }

    /**
     * @return argument identifiers in index order
     */
    public List< String > argumentIds() {
        List< String > ids = new ArrayList< String >( arguments_.size() );

        for ( Argument a : arguments_ ) {
            ids.add( a.id() );
        }

        return ids;
    }

    public boolean contains( String id ) {
        return by_id_.containsKey( id );
    }

    /**
     * @param id an argument identifier
     * @return the argument
     * @throws IllegalArgumentException if there is no such argument
     */
    public Argument argument( String id ) {
        Argument argument = by_id_.get( id );

        if ( argument == null ) {
            throw new IllegalArgumentException( "Unknown argument: " + id );
        }

        return argument;
    }

    public Argument argument( int index ) {
        return arguments_.get( index );
    }

    public int indexOf( String id ) {
        return argument( id ).index();
    }

    /**
     * @return true if _attacker_ attacks _target_
     */
    public boolean attacks( String attacker, String target ) {
        return attacks_[ indexOf( attacker ) ].get( indexOf( target ) );
    }

    public boolean isSelfAttacking( String id ) {
        int index = indexOf( id );

        return attacks_[ index ].get( index );
    }

    boolean isSelfAttacking( int index ) {
        return attacks_[ index ].get( index );
    }

    /**
     * @return the direct attackers of _id_, in index order
     */
    public List< String > attackersOf( String id ) {
        return ids( attackers_[ indexOf( id ) ] );
    }

    /**
     * @return the arguments attacked by _id_, in index order
     */
    public List< String > attackedBy( String id ) {
        return ids( attacks_[ indexOf( id ) ] );
    }

    /**
     * @return all attacks as (attacker, target) pairs, in insertion order
     */
    public Set< Pair< String, String > > attackSet() {
        return Collections.unmodifiableSet( new LinkedHashSet< Pair< String, String > >( edges_.keySet() ) );
    }

    public int attackCount() {
        return edges_.size();
    }

    /**
     * @return the provenance of an attack, or null if there is no such attack
     */
    public EdgeProvenance provenance( String attacker, String target ) {
        return edges_.get( ImmutablePair.of( attacker, target ) );
    }

    /**
     * @return the set of arguments attacked by the argument at _index_ (not a copy; do not modify)
     */
    BitSet outgoing( int index ) {
        return attacks_[ index ];
    }

    /**
     * @return the set of attackers of the argument at _index_ (not a copy; do not modify)
     */
    BitSet incoming( int index ) {
        return attackers_[ index ];
    }

    /**
     * @brief Translate a set of argument indices into identifiers.
     */
    public List< String > ids( BitSet members ) {
        List< String > ids = new ArrayList< String >( members.cardinality() );

        for ( int i = members.nextSetBit( 0 ); i >= 0; i = members.nextSetBit( i + 1 ) ) {
            ids.add( arguments_.get( i ).id() );
        }

        return ids;
    }

    /**
     * @brief Translate identifiers into a set of argument indices.
     * @throws IllegalArgumentException if an identifier is unknown
     */
    public BitSet indices( Collection< String > ids ) {
        BitSet members = new BitSet( arguments_.size() );

        for ( String id : ids ) {
            members.set( indexOf( id ) );
        }

        return members;
    }

    @Override
    public String toString() {
        return "ArgumentGraph" + argumentIds() + " attacks=" + edges_.keySet();
    }
}
