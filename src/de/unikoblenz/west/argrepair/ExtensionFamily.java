package de.unikoblenz.west.argrepair;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * @brief The result of a semantics request: for each requested semantics an ordered list of extensions, plus the defense
 *        depth of each grounded argument if the grounded semantics was requested.
 */
public class ExtensionFamily {
    private final ArgumentGraph graph_;
    private final EnumMap< SemanticsKind, List< Extension > > extensions_;
    private final Map< String, Integer > defense_depth_;

    /**
     * @param graph the framework the extensions belong to
     * @param extensions per semantics, the sorted extensions
     * @param defense_depth argument id -> round in which it entered the grounded extension (empty unless grounded was computed)
     */
    public ExtensionFamily( ArgumentGraph graph, Map< SemanticsKind, List< Extension > > extensions, Map< String, Integer > defense_depth ) {
        graph_ = graph;
        extensions_ = new EnumMap< SemanticsKind, List< Extension > >( SemanticsKind.class );

        for ( Map.Entry< SemanticsKind, List< Extension > > entry : extensions.entrySet() ) {
            extensions_.put( entry.getKey(), Collections.unmodifiableList( entry.getValue() ) );
        }

        defense_depth_ = Collections.unmodifiableMap( new LinkedHashMap< String, Integer >( defense_depth ) );
    }

    public ArgumentGraph graph() {
        return graph_;
    }

    /**
     * @return the semantics contained in this family
     */
    public Set< SemanticsKind > kinds() {
        return Collections.unmodifiableSet( extensions_.keySet() );
    }

    public boolean contains( SemanticsKind kind ) {
        return extensions_.containsKey( kind );
    }

    /**
     * @return the extensions of _kind_; an empty list means that no extension exists
     * @throws IllegalArgumentException if _kind_ was not computed for this family
     */
    public List< Extension > extensions( SemanticsKind kind ) {
        List< Extension > extensions = extensions_.get( kind );

        if ( extensions == null ) {
            throw new IllegalArgumentException( "Semantics " + kind + " was not computed for this family (computed: " + extensions_.keySet() + ")" );
        }

        return extensions;
    }

    /**
     * @return the unique grounded extension
     * @throws IllegalArgumentException if the grounded semantics was not computed
     */
    public Extension grounded() {
        return extensions( SemanticsKind.GROUNDED ).get( 0 );
    }

    /**
     * @return argument id -> round in which it entered the grounded extension; arguments outside it have no entry
     */
    public Map< String, Integer > defenseDepth() {
        return defense_depth_;
    }

    /**
     * @return the defense depth of _id_, or null if it is not in the grounded extension
     */
    public Integer defenseDepth( String id ) {
        return defense_depth_.get( id );
    }

    /**
     * @return how many extensions of _kind_ contain _target_
     */
    public Coverage coverage( SemanticsKind kind, String target ) {
        graph_.argument( target );

        List< Extension > extensions = extensions( kind );
        int accepted = 0;

        for ( Extension e : extensions ) {
            if ( e.contains( target ) ) {
                ++accepted;
            }
        }

        return new Coverage( accepted, extensions.size() );
    }

    @Override
    public String toString() {
        return extensions_.toString();
    }
}
