package de.unikoblenz.west.argrepair;

import java.util.Locale;

/**
 * @brief The closed set of supported semantics.
 */
public enum SemanticsKind {
    CONFLICT_FREE( "conflict-free" ),
    ADMISSIBLE( "admissible" ),
    COMPLETE( "complete" ),
    GROUNDED( "grounded" ),
    PREFERRED( "preferred" ),
    STABLE( "stable" ),
    STAGE( "stage" ),
    SEMI_STABLE( "semi-stable" );

    private final String name_;

    SemanticsKind( String name ) {
        name_ = name;
    }

    /**
     * @return the external name, e.g. "semi-stable"
     */
    public String externalName() {
        return name_;
    }

    /**
     * @brief Parse an external name. Case is ignored; '_' and '-' are interchangeable and "semistable" is accepted.
     * @throws InvalidSemanticsKindException if the name denotes no supported semantics
     */
    public static SemanticsKind fromName( String name ) {
        if ( name == null ) {
            throw new InvalidSemanticsKindException( null );
        }

        String normalized = name.trim().toLowerCase( Locale.ROOT ).replace( '_', '-' );

        if ( normalized.equals( "semistable" ) ) {
            return SEMI_STABLE;
        }

        for ( SemanticsKind kind : values() ) {
            if ( kind.name_.equals( normalized ) ) {
                return kind;
            }
        }

        throw new InvalidSemanticsKindException( name );
    }

    /**
     * @return a fresh instance of the semantics implementation
     */
    public Semantics semantics() {
        switch ( this ) {
            case CONFLICT_FREE:
                return new ConflictFreeSemantics();
            case ADMISSIBLE:
                return new AdmissibleSemantics();
            case COMPLETE:
                return new CompleteSemantics();
            case GROUNDED:
                return new GroundedSemantics();
            case PREFERRED:
                return new PreferredSemantics();
            case STABLE:
                return new StableSemantics();
            case STAGE:
                return new StageSemantics();
            case SEMI_STABLE:
                return new SemiStableSemantics();
            default:
                throw new IllegalStateException( "No implementation for semantics " + this );
        }
    }

    @Override
    public String toString() {
        return name_;
    }
}
