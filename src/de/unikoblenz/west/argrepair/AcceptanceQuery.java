package de.unikoblenz.west.argrepair;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * @brief Read-side questions over already computed extension families: membership and diagnostics.
 *
 * Nothing here runs a fixed-point computation or an enumeration.
 */
public final class AcceptanceQuery {
    private AcceptanceQuery() {
    }

    /**
     * @return true iff _target_ belongs to at least one extension of _kind_
     */
    public static boolean credulous( ExtensionFamily family, SemanticsKind kind, String target ) {
        return family.coverage( kind, target ).accepted() > 0;
    }

    /**
     * @return true iff _target_ belongs to every extension of _kind_; false if there is no extension at all
     */
    public static boolean skeptical( ExtensionFamily family, SemanticsKind kind, String target ) {
        Coverage coverage = family.coverage( kind, target );

        return coverage.total() > 0 && coverage.accepted() == coverage.total();
    }

    public static boolean query( ExtensionFamily family, SemanticsKind kind, String target, AcceptanceMode mode ) {
        if ( mode == AcceptanceMode.CREDULOUS ) {
            return credulous( family, kind, target );
        }

        return skeptical( family, kind, target );
    }

    /**
     * @brief Membership query against the family's only semantics, or against the preferred semantics if the family holds several.
     */
    public static boolean query( ExtensionFamily family, String target, AcceptanceMode mode ) {
        return query( family, defaultKind( family ), target, mode );
    }

    /**
     * @return the semantics used by _query_ when none is given
     */
    public static SemanticsKind defaultKind( ExtensionFamily family ) {
        if ( family.kinds().size() == 1 ) {
            return family.kinds().iterator().next();
        }

        return SemanticsKind.PREFERRED;
    }

    /**
     * @brief Diagnose the standing of _target_.
     * @param graph the framework _family_ was computed for
     * @param family must contain the grounded and the preferred semantics
     * @throws IllegalArgumentException if _target_ is unknown or the family lacks a required semantics
     */
    public static AcceptanceInsights insights( ArgumentGraph graph, ExtensionFamily family, String target ) {
        int t = graph.indexOf( target );
        List< String > attackers = graph.attackersOf( target );

        // Grounded roadblocks: attackers not attacked by anything in the grounded extension
        Extension grounded = family.grounded();
        List< String > roadblocks = new ArrayList< String >();

        if ( !grounded.containsIndex( t ) ) {
            BitSet defeated = Defense.attackedBy( graph, grounded.members() );

            for ( String b : attackers ) {
                if ( !defeated.get( graph.indexOf( b ) ) ) {
                    roadblocks.add( b );
                }
            }
        }

        // Persistent vs soft, across the preferred family
        List< Extension > preferred = family.extensions( SemanticsKind.PREFERRED );
        List< String > persistent = new ArrayList< String >();
        List< String > soft = new ArrayList< String >();

        if ( !preferred.isEmpty() ) {
            for ( String b : attackers ) {
                int count = 0;

                for ( Extension e : preferred ) {
                    if ( e.contains( b ) ) {
                        ++count;
                    }
                }

                if ( count == preferred.size() ) {
                    persistent.add( b );
                }
                else if ( count > 0 ) {
                    soft.add( b );
                }
            }
        }

        return new AcceptanceInsights( target, roadblocks, persistent, soft );
    }
}
