package de.unikoblenz.west.argrepair;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * @brief Computes extensions of an argumentation framework under one or all supported semantics.
 *
 * The engine is a pure function of its inputs and keeps no state between calls, so one instance can serve concurrent requests.
 */
public class SemanticsEngine {
    public static final String ALL = "all";

    private final EngineConfig config_;

    public SemanticsEngine() {
        this( EngineConfig.defaults() );
    }

    public SemanticsEngine( EngineConfig config ) {
        config_ = config;
    }

    public EngineConfig config() {
        return config_;
    }

    /**
     * @brief Compute the extensions of a single semantics.
     * @throws SearchExhaustedException if enumeration hits the configured caps
     */
    public ExtensionFamily compute( ArgumentGraph graph, SemanticsKind kind ) {
        return compute( graph, EnumSet.of( kind ) );
    }

    /**
     * @brief Compute the extensions of a semantics given by name, or of all semantics for "all".
     * @throws InvalidSemanticsKindException if the name is neither "all" nor a supported semantics
     */
    public ExtensionFamily compute( ArgumentGraph graph, String kind ) {
        if ( kind != null && kind.trim().equalsIgnoreCase( ALL ) ) {
            return computeAll( graph );
        }

        return compute( graph, SemanticsKind.fromName( kind ) );
    }

    public ExtensionFamily computeAll( ArgumentGraph graph ) {
        return compute( graph, EnumSet.allOf( SemanticsKind.class ) );
    }

    /**
     * @brief Compute the extensions of several semantics, sharing the grounded extension and the complete family between them.
     * @return the family; for each semantics the extensions are sorted by cardinality, then by member indices
     */
    public ExtensionFamily compute( ArgumentGraph graph, Set< SemanticsKind > kinds ) {
        SemanticsComputation computation = new SemanticsComputation( graph, new ExtensionEnumerator( config_ ) );
        Map< SemanticsKind, List< Extension > > extensions = new EnumMap< SemanticsKind, List< Extension > >( SemanticsKind.class );

        for ( SemanticsKind kind : kinds ) {
            long start = System.currentTimeMillis();
            List< BitSet > sets = kind.semantics().compute( computation );
            extensions.put( kind, toExtensions( graph, sets ) );

            ArgRepair.logger.fine( "[" + kind + "] " + sets.size() + " extension(s) over " + graph.size() + " arguments in " + ( System.currentTimeMillis() - start ) + " ms" );
        }

        Map< String, Integer > depth = new LinkedHashMap< String, Integer >();

        if ( kinds.contains( SemanticsKind.GROUNDED ) ) {
            // Report depths in argument order
            for ( Map.Entry< Integer, Integer > entry : new TreeMap< Integer, Integer >( computation.defenseDepth() ).entrySet() ) {
                depth.put( graph.argument( entry.getKey() ).id(), entry.getValue() );
            }
        }

        return new ExtensionFamily( graph, extensions, depth );
    }

    private static List< Extension > toExtensions( ArgumentGraph graph, List< BitSet > sets ) {
        // Ordered output keeps results reproducible
        SortedSet< Extension > extensions = new TreeSet< Extension >();

        for ( BitSet set : sets ) {
            extensions.add( new Extension( graph, set ) );
        }

        return new ArrayList< Extension >( extensions );
    }
}
