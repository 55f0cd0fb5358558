package de.unikoblenz.west.argrepair;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

/**
 * @brief Procedures behind the command line: analyze a graph, or plan and save a repair, printing plain-text results.
 */
public class ArgRepairImpl {
    /**
     * @brief Print the extensions of the requested semantics, the defense depths, and, for a target, its acceptance and diagnostics.
     * @param semantics a semantics name or "all"
     * @param target argument to query; may be null
     */
    public static ExtensionFamily analyze( ArgumentGraph graph, String semantics, String target, AcceptanceMode mode, EngineConfig config, PrintStream out ) {
        SemanticsEngine engine = new SemanticsEngine( config );

        if ( target != null ) {
            graph.argument( target );
        }

        long start = System.currentTimeMillis();
        ExtensionFamily family = engine.compute( graph, semantics );
        ArgRepair.logger.info( "Computed " + family.kinds() + " in " + ( System.currentTimeMillis() - start ) + " ms" );

        out.println( "Arguments: " + graph.size() + ", attacks: " + graph.attackCount() );

        for ( SemanticsKind kind : family.kinds() ) {
            printExtensions( kind.externalName(), family.extensions( kind ), out );
        }

        if ( !family.defenseDepth().isEmpty() ) {
            out.println( "Defense depth:" );

            for ( Map.Entry< String, Integer > entry : family.defenseDepth().entrySet() ) {
                out.println( "  " + entry.getKey() + ": " + entry.getValue() );
            }
        }

        if ( target == null ) {
            return family;
        }

        out.println( "Acceptance of " + target + " (" + mode + "):" );

        for ( SemanticsKind kind : family.kinds() ) {
            out.println( "  " + kind + ": " + ( AcceptanceQuery.query( family, kind, target, mode ) ? "yes" : "no" ) + ", coverage " + family.coverage( kind, target ) );
        }

        // Diagnostics need grounded and preferred, which a single-semantics request may lack
        ExtensionFamily diagnostic = family;

        if ( !family.contains( SemanticsKind.GROUNDED ) || !family.contains( SemanticsKind.PREFERRED ) ) {
            diagnostic = engine.compute( graph, EnumSet.of( SemanticsKind.GROUNDED, SemanticsKind.PREFERRED ) );
        }

        AcceptanceInsights insights = AcceptanceQuery.insights( graph, diagnostic, target );
        out.println( "Insights for " + target + ":" );
        out.println( "  grounded roadblocks: " + formatIds( insights.groundedRoadblocks() ) );
        out.println( "  persistent attackers: " + formatIds( insights.persistentAttackers() ) );
        out.println( "  soft attackers: " + formatIds( insights.softAttackers() ) );

        return family;
    }

    /**
     * @brief Plan a repair, print the outcome, and save the augmented graph to _output_path_ if defenders were added.
     * @throws IOException if the augmented graph cannot be written
     */
    public static RepairOutcome repair( ArgumentGraph graph, String target, RepairGoal goal, int k, int fanout, boolean force, RepairConfig config, String output_path, PrintStream out ) throws IOException {
        RepairPlanner planner = new RepairPlanner( config );
        RepairOutcome outcome = planner.planRepair( graph, target, goal, k, fanout, force );

        out.println( "Repair of " + target + " for goal " + goal + ": " + outcome.status() );
        out.println( "  reason: " + outcome.reason() );

        if ( outcome.before() != null ) {
            out.println( "  before: " + outcome.before() );
        }

        RepairPlan plan = outcome.plan();

        if ( plan == null ) {
            return outcome;
        }

        out.println( "  after: " + plan.after() );

        for ( Map.Entry< String, List< String > > entry : plan.defenderEdges().entrySet() ) {
            out.println( "  defender " + entry.getKey() + " attacks " + formatIds( entry.getValue() ) );
        }

        if ( !plan.isEmpty() ) {
            GraphFormat.forPath( output_path ).write( plan.augmented(), new File( output_path ) );
            out.println( "Repaired graph written to " + output_path );
            ArgRepair.logger.info( "Saved repaired graph with " + plan.augmented().size() + " arguments to " + output_path );
        }

        return outcome;
    }

    static void printExtensions( String name, List< Extension > extensions, PrintStream out ) {
        out.println( "[" + name + "] " + extensions.size() + " extension(s)" );

        for ( Extension e : extensions ) {
            out.println( "  " + e );
        }
    }

    static String formatIds( List< String > ids ) {
        return "{" + StringUtils.join( ids, ", " ) + "}";
    }
}
