package de.unikoblenz.west.argrepair;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

import org.apache.commons.cli.*; // For parsing command line arguments
import org.apache.commons.io.FilenameUtils;

/**
 * @brief Compute Dung semantics for argumentation frameworks and plan repairs that make a target argument accepted.
 */
public class ArgRepair {
    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    public final static Logger logger = Logger.getLogger( ArgRepair.class.getName() );
    private static FileHandler log_file;
    private static SimpleFormatter log_formatter;

    public static void main( String[] args )
    {
        // Set up logging
        try {
            log_file = new FileHandler( "argrepair.log" );
            log_formatter = new SimpleFormatter();
            log_file.setFormatter( log_formatter );
            logger.addHandler( log_file );
        }
        catch ( IOException e ) {
            System.err.println( e.getMessage() );
            System.exit( EXIT_FAILURE );
        }

        System.exit( run( args, System.out ) );
    }

    static Options options() {
        Options options = new Options();

        Option input_arg = new Option( "i", "input", true, "Graph input file path (.apx for ASPARTIX facts, edge list otherwise)" );
        input_arg.setRequired( true );
        options.addOption( input_arg );

        Option sem_arg = new Option( "s", "semantics", true, "Semantics. Options: conflict-free, admissible, complete, grounded, preferred, stable, stage, semi-stable, all (default: all; preferred for repairs)" );
        sem_arg.setRequired( false );
        options.addOption( sem_arg );

        Option query_arg = new Option( "q", "query", true, "Target argument to query or repair" );
        query_arg.setRequired( false );
        options.addOption( query_arg );

        Option mode_arg = new Option( "m", "mode", true, "Acceptance mode. Options: credulous, skeptical (default: credulous)" );
        mode_arg.setRequired( false );
        options.addOption( mode_arg );

        Option budget_arg = new Option( "k", "budget", true, "Maximum number of defenders added by a repair (default: 1)" );
        budget_arg.setRequired( false );
        options.addOption( budget_arg );

        Option fanout_arg = new Option( "f", "fanout", true, "Maximum number of blockers attacked by one defender, 0 for unlimited (default: 0)" );
        fanout_arg.setRequired( false );
        options.addOption( fanout_arg );

        Option coverage_arg = new Option( "c", "min-coverage", true, "Fraction of extensions that must contain the target; required for skeptical repairs" );
        coverage_arg.setRequired( false );
        options.addOption( coverage_arg );

        Option strategy_arg = new Option( "x", "strategy", true, "Repair strategy. Options: greedy, exact (default: greedy)" );
        strategy_arg.setRequired( false );
        options.addOption( strategy_arg );

        Option output_arg = new Option( "o", "output", true, "Output file path for the repaired graph (default: <input>_repaired.<ext>)" );
        output_arg.setRequired( false );
        options.addOption( output_arg );

        Option timeout_arg = new Option( "t", "timeout", true, "Timeout in seconds for enumeration and repair search (default: none)" );
        timeout_arg.setRequired( false );
        options.addOption( timeout_arg );

        Option parallel_arg = new Option( "p", "parallelism", true, "Number of enumeration worker threads (default: 1)" );
        parallel_arg.setRequired( false );
        options.addOption( parallel_arg );

        Option iter_arg = new Option( "n", "max-iterations", true, "Maximum number of candidate plans verified by a repair (default: " + RepairConfig.DEFAULT_MAX_ITERATIONS + ")" );
        iter_arg.setRequired( false );
        options.addOption( iter_arg );

        options.addOption( "r", "repair", false, "Plan a repair for the query argument" );
        options.addOption( null, "force", false, "Plan a repair even if the goal already holds" );
        options.addOption( "v", "verbose", false, "Print settings and log search details" );
        options.addOption( "h", "help", false, "Show help" );

        return options;
    }

    /**
     * @brief Execute one command line.
     * @param args the command line arguments
     * @param out where results are printed
     * @return the process exit code: 0 on success, 1 if the request failed or the repair did not succeed, 2 on usage errors
     */
    public static int run( String[] args, PrintStream out ) {
        Options options = options();
        CommandLineParser clparser = new DefaultParser();
        HelpFormatter formatter = new HelpFormatter();
        CommandLine cmd;

        for ( String arg : args ) {
            if ( arg.equals( "-h" ) || arg.equals( "--help" ) ) {
                formatter.printHelp( "ArgRepair", options );
                return EXIT_OK;
            }
        }

        try {
            cmd = clparser.parse( options, args );
        }
        catch ( ParseException e ) {
            out.println( e.getMessage() );
            formatter.printHelp( "ArgRepair", options );

            return EXIT_USAGE;
        }

        boolean verbose = cmd.hasOption( "v" );
        boolean repair = cmd.hasOption( "r" );
        boolean force = cmd.hasOption( "force" );
        String input_path = cmd.getOptionValue( "input" ); // no default; argument required
        String target = cmd.getOptionValue( "query" );
        String semantics = cmd.getOptionValue( "semantics", repair ? SemanticsKind.PREFERRED.externalName() : SemanticsEngine.ALL );
        String output_path = cmd.hasOption( "o" ) ? cmd.getOptionValue( "output" ) :
            FilenameUtils.removeExtension( input_path ) + "_repaired." + ( FilenameUtils.getExtension( input_path ).isEmpty() ? "txt" : FilenameUtils.getExtension( input_path ) );

        int k;
        int fanout;
        int timeout_seconds;
        int parallelism;
        long max_iterations;
        Double min_coverage = null;
        AcceptanceMode mode;
        RepairConfig.Strategy strategy;

        try {
            k = Integer.parseInt( cmd.getOptionValue( "budget", "1" ) );
            fanout = Integer.parseInt( cmd.getOptionValue( "fanout", "0" ) );
            timeout_seconds = Integer.parseInt( cmd.getOptionValue( "timeout", "0" ) );
            parallelism = Integer.parseInt( cmd.getOptionValue( "parallelism", "1" ) );
            max_iterations = Long.parseLong( cmd.getOptionValue( "max-iterations", String.valueOf( RepairConfig.DEFAULT_MAX_ITERATIONS ) ) );

            if ( cmd.hasOption( "c" ) ) {
                min_coverage = Double.parseDouble( cmd.getOptionValue( "min-coverage" ) );
            }
        }
        catch ( NumberFormatException e ) {
            logger.severe( "Numeric option expected a number: " + e.getMessage() );
            out.println( "[ ERROR ] Numeric option expected a number: " + e.getMessage() );

            return EXIT_USAGE;
        }

        EngineConfig engine_config;
        RepairConfig repair_config;

        try {
            mode = AcceptanceMode.fromName( cmd.getOptionValue( "mode", AcceptanceMode.CREDULOUS.toString() ) );
            strategy = RepairConfig.Strategy.fromName( cmd.getOptionValue( "strategy", RepairConfig.Strategy.GREEDY.toString() ) );
            engine_config = new EngineConfig( parallelism, EngineConfig.DEFAULT_MAX_SEARCH_NODES, timeout_seconds );
            repair_config = new RepairConfig( strategy, max_iterations, timeout_seconds * 1000L, RepairConfig.DEFAULT_DEFENDER_PREFIX, engine_config );

            if ( repair && target == null ) {
                throw new IllegalArgumentException( "You need to provide a target argument via the -q option to plan a repair" );
            }
        }
        catch ( IllegalArgumentException e ) {
            logger.severe( e.getMessage() );
            out.println( "[ ERROR ] " + e.getMessage() );

            return EXIT_USAGE;
        }

        if ( verbose ) {
            logger.setLevel( Level.FINE );

            out.println( "************** ARGREPAIR **************" );
            out.println( "Input path: " + input_path );
            out.println( "Semantics: " + semantics );
            out.println( "Target: " + ( target == null ? "none" : target ) );
            out.println( "Mode: " + mode );
            out.println( "Engine: " + engine_config );

            if ( repair ) {
                out.println( "Output path: " + output_path );
                out.println( "Budget k: " + k );
                out.println( "Fanout: " + fanout );
                out.println( "Min coverage: " + ( min_coverage == null ? "none" : min_coverage ) );
                out.println( "Strategy: " + strategy );
                out.println( "Max iterations: " + max_iterations );
                out.println( "Force: " + force );
            }
        }

        try {
            ArgumentGraph graph = GraphFormat.forPath( input_path ).read( new File( input_path ) );
            logger.info( "Read " + graph.size() + " arguments and " + graph.attackCount() + " attacks from " + input_path );

            if ( repair ) {
                RepairGoal goal = new RepairGoal( SemanticsKind.fromName( semantics ), mode, min_coverage );
                RepairOutcome outcome = ArgRepairImpl.repair( graph, target, goal, k, fanout, force, repair_config, output_path, out );

                return outcome.isSuccess() ? EXIT_OK : EXIT_FAILURE;
            }

            ArgRepairImpl.analyze( graph, semantics, target, mode, engine_config, out );

            return EXIT_OK;
        }
        catch ( IOException e ) {
            logger.severe( "IOException: " + e.getMessage() );
            out.println( "[ ERROR ] " + e.getMessage() );
        }
        catch ( MalformedGraphException e ) {
            logger.severe( "MalformedGraphException (" + e.reason() + "): " + e.getMessage() );
            out.println( "[ ERROR ] " + e.getMessage() );
        }
        catch ( SearchExhaustedException e ) {
            logger.severe( "SearchExhaustedException: " + e.getMessage() );
            out.println( "[ ERROR ] " + e.getMessage() );
        }
        catch ( IllegalArgumentException e ) {
            logger.severe( "IllegalArgumentException: " + e.getMessage() );
            out.println( "[ ERROR ] " + e.getMessage() );
        }
        catch ( RuntimeException e ) {
            logger.log( Level.SEVERE, "RuntimeException: " + e.getMessage(), e );
            out.println( "[ ERROR ] " + e.getMessage() );
        }

        return EXIT_FAILURE;
    }
}
