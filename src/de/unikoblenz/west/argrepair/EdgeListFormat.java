package de.unikoblenz.west.argrepair;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.ImmutablePair;
import org.apache.commons.lang3.tuple.Pair;

/**
 * @brief Line-based edge list.
 *
 * <pre>
 * # comment
 * args: A1,A2,A3
 * A2,A1
 * A3,A1
 * </pre>
 *
 * The "args:" line declares the arguments in index order and must precede all attack lines. Blank lines and lines
 * starting with '#' are ignored.
 */
public class EdgeListFormat extends GraphFormat {
    public static final String HEADER = "args:";

    @Override
    public ArgumentGraph parse( List< String > lines ) {
        List< String > arguments = null;
        List< Pair< String, String > > attacks = new ArrayList< Pair< String, String > >();
        int line_number = 0;

        for ( String raw : lines ) {
            ++line_number;
            String line = StringUtils.trim( raw );

            if ( StringUtils.isEmpty( line ) || line.startsWith( "#" ) ) {
                continue;
            }

            if ( StringUtils.startsWithIgnoreCase( line, HEADER ) ) {
                if ( arguments != null ) {
                    throw MalformedGraphException.syntax( line_number, raw, "a single \"" + HEADER + "\" line" );
                }

                arguments = new ArrayList< String >();
                String list = StringUtils.trim( line.substring( HEADER.length() ) );

                if ( !list.isEmpty() ) {
                    for ( String id : StringUtils.splitPreserveAllTokens( list, ',' ) ) {
                        arguments.add( id );
                    }
                }

                continue;
            }

            if ( arguments == null ) {
                throw MalformedGraphException.syntax( line_number, raw, "the \"" + HEADER + "\" line before any attack" );
            }

            String[] pair = StringUtils.splitPreserveAllTokens( line, ',' );

            if ( pair.length != 2 ) {
                throw MalformedGraphException.syntax( line_number, raw, "attacker,target" );
            }

            attacks.add( ImmutablePair.of( pair[ 0 ], pair[ 1 ] ) );
        }

        if ( arguments == null ) {
            arguments = new ArrayList< String >();
        }

        return ArgumentGraph.build( arguments, attacks );
    }

    @Override
    public List< String > format( ArgumentGraph graph ) {
        List< String > lines = new ArrayList< String >();
        lines.add( "# " + graph.size() + " arguments, " + graph.attackCount() + " attacks" );
        lines.add( HEADER + " " + StringUtils.join( graph.argumentIds(), ',' ) );

        for ( Pair< String, String > attack : graph.attackSet() ) {
            lines.add( attack.getLeft() + "," + attack.getRight() );
        }

        return lines;
    }
}
