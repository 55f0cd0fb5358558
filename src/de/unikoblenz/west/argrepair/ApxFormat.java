package de.unikoblenz.west.argrepair;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.ImmutablePair;
import org.apache.commons.lang3.tuple.Pair;

/**
 * @brief ASPARTIX facts: arg(a). and att(a,b). statements, '%' starts a comment.
 *
 * Repeated declarations are ignored. Atoms that only occur in attacks are declared implicitly, in order of first occurrence.
 */
public class ApxFormat extends GraphFormat {
    private static final Pattern STATEMENT = Pattern.compile( "(arg|att)\\s*\\(([^()]*)\\)\\s*\\." );

    @Override
    public ArgumentGraph parse( List< String > lines ) {
        Set< String > arguments = new LinkedHashSet< String >();
        List< Pair< String, String > > attacks = new ArrayList< Pair< String, String > >();
        int line_number = 0;

        for ( String raw : lines ) {
            ++line_number;
            String line = raw;
            int comment = line.indexOf( '%' );

            if ( comment >= 0 ) {
                line = line.substring( 0, comment );
            }

            Matcher matcher = STATEMENT.matcher( line );
            int end = 0;

            while ( matcher.find() ) {
                if ( !StringUtils.isBlank( line.substring( end, matcher.start() ) ) ) {
                    throw MalformedGraphException.syntax( line_number, raw, "arg(a). or att(a,b)." );
                }

                end = matcher.end();
                String[] terms = StringUtils.splitPreserveAllTokens( matcher.group( 2 ), ',' );

                if ( matcher.group( 1 ).equals( "arg" ) ) {
                    if ( terms.length != 1 ) {
                        throw MalformedGraphException.syntax( line_number, raw, "arg(a)." );
                    }

                    arguments.add( StringUtils.trim( terms[ 0 ] ) );
                }
                else {
                    if ( terms.length != 2 ) {
                        throw MalformedGraphException.syntax( line_number, raw, "att(a,b)." );
                    }

                    attacks.add( ImmutablePair.of( StringUtils.trim( terms[ 0 ] ), StringUtils.trim( terms[ 1 ] ) ) );
                }
            }

            if ( !StringUtils.isBlank( line.substring( end ) ) ) {
                throw MalformedGraphException.syntax( line_number, raw, "arg(a). or att(a,b)." );
            }
        }

        Map< Pair< String, String >, EdgeProvenance > edges = new LinkedHashMap< Pair< String, String >, EdgeProvenance >();

        for ( Pair< String, String > attack : attacks ) {
            boolean declared_left = arguments.add( attack.getLeft() );
            boolean declared_right = arguments.add( attack.getRight() );

            if ( declared_left || declared_right ) {
                ArgRepair.logger.fine( "Implicitly declared argument(s) of att(" + attack.getLeft() + "," + attack.getRight() + ")" );
            }

            edges.put( attack, EdgeProvenance.EXPLICIT );
        }

        return ArgumentGraph.build( new ArrayList< String >( arguments ), edges );
    }

    @Override
    public List< String > format( ArgumentGraph graph ) {
        List< String > lines = new ArrayList< String >();

        for ( String id : graph.argumentIds() ) {
            lines.add( "arg(" + id + ")." );
        }

        for ( Pair< String, String > attack : graph.attackSet() ) {
            lines.add( "att(" + attack.getLeft() + "," + attack.getRight() + ")." );
        }

        return lines;
    }
}
