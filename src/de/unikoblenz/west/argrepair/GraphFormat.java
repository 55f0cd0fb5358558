package de.unikoblenz.west.argrepair;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;

/**
 * @brief A plain-text serialization of argument graphs. Only the argument set and the attack set are significant.
 */
public abstract class GraphFormat {
    /**
     * @brief Parse a graph from lines of text.
     * @throws MalformedGraphException on malformed content; the message names the offending line
     */
    public abstract ArgumentGraph parse( List< String > lines );

    /**
     * @brief Render a graph as lines of text that _parse_ reads back to the same argument and attack sets.
     */
    public abstract List< String > format( ArgumentGraph graph );

    public ArgumentGraph parse( String text ) {
        return parse( Arrays.asList( text.split( "\\r?\\n" ) ) );
    }

    public ArgumentGraph read( File file ) throws IOException {
        return parse( FileUtils.readLines( file, StandardCharsets.UTF_8 ) );
    }

    public void write( ArgumentGraph graph, File file ) throws IOException {
        FileUtils.writeLines( file, StandardCharsets.UTF_8.name(), format( graph ), "\n" );
    }

    /**
     * @return ApxFormat for ".apx" files, EdgeListFormat otherwise
     */
    public static GraphFormat forPath( String path ) {
        if ( FilenameUtils.isExtension( path.toLowerCase( Locale.ROOT ), "apx" ) ) {
            return new ApxFormat();
        }

        return new EdgeListFormat();
    }
}
