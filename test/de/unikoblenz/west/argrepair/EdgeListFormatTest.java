package de.unikoblenz.west.argrepair;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EdgeListFormatTest {
    private final EdgeListFormat format = new EdgeListFormat();

    @Test
    void parse_shouldReadHeaderAttacksAndComments() {
        ArgumentGraph g = format.parse( "# two blockers\n\nargs: A1, A2,A3,A4\nA2,A1\n  # indented comment\nA3 , A1\n" );

        assertThat( g.argumentIds() ).containsExactly( "A1", "A2", "A3", "A4" );
        assertThat( g.attackersOf( "A1" ) ).containsExactly( "A2", "A3" );
        assertThat( g.attackCount() ).isEqualTo( 2 );
    }

    @Test
    void parse_shouldAcceptAnEmptyGraph() {
        assertThat( format.parse( "# nothing\n" ).size() ).isEqualTo( 0 );
        assertThat( format.parse( "args:\n" ).size() ).isEqualTo( 0 );
    }

    @Test
    void format_shouldRoundTripIdentifiersThatResembleMarkup() {
        ArgumentGraph g = GraphFixtures.graph( "args,_1,-x,A1", "args>A1", "_1>A1", "-x>args" );
        ArgumentGraph parsed = format.parse( format.format( g ) );

        assertThat( parsed.argumentIds() ).containsExactlyElementsOf( g.argumentIds() );
        assertThat( parsed.attackSet() ).containsExactlyInAnyOrderElementsOf( g.attackSet() );
    }

    @Test
    void parse_shouldRejectIdentifiersThatCouldNotBeWrittenBack() {
        assertThatThrownBy( () -> format.parse( "args: A1,a(1)\n" ) )
            .isInstanceOf( MalformedGraphException.class )
            .hasMessageContaining( "a(1)" );
    }

    @Test
    void parse_shouldRejectMalformedLines() {
        assertThatThrownBy( () -> format.parse( "A2,A1\nargs: A1,A2" ) )
            .isInstanceOf( MalformedGraphException.class )
            .hasMessageContaining( "Line 1" );
        assertThatThrownBy( () -> format.parse( "args: A1,A2\nA2;A1" ) )
            .isInstanceOf( MalformedGraphException.class )
            .hasMessageContaining( "Line 2" );
        assertThatThrownBy( () -> format.parse( "args: A1\nargs: A2" ) )
            .isInstanceOf( MalformedGraphException.class );
        assertThatThrownBy( () -> format.parse( "args: A1,A2\nA3,A1" ) )
            .isInstanceOf( MalformedGraphException.class )
            .hasMessageContaining( "A3" );
    }

    @Test
    void format_shouldRoundTrip() {
        Random random = new Random( 3L );

        for ( int i = 0; i < 10; ++i ) {
            ArgumentGraph g = GraphFixtures.random( random, 1 + random.nextInt( 10 ), 0.3 );
            ArgumentGraph parsed = format.parse( format.format( g ) );

            assertThat( parsed.argumentIds() ).containsExactlyInAnyOrderElementsOf( g.argumentIds() );
            assertThat( parsed.attackSet() ).containsExactlyInAnyOrderElementsOf( g.attackSet() );
        }
    }

    @Test
    void writeAndRead_shouldRoundTripThroughAFile( @TempDir File dir ) throws IOException {
        ArgumentGraph g = GraphFixtures.twoBlockers().augment( Arrays.asList( new Defender( "R1", Arrays.asList( "A2", "A3" ) ) ) );
        File file = new File( dir, "graph.txt" );

        format.write( g, file );
        ArgumentGraph read = GraphFormat.forPath( file.getPath() ).read( file );

        assertThat( read.argumentIds() ).containsExactlyElementsOf( g.argumentIds() );
        assertThat( read.attackSet() ).containsExactlyInAnyOrderElementsOf( g.attackSet() );
    }
}
