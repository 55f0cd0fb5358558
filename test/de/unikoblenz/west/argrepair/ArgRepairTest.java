package de.unikoblenz.west.argrepair;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArgRepairTest {
    @TempDir
    File dir;

    private File input;
    private ByteArrayOutputStream buffer;
    private PrintStream out;

    @BeforeEach
    void setUp() throws IOException {
        input = new File( dir, "graph.txt" );
        FileUtils.writeLines( input, StandardCharsets.UTF_8.name(), Arrays.asList( "# A1 has two blockers", "args: A1,A2,A3,A4", "A2,A1", "A3,A1" ) );
        buffer = new ByteArrayOutputStream();
        out = new PrintStream( buffer, true, StandardCharsets.UTF_8 );
    }

    private String output() {
        return new String( buffer.toByteArray(), StandardCharsets.UTF_8 );
    }

    @Test
    void analyze_shouldPrintExtensionsAndInsights() {
        int code = ArgRepair.run( new String[] { "-i", input.getPath(), "-q", "A1" }, out );

        assertThat( code ).isEqualTo( ArgRepair.EXIT_OK );
        assertThat( output() )
            .contains( "[grounded] 1 extension(s)" )
            .contains( "{A2, A3, A4}" )
            .contains( "[stable] 1 extension(s)" )
            .contains( "preferred: no, coverage 0/1 (0.00)" )
            .contains( "grounded roadblocks: {A2, A3}" );
    }

    @Test
    void analyze_shouldHonorTheRequestedSemantics() {
        int code = ArgRepair.run( new String[] { "-i", input.getPath(), "-s", "stable" }, out );

        assertThat( code ).isEqualTo( ArgRepair.EXIT_OK );
        assertThat( output() ).contains( "[stable] 1 extension(s)" ).doesNotContain( "[preferred]" );
    }

    @Test
    void repair_shouldWriteTheAugmentedGraphNextToTheInput() throws IOException {
        int code = ArgRepair.run( new String[] { "-i", input.getPath(), "-q", "A1", "-r" }, out );
        File repaired = new File( dir, "graph_repaired.txt" );

        assertThat( code ).isEqualTo( ArgRepair.EXIT_OK );
        assertThat( output() ).contains( "PLANNED" ).contains( "defender R1 attacks {A2, A3}" ).contains( "after: 1/1 (1.00)" );
        assertThat( repaired ).exists();

        ArgumentGraph g = new EdgeListFormat().read( repaired );
        assertThat( g.argumentIds() ).containsExactly( "A1", "A2", "A3", "A4", "R1" );
        assertThat( g.attackedBy( "R1" ) ).containsExactly( "A2", "A3" );
    }

    @Test
    void repair_shouldHonorOutputPathAndApxInput() throws IOException {
        File apx = new File( dir, "graph.apx" );
        FileUtils.writeLines( apx, StandardCharsets.UTF_8.name(), Arrays.asList( "arg(a). arg(b). arg(c).", "att(b,a).", "att(c,a)." ) );
        File target = new File( dir, "out.apx" );

        int code = ArgRepair.run( new String[] { "-i", apx.getPath(), "-q", "a", "-r", "-k", "2", "-f", "1", "-o", target.getPath(), "-x", "exact" }, out );

        assertThat( code ).isEqualTo( ArgRepair.EXIT_OK );
        assertThat( new ApxFormat().read( target ).argumentIds() ).containsExactly( "a", "b", "c", "R1", "R2" );
    }

    @Test
    void repair_shouldFailWhenInfeasible() {
        int code = ArgRepair.run( new String[] { "-i", input.getPath(), "-q", "A1", "-r", "-k", "0" }, out );

        assertThat( code ).isEqualTo( ArgRepair.EXIT_FAILURE );
        assertThat( output() ).contains( "INFEASIBLE" ).contains( "budget exhausted, 2 blockers require at least 1 group but k=0" );
        assertThat( new File( dir, "graph_repaired.txt" ) ).doesNotExist();
    }

    @Test
    void repair_shouldRequireATarget() {
        assertThat( ArgRepair.run( new String[] { "-i", input.getPath(), "-r" }, out ) ).isEqualTo( ArgRepair.EXIT_USAGE );
    }

    @Test
    void skepticalRepair_shouldRequireCoverage() {
        int code = ArgRepair.run( new String[] { "-i", input.getPath(), "-q", "A1", "-r", "-m", "skeptical" }, out );

        assertThat( code ).isEqualTo( ArgRepair.EXIT_FAILURE );
        assertThat( output() ).contains( "explicit minimum coverage" );
    }

    @Test
    void run_shouldReportUsageErrors() {
        assertThat( ArgRepair.run( new String[] { "-q", "A1" }, out ) ).isEqualTo( ArgRepair.EXIT_USAGE );
        assertThat( ArgRepair.run( new String[] { "-i", input.getPath(), "-k", "many" }, out ) ).isEqualTo( ArgRepair.EXIT_USAGE );
        assertThat( ArgRepair.run( new String[] { "-h" }, out ) ).isEqualTo( ArgRepair.EXIT_OK );
    }

    @Test
    void run_shouldFailOnBadInput() {
        assertThat( ArgRepair.run( new String[] { "-i", input.getPath(), "-s", "ideal" }, out ) ).isEqualTo( ArgRepair.EXIT_FAILURE );
        assertThat( ArgRepair.run( new String[] { "-i", new File( dir, "missing.txt" ).getPath() }, out ) ).isEqualTo( ArgRepair.EXIT_FAILURE );
        assertThat( ArgRepair.run( new String[] { "-i", input.getPath(), "-q", "Z" }, out ) ).isEqualTo( ArgRepair.EXIT_FAILURE );
    }
}
