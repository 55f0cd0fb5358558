package de.unikoblenz.west.argrepair;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class AcceptanceQueryTest {
    private final SemanticsEngine engine = new SemanticsEngine();

    @Test
    void credulousAndSkeptical_shouldFollowTheExtensionFamily() {
        ExtensionFamily family = engine.computeAll( GraphFixtures.persistentAndSoft() );

        // preferred = {B, C}, {B, D}
        assertThat( AcceptanceQuery.credulous( family, SemanticsKind.PREFERRED, "C" ) ).isTrue();
        assertThat( AcceptanceQuery.skeptical( family, SemanticsKind.PREFERRED, "C" ) ).isFalse();
        assertThat( AcceptanceQuery.skeptical( family, SemanticsKind.PREFERRED, "B" ) ).isTrue();
        assertThat( AcceptanceQuery.credulous( family, SemanticsKind.PREFERRED, "A1" ) ).isFalse();
        assertThat( family.coverage( SemanticsKind.PREFERRED, "D" ) ).isEqualTo( new Coverage( 1, 2 ) );
        assertThat( family.coverage( SemanticsKind.PREFERRED, "D" ).ratio() ).isEqualTo( 0.5 );
    }

    @Test
    void grounded_credulousAndSkepticalCoincide() {
        ExtensionFamily family = engine.computeAll( GraphFixtures.persistentAndSoft() );

        for ( String id : GraphFixtures.persistentAndSoft().argumentIds() ) {
            assertThat( AcceptanceQuery.credulous( family, SemanticsKind.GROUNDED, id ) )
                .isEqualTo( AcceptanceQuery.skeptical( family, SemanticsKind.GROUNDED, id ) );
        }
    }

    @Test
    void skeptical_shouldBeFalseWithoutExtensions() {
        ExtensionFamily family = engine.compute( GraphFixtures.oddCycle(), SemanticsKind.STABLE );

        assertThat( AcceptanceQuery.skeptical( family, SemanticsKind.STABLE, "A1" ) ).isFalse();
        assertThat( AcceptanceQuery.credulous( family, SemanticsKind.STABLE, "A1" ) ).isFalse();
        assertThat( family.coverage( SemanticsKind.STABLE, "A1" ).ratio() ).isEqualTo( 0.0 );
    }

    @Test
    void query_shouldUseTheOnlyComputedSemanticsOrPreferred() {
        ExtensionFamily stable_only = engine.compute( GraphFixtures.singleAttack(), SemanticsKind.STABLE );
        ExtensionFamily all = engine.computeAll( GraphFixtures.persistentAndSoft() );

        assertThat( AcceptanceQuery.defaultKind( stable_only ) ).isEqualTo( SemanticsKind.STABLE );
        assertThat( AcceptanceQuery.query( stable_only, "A2", AcceptanceMode.SKEPTICAL ) ).isTrue();
        assertThat( AcceptanceQuery.query( stable_only, "A1", AcceptanceMode.CREDULOUS ) ).isFalse();

        assertThat( AcceptanceQuery.defaultKind( all ) ).isEqualTo( SemanticsKind.PREFERRED );
        assertThat( AcceptanceQuery.query( all, "D", AcceptanceMode.CREDULOUS ) ).isTrue();
        assertThat( AcceptanceQuery.query( all, "D", AcceptanceMode.SKEPTICAL ) ).isFalse();
        assertThat( AcceptanceQuery.query( all, SemanticsKind.GROUNDED, "D", AcceptanceMode.CREDULOUS ) ).isFalse();
    }

    @Test
    void query_shouldRejectUnknownTarget() {
        ExtensionFamily family = engine.computeAll( GraphFixtures.singleAttack() );

        assertThatThrownBy( () -> AcceptanceQuery.query( family, "Z", AcceptanceMode.CREDULOUS ) )
            .isInstanceOf( IllegalArgumentException.class );
    }

    @Test
    void insights_shouldSeparateRoadblocksPersistentAndSoftAttackers() {
        ArgumentGraph g = GraphFixtures.persistentAndSoft();
        AcceptanceInsights insights = AcceptanceQuery.insights( g, engine.computeAll( g ), "A1" );

        assertThat( insights.target() ).isEqualTo( "A1" );
        assertThat( insights.groundedRoadblocks() ).containsExactly( "B", "C" );
        assertThat( insights.persistentAttackers() ).containsExactly( "B" );
        assertThat( insights.softAttackers() ).containsExactly( "C" );
    }

    @Test
    void insights_shouldReportNoRoadblocksForGroundedTargets() {
        ArgumentGraph g = GraphFixtures.graph( "A,B,C", "A>B", "B>C" );
        AcceptanceInsights insights = AcceptanceQuery.insights( g, engine.computeAll( g ), "C" );

        assertThat( insights.groundedRoadblocks() ).isEmpty();
        assertThat( insights.persistentAttackers() ).isEmpty();
        assertThat( insights.softAttackers() ).isEmpty();
    }

    @Test
    void insights_shouldRequireGroundedAndPreferred() {
        ArgumentGraph g = GraphFixtures.singleAttack();

        assertThatThrownBy( () -> AcceptanceQuery.insights( g, engine.compute( g, SemanticsKind.STABLE ), "A1" ) )
            .isInstanceOf( IllegalArgumentException.class );
    }
}
