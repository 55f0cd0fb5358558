package de.unikoblenz.west.argrepair;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Test;

/**
 * @brief Checks the engine on seeded random graphs against the definitions, evaluated by brute force over the power set.
 */
class SemanticsPropertiesTest {
    private static final int GRAPHS = 60;

    private final SemanticsEngine engine = new SemanticsEngine();

    private static Set< BitSet > members( List< Extension > extensions ) {
        Set< BitSet > sets = new HashSet< BitSet >();

        for ( Extension e : extensions ) {
            sets.add( e.members() );
        }

        return sets;
    }

    private static List< BitSet > powerSet( int n ) {
        List< BitSet > sets = new ArrayList< BitSet >();

        for ( int mask = 0; mask < ( 1 << n ); ++mask ) {
            sets.add( BitSet.valueOf( new long[] { mask } ) );
        }

        return sets;
    }

    private static boolean attacksFromSet( ArgumentGraph g, BitSet s, String target ) {
        for ( String attacker : g.attackersOf( target ) ) {
            if ( s.get( g.indexOf( attacker ) ) ) {
                return true;
            }
        }

        return false;
    }

    private static boolean conflictFree( ArgumentGraph g, BitSet s ) {
        for ( int a = s.nextSetBit( 0 ); a >= 0; a = s.nextSetBit( a + 1 ) ) {
            if ( attacksFromSet( g, s, g.argument( a ).id() ) ) {
                return false;
            }
        }

        return true;
    }

    private static boolean admissible( ArgumentGraph g, BitSet s ) {
        if ( !conflictFree( g, s ) ) {
            return false;
        }

        for ( int a = s.nextSetBit( 0 ); a >= 0; a = s.nextSetBit( a + 1 ) ) {
            for ( String attacker : g.attackersOf( g.argument( a ).id() ) ) {
                if ( !attacksFromSet( g, s, attacker ) ) {
                    return false;
                }
            }
        }

        return true;
    }

    private static boolean stable( ArgumentGraph g, BitSet s ) {
        if ( !conflictFree( g, s ) ) {
            return false;
        }

        for ( int a = 0; a < g.size(); ++a ) {
            if ( !s.get( a ) && !attacksFromSet( g, s, g.argument( a ).id() ) ) {
                return false;
            }
        }

        return true;
    }

    private static boolean defends( ArgumentGraph g, BitSet s, int a ) {
        for ( String attacker : g.attackersOf( g.argument( a ).id() ) ) {
            if ( !attacksFromSet( g, s, attacker ) ) {
                return false;
            }
        }

        return true;
    }

    private static boolean complete( ArgumentGraph g, BitSet s ) {
        if ( !admissible( g, s ) ) {
            return false;
        }

        for ( int a = 0; a < g.size(); ++a ) {
            if ( !s.get( a ) && defends( g, s, a ) ) {
                return false;
            }
        }

        return true;
    }

    private static BitSet range( ArgumentGraph g, BitSet s ) {
        BitSet range = ( BitSet ) s.clone();

        for ( int a = 0; a < g.size(); ++a ) {
            if ( attacksFromSet( g, s, g.argument( a ).id() ) ) {
                range.set( a );
            }
        }

        return range;
    }

    private static Set< BitSet > rangeMaximal( ArgumentGraph g, Set< BitSet > family ) {
        Set< BitSet > maximal = new HashSet< BitSet >();

        for ( BitSet s : family ) {
            boolean is_maximal = true;

            for ( BitSet t : family ) {
                if ( MaximalityFilter.isProperSubset( range( g, s ), range( g, t ) ) ) {
                    is_maximal = false;
                }
            }

            if ( is_maximal ) {
                maximal.add( s );
            }
        }

        return maximal;
    }

    private static Set< BitSet > subsetMaximal( List< BitSet > family ) {
        Set< BitSet > maximal = new HashSet< BitSet >();

        for ( BitSet s : family ) {
            boolean is_maximal = true;

            for ( BitSet t : family ) {
                if ( !s.equals( t ) && MaximalityFilter.isProperSubset( s, t ) ) {
                    is_maximal = false;
                }
            }

            if ( is_maximal ) {
                maximal.add( s );
            }
        }

        return maximal;
    }

    @Test
    void randomGraphs_shouldSatisfyTheDefinitions() {
        Random random = new Random( 20240611L );

        for ( int i = 0; i < GRAPHS; ++i ) {
            int size = 1 + random.nextInt( 8 );
            ArgumentGraph g = GraphFixtures.random( random, size, 0.1 + 0.3 * random.nextDouble() );
            ExtensionFamily family = engine.computeAll( g );
            String label = "graph " + i + ": " + g;

            // Brute-force families
            List< BitSet > admissible = new ArrayList< BitSet >();
            Set< BitSet > conflict_free = new HashSet< BitSet >();
            Set< BitSet > stable = new HashSet< BitSet >();
            Set< BitSet > complete = new HashSet< BitSet >();

            for ( BitSet s : powerSet( size ) ) {
                if ( conflictFree( g, s ) ) {
                    conflict_free.add( s );
                }

                if ( admissible( g, s ) ) {
                    admissible.add( s );
                }

                if ( stable( g, s ) ) {
                    stable.add( s );
                }

                if ( complete( g, s ) ) {
                    complete.add( s );
                }
            }

            // The least complete extension is the intersection of all of them
            BitSet least = null;

            for ( BitSet s : complete ) {
                if ( least == null ) {
                    least = ( BitSet ) s.clone();
                }
                else {
                    least.and( s );
                }
            }

            assertThat( members( family.extensions( SemanticsKind.CONFLICT_FREE ) ) ).as( label ).isEqualTo( conflict_free );
            assertThat( members( family.extensions( SemanticsKind.ADMISSIBLE ) ) ).as( label ).isEqualTo( new HashSet< BitSet >( admissible ) );
            assertThat( members( family.extensions( SemanticsKind.PREFERRED ) ) ).as( label ).isEqualTo( subsetMaximal( admissible ) );
            assertThat( members( family.extensions( SemanticsKind.STABLE ) ) ).as( label ).isEqualTo( stable );
            assertThat( members( family.extensions( SemanticsKind.COMPLETE ) ) ).as( label ).isEqualTo( complete );
            assertThat( family.extensions( SemanticsKind.GROUNDED ).get( 0 ).members() ).as( label ).isEqualTo( least );
            assertThat( members( family.extensions( SemanticsKind.STAGE ) ) ).as( label ).isEqualTo( rangeMaximal( g, conflict_free ) );
            assertThat( members( family.extensions( SemanticsKind.SEMI_STABLE ) ) ).as( label ).isEqualTo( rangeMaximal( g, new HashSet< BitSet >( admissible ) ) );

            // Grounded uniqueness and minimality among complete extensions
            List< Extension > grounded = family.extensions( SemanticsKind.GROUNDED );
            assertThat( grounded ).as( label ).hasSize( 1 );

            for ( Extension complete_extension : family.extensions( SemanticsKind.COMPLETE ) ) {
                assertThat( grounded.get( 0 ).isSubsetOf( complete_extension ) ).as( label ).isTrue();
            }

            // Defense invariant
            for ( SemanticsKind kind : new SemanticsKind[] { SemanticsKind.ADMISSIBLE, SemanticsKind.COMPLETE, SemanticsKind.GROUNDED, SemanticsKind.PREFERRED, SemanticsKind.STABLE, SemanticsKind.SEMI_STABLE } ) {
                for ( Extension e : family.extensions( kind ) ) {
                    assertThat( admissible( g, e.members() ) ).as( label + " " + kind + " " + e ).isTrue();
                }
            }

            // Preferred maximality
            List< Extension > preferred = family.extensions( SemanticsKind.PREFERRED );

            for ( Extension a : preferred ) {
                for ( Extension b : preferred ) {
                    assertThat( a.isProperSubsetOf( b ) ).as( label ).isFalse();
                }
            }

            // Stable extensions are preferred, and when they exist they are exactly the stage and semi-stable extensions
            assertThat( preferred ).as( label ).containsAll( family.extensions( SemanticsKind.STABLE ) );

            if ( !stable.isEmpty() ) {
                assertThat( members( family.extensions( SemanticsKind.STAGE ) ) ).as( label ).isEqualTo( stable );
                assertThat( members( family.extensions( SemanticsKind.SEMI_STABLE ) ) ).as( label ).isEqualTo( stable );
            }

            // Stage extensions are conflict-free
            for ( Extension e : family.extensions( SemanticsKind.STAGE ) ) {
                assertThat( conflictFree( g, e.members() ) ).as( label ).isTrue();
            }
        }
    }

    @Test
    void extensions_shouldBeSortedDeterministically() {
        Random random = new Random( 99L );

        for ( int i = 0; i < 20; ++i ) {
            ArgumentGraph g = GraphFixtures.random( random, 7, 0.25 );
            List< Extension > first = engine.compute( g, SemanticsKind.CONFLICT_FREE ).extensions( SemanticsKind.CONFLICT_FREE );
            List< Extension > second = engine.compute( g, SemanticsKind.CONFLICT_FREE ).extensions( SemanticsKind.CONFLICT_FREE );

            assertThat( first ).isEqualTo( second );
            assertThat( first ).isSorted();
        }
    }
}
