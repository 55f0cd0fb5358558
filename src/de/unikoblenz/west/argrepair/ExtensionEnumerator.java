package de.unikoblenz.west.argrepair;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * @brief Enumerates the conflict-free supersets of a base set and keeps those accepted by a filter.
 *
 * The search branches on each free argument (include / exclude) in index order. An argument can only be included if it is
 * not in conflict with anything chosen so far, so every leaf of the search tree is a conflict-free set and conflicting
 * branches are never explored. With a parallelism above one, the top levels of the tree are expanded on the calling thread
 * and the resulting subtrees are searched by a worker pool; the union of the accepted leaves does not depend on the order
 * in which workers finish.
 */
public class ExtensionEnumerator {
    /**
     * @brief Decides whether a conflict-free candidate is kept.
     */
    public interface CandidateFilter {
        boolean accept( BitSet candidate );
    }

    private final EngineConfig config_;

    public ExtensionEnumerator( EngineConfig config ) {
        config_ = config;
    }

    /**
     * @brief A partial assignment: the arguments chosen so far, the arguments that can no longer be chosen, and the next decision.
     */
    private static class Branch {
        final BitSet in_;
        final BitSet blocked_;
        final int position_;

        Branch( BitSet in, BitSet blocked, int position ) {
            in_ = in;
            blocked_ = blocked;
            position_ = position;
        }
    }

    /**
     * @brief Counts visited search nodes and enforces the node and time caps. Shared by all workers of one enumeration.
     */
    private static class SearchBudget {
        private final AtomicLong visited_ = new AtomicLong();
        private final long max_nodes_;
        private final long deadline_nanos_;

        SearchBudget( long max_nodes, int timeout_seconds ) {
            max_nodes_ = max_nodes;
            deadline_nanos_ = timeout_seconds > 0 ? System.nanoTime() + TimeUnit.SECONDS.toNanos( timeout_seconds ) : 0L;
        }

        void visit() {
            long count = visited_.incrementAndGet();

            if ( count > max_nodes_ ) {
                throw new SearchExhaustedException( "Extension enumeration exceeded " + max_nodes_ + " search nodes" );
            }

            if ( ( count & 1023L ) == 0 ) {
                if ( deadline_nanos_ != 0L && System.nanoTime() > deadline_nanos_ ) {
                    throw new SearchExhaustedException( "Extension enumeration timed out" );
                }

                if ( Thread.currentThread().isInterrupted() ) {
                    throw new SearchExhaustedException( "Extension enumeration was interrupted" );
                }
            }
        }

        long visited() {
            return visited_.get();
        }
    }

    /**
     * @brief Searches one subtree. Exceptions are kept in _error_ since they would otherwise be lost in the pool.
     */
    private static class EnumerationTask implements Callable< Void > {
        private final ArgumentGraph graph_;
        private final int[] free_;
        private final Branch branch_;
        private final CandidateFilter filter_;
        private final SearchBudget budget_;
        public final List< BitSet > results_;
        public Throwable error_;

        EnumerationTask( ArgumentGraph graph, int[] free, Branch branch, CandidateFilter filter, SearchBudget budget ) {
            graph_ = graph;
            free_ = free;
            branch_ = branch;
            filter_ = filter;
            budget_ = budget;
            results_ = new ArrayList< BitSet >();
            error_ = null;
        }

        public Void call() {
            try {
                search( graph_, free_, branch_, filter_, budget_, results_ );
            }
            catch ( Throwable e ) {
                error_ = e;
            }

            return null;
        }
    }

    /**
     * @brief Enumerate all conflict-free sets S with base ⊆ S and S ∩ excluded = ∅ that are accepted by _filter_.
     * @param graph the framework
     * @param base arguments that are in every candidate; must be conflict-free
     * @param excluded arguments that are in no candidate
     * @param filter the acceptance test applied to each complete candidate
     * @return the accepted candidates, in no particular order
     * @throws SearchExhaustedException if the node cap or the timeout is hit
     */
    public List< BitSet > enumerate( ArgumentGraph graph, BitSet base, BitSet excluded, CandidateFilter filter ) {
        if ( !Defense.isConflictFree( graph, base ) ) {
            throw new IllegalStateException( "Enumeration base " + graph.ids( base ) + " is not conflict-free" );
        }

        BitSet blocked = conflictsOf( graph, base );
        blocked.or( excluded );

        List< Integer > free_list = new ArrayList< Integer >();

        for ( int a = 0; a < graph.size(); ++a ) {
            if ( !base.get( a ) && !blocked.get( a ) && !graph.isSelfAttacking( a ) ) {
                free_list.add( a );
            }
        }

        int[] free = new int[ free_list.size() ];

        for ( int i = 0; i < free.length; ++i ) {
            free[ i ] = free_list.get( i );
        }

        SearchBudget budget = new SearchBudget( config_.maxSearchNodes(), config_.timeoutSeconds() );
        Branch root = new Branch( ( BitSet ) base.clone(), blocked, 0 );
        List< BitSet > results;

        if ( config_.parallelism() > 1 && free.length > 1 ) {
            results = searchParallel( graph, free, root, filter, budget );
        }
        else {
            results = new ArrayList< BitSet >();
            search( graph, free, root, filter, budget, results );
        }

        ArgRepair.logger.fine( "Enumerated " + free.length + " free arguments, visited " + budget.visited() + " search nodes, accepted " + results.size() + " candidates" );

        return results;
    }

    /**
     * @return every argument that conflicts with some member of _s_ (attacked by it or attacking it), plus _s_ itself
     */
    private static BitSet conflictsOf( ArgumentGraph graph, BitSet s ) {
        BitSet conflicting = Defense.range( graph, s );

        for ( int i = s.nextSetBit( 0 ); i >= 0; i = s.nextSetBit( i + 1 ) ) {
            conflicting.or( graph.incoming( i ) );
        }

        return conflicting;
    }

    private static void search( ArgumentGraph graph, int[] free, Branch branch, CandidateFilter filter, SearchBudget budget, List< BitSet > results ) {
        budget.visit();

        if ( branch.position_ == free.length ) {
            if ( filter.accept( branch.in_ ) ) {
                results.add( ( BitSet ) branch.in_.clone() );
            }

            return;
        }

        int a = free[ branch.position_ ];

        // Include _a_ if nothing chosen so far conflicts with it
        if ( !branch.blocked_.get( a ) ) {
            search( graph, free, include( graph, branch, a ), filter, budget, results );
        }

        search( graph, free, new Branch( branch.in_, branch.blocked_, branch.position_ + 1 ), filter, budget, results );
    }

    private static Branch include( ArgumentGraph graph, Branch branch, int a ) {
        BitSet in = ( BitSet ) branch.in_.clone();
        in.set( a );

        BitSet blocked = ( BitSet ) branch.blocked_.clone();
        blocked.or( graph.outgoing( a ) );
        blocked.or( graph.incoming( a ) );

        return new Branch( in, blocked, branch.position_ + 1 );
    }

    private List< BitSet > searchParallel( ArgumentGraph graph, int[] free, Branch root, CandidateFilter filter, SearchBudget budget ) {
        // Expand the top of the tree until there are a few subtrees per worker
        int split_depth = Math.min( free.length, 2 + 32 - Integer.numberOfLeadingZeros( config_.parallelism() ) );
        List< Branch > frontier = new ArrayList< Branch >();
        frontier.add( root );

        for ( int depth = 0; depth < split_depth; ++depth ) {
            List< Branch > next = new ArrayList< Branch >();

            for ( Branch branch : frontier ) {
                budget.visit();
                int a = free[ branch.position_ ];

                if ( !branch.blocked_.get( a ) ) {
                    next.add( include( graph, branch, a ) );
                }

                next.add( new Branch( branch.in_, branch.blocked_, branch.position_ + 1 ) );
            }

            frontier = next;
        }

        List< EnumerationTask > tasks = new ArrayList< EnumerationTask >();

        for ( Branch branch : frontier ) {
            tasks.add( new EnumerationTask( graph, free, branch, filter, budget ) );
        }

        ExecutorService executor = Executors.newFixedThreadPool( config_.parallelism() );
        List< Future< Void > > futures;

        try {
            if ( config_.timeoutSeconds() > 0 ) {
                futures = executor.invokeAll( tasks, config_.timeoutSeconds(), TimeUnit.SECONDS );
            }
            else {
                futures = executor.invokeAll( tasks );
            }
        }
        catch ( InterruptedException e ) {
            Thread.currentThread().interrupt();
            throw new SearchExhaustedException( "Extension enumeration was interrupted" );
        }
        finally {
            executor.shutdownNow();
        }

        for ( Future< Void > future : futures ) {
            if ( future.isCancelled() ) {
                throw new SearchExhaustedException( "Extension enumeration timed out" );
            }
        }

        List< BitSet > results = new ArrayList< BitSet >();

        for ( EnumerationTask task : tasks ) {
            if ( task.error_ instanceof RuntimeException ) {
                throw ( RuntimeException ) task.error_;
            }

            if ( task.error_ instanceof Error ) {
                throw ( Error ) task.error_;
            }

            if ( task.error_ != null ) {
                throw new IllegalStateException( "Enumeration worker failed: " + task.error_.getMessage(), task.error_ );
            }

            results.addAll( task.results_ );
        }

        return results;
    }
}
