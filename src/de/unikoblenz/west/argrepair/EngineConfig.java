package de.unikoblenz.west.argrepair;

/**
 * @brief Resource limits for extension enumeration.
 */
public class EngineConfig {
    public static final long DEFAULT_MAX_SEARCH_NODES = 5000000L;

    private final int parallelism_;
    private final long max_search_nodes_;
    private final int timeout_seconds_;

    /**
     * @brief Class constructor.
     * @param parallelism number of worker threads used for enumeration (1 = enumerate on the calling thread)
     * @param max_search_nodes cap on the number of search nodes visited per enumeration
     * @param timeout_seconds wall-clock limit per enumeration; 0 means no limit
     */
    public EngineConfig( int parallelism, long max_search_nodes, int timeout_seconds ) {
        if ( parallelism < 1 ) {
            throw new IllegalArgumentException( "Parallelism must be at least 1, got " + parallelism );
        }

        if ( max_search_nodes < 1 ) {
            throw new IllegalArgumentException( "Search node cap must be positive, got " + max_search_nodes );
        }

        if ( timeout_seconds < 0 ) {
            throw new IllegalArgumentException( "Timeout must not be negative, got " + timeout_seconds );
        }

        parallelism_ = parallelism;
        max_search_nodes_ = max_search_nodes;
        timeout_seconds_ = timeout_seconds;
    }

    public static EngineConfig defaults() {
        return new EngineConfig( 1, DEFAULT_MAX_SEARCH_NODES, 0 );
    }

    public int parallelism() {
        return parallelism_;
    }

    public long maxSearchNodes() {
        return max_search_nodes_;
    }

    public int timeoutSeconds() {
        return timeout_seconds_;
    }

    @Override
    public String toString() {
        return "EngineConfig[parallelism=" + parallelism_ + ", max_search_nodes=" + max_search_nodes_ + ", timeout_seconds=" + timeout_seconds_ + "]";
    }
}
