package de.unikoblenz.west.argrepair;

/**
 * @brief Thrown when a search hits its iteration or wall-clock cap before reaching a definitive answer.
 *
 * Callers may retry with a larger budget.
 */
public class SearchExhaustedException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public SearchExhaustedException( String message ) {
        super( message );
    }
}
