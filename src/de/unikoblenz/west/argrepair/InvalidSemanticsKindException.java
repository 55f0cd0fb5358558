package de.unikoblenz.west.argrepair;

/**
 * @brief Thrown when a semantics name does not denote a supported semantics.
 */
public class InvalidSemanticsKindException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final String name_;

    public InvalidSemanticsKindException( String name ) {
        super( "Unknown semantics: \"" + name + "\". Options: conflict-free, admissible, complete, grounded, preferred, stable, stage, semi-stable" );
        name_ = name;
    }

    public String name() {
        return name_;
    }
}
