package de.unikoblenz.west.argrepair;

/**
 * @brief Thrown when an argumentation framework cannot be constructed from the given arguments and attacks.
 */
public class MalformedGraphException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public enum Reason {
        DUPLICATE_ARGUMENT,
        UNKNOWN_ARGUMENT_IN_ATTACK,
        INVALID_IDENTIFIER,
        SYNTAX
    }

    private final Reason reason_;
    private final String argument_;

    public MalformedGraphException( Reason reason, String argument, String message ) {
        super( message );
        reason_ = reason;
        argument_ = argument;
    }

    public static MalformedGraphException duplicateArgument( String id ) {
        return new MalformedGraphException( Reason.DUPLICATE_ARGUMENT, id, "Duplicate argument: " + id );
    }

    public static MalformedGraphException unknownArgumentInAttack( String id, String attacker, String target ) {
        return new MalformedGraphException( Reason.UNKNOWN_ARGUMENT_IN_ATTACK, id, "Attack " + attacker + " -> " + target + " references unknown argument " + id );
    }

    public static MalformedGraphException invalidIdentifier( String id ) {
        return new MalformedGraphException( Reason.INVALID_IDENTIFIER, id, "Invalid argument identifier: \"" + id + "\" (expected letters, digits, '_' or '-')" );
    }

    /**
     * @brief A line of a serialized graph that could not be parsed.
     */
    public static MalformedGraphException syntax( int line_number, String line, String expected ) {
        return new MalformedGraphException( Reason.SYNTAX, null, "Line " + line_number + ": expected " + expected + ", got \"" + line + "\"" );
    }

    /**
     * @return the kind of malformation
     */
    public Reason reason() {
        return reason_;
    }

    /**
     * @return the offending argument identifier, or null for syntax errors
     */
    public String argument() {
        return argument_;
    }
}
