package de.unikoblenz.west.argrepair;

import java.util.Locale;

/**
 * @brief Credulous: in some extension. Skeptical: in every extension.
 */
public enum AcceptanceMode {
    CREDULOUS,
    SKEPTICAL;

    /**
     * @throws IllegalArgumentException for anything but "credulous" or "skeptical" (case is ignored)
     */
    public static AcceptanceMode fromName( String name ) {
        if ( name != null ) {
            for ( AcceptanceMode mode : values() ) {
                if ( mode.name().equalsIgnoreCase( name.trim() ) ) {
                    return mode;
                }
            }
        }

        throw new IllegalArgumentException( "Unknown acceptance mode: \"" + name + "\". Options: credulous, skeptical" );
    }

    @Override
    public String toString() {
        return name().toLowerCase( Locale.ROOT );
    }
}
