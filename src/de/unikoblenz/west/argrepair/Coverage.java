package de.unikoblenz.west.argrepair;

import java.util.Locale;

/**
 * @brief How many extensions of a family contain a target argument (k of n).
 */
public class Coverage {
    private final int accepted_;
    private final int total_;

    public Coverage( int accepted, int total ) {
        if ( accepted < 0 || total < 0 || accepted > total ) {
            throw new IllegalArgumentException( "Invalid coverage " + accepted + "/" + total );
        }

        accepted_ = accepted;
        total_ = total;
    }

    /**
     * @return the number of extensions containing the target
     */
    public int accepted() {
        return accepted_;
    }

    /**
     * @return the number of extensions
     */
    public int total() {
        return total_;
    }

    /**
     * @return accepted / total, or 0.0 for an empty family
     */
    public double ratio() {
        return total_ == 0 ? 0.0 : ( double ) accepted_ / total_;
    }

    @Override
    public boolean equals( Object obj ) {
        if ( !( obj instanceof Coverage ) ) {
            return false;
        }

        Coverage other = ( Coverage ) obj;

        return accepted_ == other.accepted_ && total_ == other.total_;
    }

    @Override
    public int hashCode() {
        return 31 * accepted_ + total_;
    }

    @Override
    public String toString() {
        return accepted_ + "/" + total_ + String.format( Locale.ROOT, " (%.2f)", ratio() );
    }
}
