package space.ketterling.liveview.alerts;

import java.util.Locale;

/**
 * CAP severity, ranked so that higher is more severe.
 */
public enum Severity {
    UNKNOWN(0), MINOR(1), MODERATE(2), SEVERE(3), EXTREME(4);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    /**
     * Case-insensitive lookup; anything unrecognised is {@link #UNKNOWN}.
     */
    public static Severity of(String s) {
        if (s == null)
            return UNKNOWN;
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
