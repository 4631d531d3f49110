package space.ketterling.liveview.alerts;

import java.util.Locale;

/**
 * CAP urgency, ranked Immediate > Expected > Future > Past > Unknown.
 */
public enum Urgency {
    UNKNOWN(0), PAST(1), FUTURE(2), EXPECTED(3), IMMEDIATE(4);

    private final int rank;

    Urgency(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public static Urgency of(String s) {
        if (s == null)
            return UNKNOWN;
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
