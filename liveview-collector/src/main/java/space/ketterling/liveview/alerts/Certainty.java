package space.ketterling.liveview.alerts;

import java.util.Locale;

/**
 * CAP certainty, ranked Observed > Likely > Possible > Unlikely > Unknown.
 */
public enum Certainty {
    UNKNOWN(0), UNLIKELY(1), POSSIBLE(2), LIKELY(3), OBSERVED(4);

    private final int rank;

    Certainty(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public static Certainty of(String s) {
        if (s == null)
            return UNKNOWN;
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
