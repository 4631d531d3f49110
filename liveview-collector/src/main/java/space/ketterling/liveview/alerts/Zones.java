package space.ketterling.liveview.alerts;

import java.util.Locale;

/**
 * Helpers for weather.gov forecast zone identifiers.
 */
public final class Zones {
    private Zones() {
    }

    /**
     * "https://api.weather.gov/zones/forecast/VTZ001" -> "VTZ001"; bare ids are
     * returned unchanged.
     */
    public static String extractZoneId(String zoneUrlOrId) {
        if (zoneUrlOrId == null)
            return null;
        String s = zoneUrlOrId.trim();
        while (s.endsWith("/"))
            s = s.substring(0, s.length() - 1);
        int slash = s.lastIndexOf('/');
        return slash < 0 ? s : s.substring(slash + 1);
    }

    /**
     * True when the zone belongs to the state, e.g. "VTZ001" for "VT".
     */
    public static boolean isRegionZone(String zoneUrlOrId, String region) {
        String id = extractZoneId(zoneUrlOrId);
        return id != null && id.startsWith(region.toUpperCase(Locale.ROOT) + "Z");
    }
}
