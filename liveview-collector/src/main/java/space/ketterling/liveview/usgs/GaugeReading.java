package space.ketterling.liveview.usgs;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Latest gage height of one USGS site.
 */
public record GaugeReading(
        String siteCode,
        String siteName,
        double latitude,
        double longitude,
        BigDecimal gageHeightFt,
        Instant observedAt) {
}
