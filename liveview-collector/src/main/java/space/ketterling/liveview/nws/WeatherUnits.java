package space.ketterling.liveview.nws;

/**
 * Unit conversions for weather.gov observations (reported in SI units).
 */
public final class WeatherUnits {
    private static final String[] DIRECTIONS = {
            "N", "NNE", "NE", "ENE", "E", "ESE", "SE", "SSE",
            "S", "SSW", "SW", "WSW", "W", "WNW", "NW", "NNW"
    };

    private WeatherUnits() {
    }

    /**
     * °C to °F, rounded half up.
     */
    public static int celsiusToFahrenheit(double celsius) {
        return (int) Math.round(celsius * 9.0 / 5.0 + 32.0);
    }

    /**
     * Degrees to the 16-point compass; 360 wraps to N.
     */
    public static String degreesToCardinal(double degrees) {
        double normalized = ((degrees % 360.0) + 360.0) % 360.0;
        int index = (int) Math.round(normalized / 22.5) % 16;
        return DIRECTIONS[index];
    }

    /**
     * Metres per second, formatted like weather.gov text ("12 mph").
     */
    public static String metersPerSecondToMphText(double mps) {
        return Math.round(mps * 2.237) + " mph";
    }

    public static int pascalsToMillibars(double pa) {
        return (int) Math.round(pa / 100.0);
    }

    public static int metersToFeet(double m) {
        return (int) Math.round(m * 3.28084);
    }
}
