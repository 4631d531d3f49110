package space.ketterling.liveview.nws;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WeatherUnitsTest {

    @Test
    void celsiusToFahrenheit_shouldRound() {
        assertEquals(32, WeatherUnits.celsiusToFahrenheit(0.0));
        assertEquals(-40, WeatherUnits.celsiusToFahrenheit(-40.0));
        assertEquals(72, WeatherUnits.celsiusToFahrenheit(22.2));
    }

    @Test
    void degreesToCardinal_shouldUseSixteenPoints() {
        assertEquals("N", WeatherUnits.degreesToCardinal(0));
        assertEquals("N", WeatherUnits.degreesToCardinal(359));
        assertEquals("NNE", WeatherUnits.degreesToCardinal(22.5));
        assertEquals("E", WeatherUnits.degreesToCardinal(90));
        assertEquals("SW", WeatherUnits.degreesToCardinal(225));
        assertEquals("N", WeatherUnits.degreesToCardinal(360));
    }

    @Test
    void metersPerSecondToMphText_shouldFormatWholeMph() {
        assertEquals("11 mph", WeatherUnits.metersPerSecondToMphText(5.0));
        assertEquals("0 mph", WeatherUnits.metersPerSecondToMphText(0.0));
    }

    @Test
    void pressureAndElevation_shouldConvert() {
        assertEquals(1013, WeatherUnits.pascalsToMillibars(101325));
        assertEquals(1000, WeatherUnits.metersToFeet(304.8));
    }
}
