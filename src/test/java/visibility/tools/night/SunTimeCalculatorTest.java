package visibility.tools.night;

import org.junit.Test;
import visibility.tools.coordinates.GeoCoordinates;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SunTimeCalculatorTest {

    private static final GeoCoordinates LONDON = new GeoCoordinates(51.5074, -0.1278);
    private static final long TOLERANCE_SECONDS = 10 * 60;

    private final SunTimeCalculator calculator = new SunTimeCalculator();

    @Test
    public void londonMidsummerNight() throws SunTimeException {
        NightInterval night = calculator.nightOf(LocalDate.of(2024, 6, 21), LONDON);

        assertClose(Instant.parse("2024-06-21T20:21:00Z"), night.sunset());
        assertClose(Instant.parse("2024-06-22T03:43:00Z"), night.sunrise());
        assertTrue(night.sunset().isBefore(night.sunrise()));
    }

    @Test
    public void newYorkWinterSunset() throws SunTimeException {
        GeoCoordinates newYork = new GeoCoordinates(40.7128, -74.0060);
        assertClose(Instant.parse("2024-12-21T21:32:00Z"), calculator.sunset(LocalDate.of(2024, 12, 21), newYork));
    }

    @Test
    public void winterNightsAreLongerThanSummerNights() throws SunTimeException {
        Duration summer = calculator.nightOf(LocalDate.of(2024, 6, 21), LONDON).length();
        Duration winter = calculator.nightOf(LocalDate.of(2024, 12, 21), LONDON).length();
        assertTrue(winter.compareTo(summer) > 0);
    }

    @Test
    public void polarNight() {
        try {
            calculator.nightOf(LocalDate.of(2024, 12, 21), new GeoCoordinates(80, 15));
            fail("Expected polar night");
        } catch (SunTimeException e) {
            assertEquals(SunTimeException.Kind.NEVER_RISES, e.getKind());
        }
    }

    @Test
    public void midnightSun() {
        try {
            calculator.nightOf(LocalDate.of(2024, 6, 21), new GeoCoordinates(80, 15));
            fail("Expected midnight sun");
        } catch (SunTimeException e) {
            assertEquals(SunTimeException.Kind.NEVER_SETS, e.getKind());
        }
    }

    private static void assertClose(Instant expected, Instant actual) {
        long difference = Math.abs(Duration.between(expected, actual).getSeconds());
        assertTrue("expected " + expected + " but was " + actual, difference <= TOLERANCE_SECONDS);
    }

}
