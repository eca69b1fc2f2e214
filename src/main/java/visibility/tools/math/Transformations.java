package visibility.tools.math;

import java.time.Instant;

/**
 * This class holds time and sidereal frame transformations
 **/
public class Transformations {

    public static final double J2000_JD = 2451545.0;
    public static final double UNIX_EPOCH_JD = 2440587.5;
    public static final double MILLIS_PER_DAY = 86400000.0;
    public static final double DAYS_PER_JULIAN_CENTURY = 36525.0;

    private Transformations() {

    }

    public static double unix2julian(long unixMillis) {
        return (unixMillis / MILLIS_PER_DAY) + UNIX_EPOCH_JD;
    }

    public static double julianDate(Instant instant) {
        return unix2julian(instant.toEpochMilli());
    }

    public static Instant julian2instant(double julianDate) {
        return Instant.ofEpochMilli(Math.round((julianDate - UNIX_EPOCH_JD) * MILLIS_PER_DAY));
    }

    /**
     * Greenwich Mean Sidereal Time, using the IAU polynomial. The day count runs from J2000.0 at the instant itself,
     * while the century term is taken at the preceding 0h UT.
     *
     * @param instant the UTC instant
     * @return GMST in degrees, not normalized
     **/
    public static double greenwichMeanSiderealTime(Instant instant) {
        double jd = julianDate(instant);
        double jdMidnight = Math.floor(jd - 0.5) + 0.5;
        double t = (jdMidnight - J2000_JD) / DAYS_PER_JULIAN_CENTURY;
        return 280.46061837 + 360.98564736629 * (jd - J2000_JD) + 0.000387933 * t * t - t * t * t / 38710000.0;
    }

    /**
     * @param instant   the UTC instant
     * @param longitude the observer's longitude in degrees, east positive
     * @return LST in degrees, in [0, 360)
     **/
    public static double localSiderealTime(Instant instant, double longitude) {
        return CircularDegrees.normalize(greenwichMeanSiderealTime(instant) + longitude);
    }

}
