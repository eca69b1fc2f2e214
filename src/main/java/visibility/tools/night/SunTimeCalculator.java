package visibility.tools.night;

import visibility.tools.coordinates.GeoCoordinates;
import visibility.tools.math.CircularDegrees;
import visibility.tools.math.Transformations;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Approximate sunrise and sunset times from the sunrise equation, good to a few minutes at non-polar latitudes.
 * Times are for the geometric horizon corrected by -0.833° for refraction and the solar semi-diameter.
 **/
public class SunTimeCalculator implements SunTimeProvider {

    private static final double SUN_ALTITUDE_AT_RISE = -0.833;
    private static final double OBLIQUITY = 23.4397;
    private static final double PERIHELION_LONGITUDE = 102.9372;
    private static final double LEAP_SECONDS_CORRECTION = 0.0008;
    /* Julian day number of 1970-01-01T12:00Z */
    private static final double UNIX_EPOCH_NOON_JD = 2440588.0;

    @Override
    public NightInterval nightOf(LocalDate date, GeoCoordinates location) throws SunTimeException {
        Instant sunset = sunset(date, location);
        Instant sunrise = sunrise(date.plusDays(1), location);
        return new NightInterval(sunset, sunrise);
    }

    public Instant sunrise(LocalDate date, GeoCoordinates location) throws SunTimeException {
        double[] transitAndHalfArc = transitAndHalfArc(date, location);
        return Transformations.julian2instant(transitAndHalfArc[0] - transitAndHalfArc[1] / 360.0);
    }

    public Instant sunset(LocalDate date, GeoCoordinates location) throws SunTimeException {
        double[] transitAndHalfArc = transitAndHalfArc(date, location);
        return Transformations.julian2instant(transitAndHalfArc[0] + transitAndHalfArc[1] / 360.0);
    }

    /**
     * @return the Julian date of solar transit and the hour angle of sunrise/sunset in degrees
     **/
    private double[] transitAndHalfArc(LocalDate date, GeoCoordinates location) throws SunTimeException {

        // Days since J2000.0 at noon UTC of the given date
        double n = date.toEpochDay() + UNIX_EPOCH_NOON_JD - Transformations.J2000_JD + LEAP_SECONDS_CORRECTION;
        double meanSolarNoon = n - location.longitude() / 360.0;

        double m = CircularDegrees.normalize(357.5291 + 0.98560028 * meanSolarNoon);
        double mRad = Math.toRadians(m);
        double center = 1.9148 * Math.sin(mRad) + 0.0200 * Math.sin(2 * mRad) + 0.0003 * Math.sin(3 * mRad);
        double eclipticLongitude = Math.toRadians(CircularDegrees.normalize(m + center + 180 + PERIHELION_LONGITUDE));

        double transit = Transformations.J2000_JD + meanSolarNoon
                + 0.0053 * Math.sin(mRad) - 0.0069 * Math.sin(2 * eclipticLongitude);

        double sinDeclination = Math.sin(eclipticLongitude) * Math.sin(Math.toRadians(OBLIQUITY));
        double cosDeclination = Math.cos(Math.asin(sinDeclination));
        double lat = Math.toRadians(location.latitude());

        double cosHourAngle = (Math.sin(Math.toRadians(SUN_ALTITUDE_AT_RISE)) - Math.sin(lat) * sinDeclination)
                / (Math.cos(lat) * cosDeclination);

        if (cosHourAngle > 1) {
            throw new SunTimeException(SunTimeException.Kind.NEVER_RISES,
                    "The sun never rises on " + date + " at " + location);
        } else if (cosHourAngle < -1) {
            throw new SunTimeException(SunTimeException.Kind.NEVER_SETS,
                    "The sun never sets on " + date + " at " + location);
        }

        return new double[]{transit, Math.toDegrees(Math.acos(cosHourAngle))};
    }

}
