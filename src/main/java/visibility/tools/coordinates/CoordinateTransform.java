package visibility.tools.coordinates;

import visibility.tools.math.CircularDegrees;
import visibility.tools.math.Transformations;

import java.time.Instant;

/**
 * Converts equatorial coordinates into the observer's horizontal frame
 **/
public class CoordinateTransform {

    private CoordinateTransform() {

    }

    /**
     * Computes altitude and azimuth of a target for an observer at a given instant. The instant is always explicit,
     * so identical inputs yield identical outputs.
     * <p>
     * Polar observers are valid: the azimuth goes through {@code atan2} and never divides by {@code cos(lat)}.
     *
     * @param target   the target's equatorial position
     * @param observer the observer's geographic coordinates
     * @param instant  the UTC instant
     * @return altitude in degrees and azimuth in [0, 360), measured from north through east
     **/
    public static HorizontalPosition horizontalPosition(EquatorialPosition target, GeoCoordinates observer, Instant instant) {

        double lst = Transformations.localSiderealTime(instant, observer.longitude());
        double hourAngle = Math.toRadians(lst - target.ra());
        double dec = Math.toRadians(target.dec());
        double lat = Math.toRadians(observer.latitude());

        double sinAlt = Math.sin(dec) * Math.sin(lat) + Math.cos(dec) * Math.cos(lat) * Math.cos(hourAngle);
        // Rounding can push sinAlt one ulp past 1 at the zenith
        double altitude = Math.toDegrees(Math.asin(Math.max(-1, Math.min(1, sinAlt))));

        // atan2 yields the azimuth from south, shift it to north-based
        double azimuth = Math.atan2(Math.sin(hourAngle),
                Math.cos(hourAngle) * Math.sin(lat) - Math.tan(dec) * Math.cos(lat));
        azimuth = (Math.toDegrees(azimuth) + 180) % CircularDegrees.FULL_CIRCLE;

        return new HorizontalPosition(altitude, azimuth);
    }

    public static double altitude(EquatorialPosition target, GeoCoordinates observer, Instant instant) {
        return horizontalPosition(target, observer, instant).altitude();
    }

    public static double azimuth(EquatorialPosition target, GeoCoordinates observer, Instant instant) {
        return horizontalPosition(target, observer, instant).azimuth();
    }

}
