package visibility.tools.horizon;

import visibility.tools.math.CircularDegrees;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * An observer's terrain obstruction as a closed piecewise-linear curve over azimuth. Points are normalized into
 * [0, 360) and sorted ascending; the segment from the last point back to the first is implicit.
 **/
public final class HorizonProfile {

    /* Brackets closer than this return an endpoint altitude instead of interpolating */
    static final double COINCIDENT_AZIMUTH_TOLERANCE = 0.01;

    private static final HorizonProfile EMPTY = new HorizonProfile(null, Collections.emptyList());

    private final String name;
    private final List<HorizonPoint> points;

    private HorizonProfile(String name, List<HorizonPoint> points) {
        this.name = name;
        this.points = points;
    }

    public static HorizonProfile empty() {
        return EMPTY;
    }

    public static HorizonProfile of(List<HorizonPoint> points) {
        return of(null, points);
    }

    public static HorizonProfile of(String name, List<HorizonPoint> points) {
        List<HorizonPoint> normalized = new ArrayList<>(points.size());
        points.forEach(point -> normalized.add(
                new HorizonPoint(CircularDegrees.normalize(point.azimuth()), point.altitude())));
        normalized.sort(Comparator.comparingDouble(HorizonPoint::azimuth));
        return new HorizonProfile(name, Collections.unmodifiableList(normalized));
    }

    /**
     * Interpolates the obstruction altitude at an azimuth. An empty profile means a flat horizon (0), a single
     * point means a constant altitude everywhere.
     *
     * @param azimuth the query azimuth in degrees, any sign or magnitude
     * @return the horizon altitude in degrees
     **/
    public double altitudeAt(double azimuth) {

        if (points.isEmpty()) {
            return 0;
        }
        if (points.size() == 1) {
            return points.get(0).altitude();
        }

        double az = CircularDegrees.normalize(azimuth);

        HorizonPoint lowPoint = null;
        HorizonPoint highPoint = null;
        for (HorizonPoint point : points) {
            if (point.azimuth() <= az) {
                lowPoint = point;
            }
            if (point.azimuth() >= az && highPoint == null) {
                highPoint = point;
            }
        }

        // Query falls across the seam, bracket with the wrapped neighbours
        if (lowPoint == null) {
            lowPoint = points.get(points.size() - 1);
        }
        if (highPoint == null) {
            highPoint = points.get(0);
        }

        if (lowPoint == highPoint || Math.abs(lowPoint.azimuth() - highPoint.azimuth()) < COINCIDENT_AZIMUTH_TOLERANCE) {
            return lowPoint.altitude();
        }

        // forwardSpan covers both the plain and the seam-crossing case
        double azRange = CircularDegrees.forwardSpan(lowPoint.azimuth(), highPoint.azimuth());
        double azOffset = CircularDegrees.forwardSpan(lowPoint.azimuth(), az);
        double t = azOffset / azRange;

        return lowPoint.altitude() + t * (highPoint.altitude() - lowPoint.altitude());
    }

    /**
     * @return whether an object at the given position clears the local horizon. Without points the horizon is the
     * mathematical one at 0°.
     **/
    public boolean isAboveLocalHorizon(double altitude, double azimuth) {
        if (points.isEmpty()) {
            return altitude > 0;
        }
        return altitude > altitudeAt(azimuth);
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public int size() {
        return points.size();
    }

    public List<HorizonPoint> getPoints() {
        return points;
    }

    public String getName() {
        return name;
    }

}
