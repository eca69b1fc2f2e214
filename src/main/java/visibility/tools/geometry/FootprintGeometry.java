package visibility.tools.geometry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Footprint polygons on the sky, using a flat tangent-plane approximation that holds for fields of a few degrees.
 **/
public class FootprintGeometry {

    /* Corner offsets in half-extent units, before rotation */
    private static final double[][] UNIT_CORNERS = {
            {-1, 1},   // top-left
            {1, 1},    // top-right
            {1, -1},   // bottom-right
            {-1, -1}   // bottom-left
    };

    private FootprintGeometry() {

    }

    public static FootprintCorners corners(ImageFootprint footprint) {
        return corners(footprint.getCenterRa(), footprint.getCenterDec(), footprint.getWidthDeg(),
                footprint.getHeightDeg(), footprint.getRotationDeg());
    }

    /**
     * Computes the four corners of a rotated rectangle centered on a target.
     * <p>
     * The rectangle is laid out in a local (east, north) plane and rotated with the standard counter-clockwise
     * matrix [cos -sin; sin cos]. Rotations given clockwise from north must be negated by the caller. The east
     * offset is then stretched by 1 / cos(centerDec) to account for meridian convergence.
     * <p>
     * Near the celestial poles cos(centerDec) tends to 0 and the right ascension offsets grow without bound. This
     * is a limitation of the approximation and is not clamped; at ±90° the offsets are meaningless (of order 1e16).
     *
     * @param centerRa    right ascension of the center, degrees
     * @param centerDec   declination of the center, degrees
     * @param widthDeg    field width, degrees
     * @param heightDeg   field height, degrees
     * @param rotationDeg counter-clockwise rotation, degrees
     * @return the corners as {ra, dec} pairs; right ascensions are not wrapped into [0, 360)
     **/
    public static FootprintCorners corners(double centerRa, double centerDec, double widthDeg, double heightDeg,
                                           double rotationDeg) {

        double rotRad = Math.toRadians(rotationDeg);
        double cosRot = Math.cos(rotRad);
        double sinRot = Math.sin(rotRad);
        double cosDec = Math.cos(Math.toRadians(centerDec));

        double hw = widthDeg / 2;
        double hh = heightDeg / 2;

        List<double[]> polygon = new ArrayList<>(UNIT_CORNERS.length);

        for (double[] unit : UNIT_CORNERS) {
            double dx = unit[0] * hw;
            double dy = unit[1] * hh;

            double rotX = dx * cosRot - dy * sinRot;
            double rotY = dx * sinRot + dy * cosRot;

            polygon.add(new double[]{centerRa + rotX / cosDec, centerDec + rotY});
        }

        return new FootprintCorners(polygon);
    }

    public static boolean pointInPolygon(double ra, double dec, FootprintCorners corners) {
        return corners.contains(ra, dec);
    }

    /**
     * Even-odd ray casting. Right ascension is treated as an open axis, so polygons must not straddle the 0°/360°
     * seam. Points on an edge follow the half-open rule of the crossing test; zero-area polygons contain nothing.
     *
     * @param ra             right ascension of the point
     * @param dec            declination of the point
     * @param coordinateList the polygon's {ra, dec} vertices
     * @return whether the point lies inside
     **/
    public static boolean pointInPolygon(double ra, double dec, List<double[]> coordinateList) {
        boolean odd = false;

        int n = coordinateList.size();
        for (int i = 0, j = n - 1; i < n; j = i++) {
            double[] pi = coordinateList.get(i);
            double[] pj = coordinateList.get(j);
            // The edge must straddle the point's declination, and cross it east of the point
            if (((pi[1] > dec) != (pj[1] > dec))
                    && (ra < (pj[0] - pi[0]) * (dec - pi[1]) / (pj[1] - pi[1]) + pi[0])) {
                odd = !odd;
            }
        }

        return odd;
    }

    /**
     * Finds the footprints under a clicked sky position
     *
     * @param ra            right ascension of the click
     * @param dec           declination of the click
     * @param cornersById   caller-owned corners, keyed by footprint id
     * @return ids whose polygon contains the point, in the map's iteration order
     **/
    public static List<String> hitTest(double ra, double dec, Map<String, FootprintCorners> cornersById) {
        List<String> hits = new ArrayList<>();
        cornersById.forEach((id, corners) -> {
            if (corners.contains(ra, dec)) {
                hits.add(id);
            }
        });
        return hits;
    }

}
