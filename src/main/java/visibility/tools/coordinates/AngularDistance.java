package visibility.tools.coordinates;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * Great-circle separation between two directions on the sky
 **/
public class AngularDistance {

    private AngularDistance() {

    }

    /**
     * @return the separation in degrees between two horizontal positions
     **/
    public static double between(double altitude1, double azimuth1, double altitude2, double azimuth2) {
        Vector3D v1 = new Vector3D(Math.toRadians(azimuth1), Math.toRadians(altitude1));
        Vector3D v2 = new Vector3D(Math.toRadians(azimuth2), Math.toRadians(altitude2));
        return Math.toDegrees(Vector3D.angle(v1, v2));
    }

    public static double between(HorizontalPosition p1, HorizontalPosition p2) {
        return between(p1.altitude(), p1.azimuth(), p2.altitude(), p2.azimuth());
    }

    /**
     * @return the separation in degrees between two equatorial positions
     **/
    public static double between(EquatorialPosition p1, EquatorialPosition p2) {
        return between(p1.dec(), p1.ra(), p2.dec(), p2.ra());
    }

}
