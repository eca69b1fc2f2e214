package visibility.tools.coordinates;

import visibility.tools.math.CircularDegrees;

/**
 * 16-point compass rose
 **/
public enum CompassDirection {

    N, NNE, NE, ENE, E, ESE, SE, SSE, S, SSW, SW, WSW, W, WNW, NW, NNW;

    private static final double SECTOR_WIDTH = 22.5;

    public static CompassDirection of(double azimuth) {
        int index = (int) Math.round(CircularDegrees.normalize(azimuth) / SECTOR_WIDTH) % 16;
        return values()[index];
    }

}
