package visibility.tools.coordinates;

/**
 * Observer-relative coordinates at one instant
 *
 * @param altitude degrees above the mathematical horizon
 * @param azimuth  degrees from north, increasing eastward, in [0, 360)
 **/
public record HorizontalPosition(double altitude, double azimuth) {

}
