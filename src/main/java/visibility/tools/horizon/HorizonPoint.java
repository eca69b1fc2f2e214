package visibility.tools.horizon;

/**
 * @param azimuth  degrees from north, in [0, 360) once stored in a profile
 * @param altitude minimum unobstructed elevation at that azimuth, in degrees
 **/
public record HorizonPoint(double azimuth, double altitude) {

}
