package visibility.tools.geometry;

/**
 * A sky map view
 *
 * @param centerRa       right ascension of the view center, degrees
 * @param centerDec      declination of the view center, degrees
 * @param fieldOfViewDeg width of the view, degrees
 **/
public record ViewBounds(double centerRa, double centerDec, double fieldOfViewDeg) {

    public static final ViewBounds WHOLE_SKY = new ViewBounds(180, 0, 180);

}
