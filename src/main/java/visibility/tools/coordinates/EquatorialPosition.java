package visibility.tools.coordinates;

/**
 * Invariant celestial coordinates of a target
 *
 * @param ra  right ascension in degrees, [0, 360)
 * @param dec declination in degrees, [-90, 90]
 **/
public record EquatorialPosition(double ra, double dec) {

    @Override
    public String toString() {
        return ra + "," + dec;
    }
}
