package visibility.tools.coordinates;

/**
 * An observer's position on Earth
 *
 * @param latitude  degrees in [-90, 90], north positive
 * @param longitude degrees in [-180, 180], east positive
 **/
public record GeoCoordinates(double latitude, double longitude) {

    @Override
    public String toString() {
        return latitude + "," + longitude;
    }
}
