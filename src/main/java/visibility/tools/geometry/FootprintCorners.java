package visibility.tools.geometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The ordered vertices of a footprint polygon, each as {ra, dec} in degrees. Before rotation the order is top-left,
 * top-right, bottom-right, bottom-left.
 **/
public final class FootprintCorners {

    private final List<double[]> polygonCoordinates;

    public FootprintCorners(List<double[]> polygonCoordinates) {
        List<double[]> copy = new ArrayList<>(polygonCoordinates.size());
        polygonCoordinates.forEach(pair -> copy.add(pair.clone()));
        this.polygonCoordinates = Collections.unmodifiableList(copy);
    }

    /**
     * @return the vertices; the arrays are copies and may be modified freely
     **/
    public List<double[]> getPolygonCoordinates() {
        List<double[]> copy = new ArrayList<>(polygonCoordinates.size());
        polygonCoordinates.forEach(pair -> copy.add(pair.clone()));
        return copy;
    }

    public double[] get(int index) {
        return polygonCoordinates.get(index).clone();
    }

    public int size() {
        return polygonCoordinates.size();
    }

    public boolean contains(double ra, double dec) {
        return FootprintGeometry.pointInPolygon(ra, dec, polygonCoordinates);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (double[] pair : polygonCoordinates) {
            if (sb.length() > 0) {
                sb.append(";");
            }
            sb.append(pair[0]).append(",").append(pair[1]);
        }
        return sb.toString();
    }

}
