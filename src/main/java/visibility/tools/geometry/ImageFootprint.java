package visibility.tools.geometry;

/**
 * A camera sensor's rectangle projected on the sky, from a plate solve. Geometry only reads the center, the size and
 * the rotation; the remaining fields identify the image for display.
 **/
public final class ImageFootprint {

    private final String id;
    private final String filename;
    private final double centerRa;
    private final double centerDec;
    private final double widthDeg;
    private final double heightDeg;
    private final double rotationDeg;
    private final String collectionId;
    private final String collectionName;
    private final double exposureSeconds;

    public ImageFootprint(String id, double centerRa, double centerDec, double widthDeg, double heightDeg, double rotationDeg) {
        this(id, null, centerRa, centerDec, widthDeg, heightDeg, rotationDeg, null, null, 0);
    }

    public ImageFootprint(String id, String filename, double centerRa, double centerDec, double widthDeg,
                          double heightDeg, double rotationDeg, String collectionId, String collectionName,
                          double exposureSeconds) {
        this.id = id;
        this.filename = filename;
        this.centerRa = centerRa;
        this.centerDec = centerDec;
        this.widthDeg = widthDeg;
        this.heightDeg = heightDeg;
        this.rotationDeg = rotationDeg;
        this.collectionId = collectionId;
        this.collectionName = collectionName;
        this.exposureSeconds = exposureSeconds;
    }

    /**
     * Half of the rectangle's diagonal, a rotation-independent radius around the center
     **/
    public double getHalfDiagonal() {
        return Math.sqrt(widthDeg * widthDeg + heightDeg * heightDeg) / 2;
    }

    public String getId() {
        return id;
    }

    public String getFilename() {
        return filename;
    }

    public double getCenterRa() {
        return centerRa;
    }

    public double getCenterDec() {
        return centerDec;
    }

    public double getWidthDeg() {
        return widthDeg;
    }

    public double getHeightDeg() {
        return heightDeg;
    }

    public double getRotationDeg() {
        return rotationDeg;
    }

    public String getCollectionId() {
        return collectionId;
    }

    public String getCollectionName() {
        return collectionName;
    }

    public double getExposureSeconds() {
        return exposureSeconds;
    }

    @Override
    public String toString() {
        return id + " (" + centerRa + "," + centerDec + " " + widthDeg + "x" + heightDeg + " rot " + rotationDeg + ")";
    }

}
