package visibility.tools.night;

/**
 * Observability of a target at one moment, from best to worst
 **/
public enum AltitudeStatus {

    IDEAL("Ideal for observation"),
    VISIBLE_BELOW_IDEAL("Visible but below ideal threshold"),
    BELOW_LOCAL_HORIZON("Below local horizon"),
    BELOW_HORIZON("Below horizon - not visible");

    private final String description;

    AltitudeStatus(String description) {
        this.description = description;
    }

    /**
     * @param altitude        the target's altitude in degrees
     * @param horizonAltitude the local horizon altitude at the target's azimuth
     * @param idealFloor      the comfortable observing altitude
     **/
    public static AltitudeStatus classify(double altitude, double horizonAltitude, double idealFloor) {
        double effectiveThreshold = Math.max(idealFloor, horizonAltitude);
        if (altitude > effectiveThreshold) {
            return IDEAL;
        }
        if (altitude > horizonAltitude) {
            return VISIBLE_BELOW_IDEAL;
        }
        if (altitude > 0) {
            return BELOW_LOCAL_HORIZON;
        }
        return BELOW_HORIZON;
    }

    public String getDescription() {
        return description;
    }

}
