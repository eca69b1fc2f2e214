package visibility.tools.night;

/**
 * Sampling and threshold parameters for night series
 *
 * @param idealAltitudeFloor comfortable observing altitude in degrees, applied even where the horizon is clear
 * @param minSampleMinutes   lower bound for the sampling interval
 * @param targetSampleCount  number of samples a night is split into before the lower bound applies
 **/
public record VisibilitySettings(double idealAltitudeFloor, int minSampleMinutes, int targetSampleCount) {

    public static final double DEFAULT_IDEAL_ALTITUDE_FLOOR = 20.0;
    public static final int DEFAULT_MIN_SAMPLE_MINUTES = 10;
    public static final int DEFAULT_TARGET_SAMPLE_COUNT = 60;

    public static VisibilitySettings defaults() {
        return new VisibilitySettings(DEFAULT_IDEAL_ALTITUDE_FLOOR, DEFAULT_MIN_SAMPLE_MINUTES, DEFAULT_TARGET_SAMPLE_COUNT);
    }

    public VisibilitySettings {
        if (minSampleMinutes < 1) {
            throw new IllegalArgumentException("minSampleMinutes must be positive: " + minSampleMinutes);
        }
        if (targetSampleCount < 1) {
            throw new IllegalArgumentException("targetSampleCount must be positive: " + targetSampleCount);
        }
    }

}
