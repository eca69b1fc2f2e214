package visibility.tools.night;

import java.util.List;

/**
 * Reduced view of a night series against a horizon-aware threshold
 *
 * @param idealWindow      first and last sample at or above the effective threshold
 * @param bestObservation  sample with the greatest clearance over the effective threshold, null for an empty series
 * @param bestClearance    clearance of the best sample in degrees, NaN for an empty series
 * @param highestSample    sample with the greatest altitude, null for an empty series
 * @param idealRanges      contiguous runs of samples at or above the effective threshold
 **/
public record NightSummary(VisibilityWindow idealWindow,
                           AltitudeSample bestObservation,
                           double bestClearance,
                           AltitudeSample highestSample,
                           List<VisibilityWindow> idealRanges) {

    public static final NightSummary NO_VISIBILITY = new NightSummary(VisibilityWindow.NONE, null, Double.NaN, null, List.of());

    public boolean hasBestObservation() {
        return bestObservation != null;
    }

}
