package visibility.tools.night;

import java.time.Instant;

/**
 * One instant of a night series. The ideal flag is computed against the fixed altitude floor only; summaries
 * recompute ideality against the horizon-aware threshold.
 **/
public record AltitudeSample(Instant time, double altitude, double azimuth, boolean ideal) {

}
