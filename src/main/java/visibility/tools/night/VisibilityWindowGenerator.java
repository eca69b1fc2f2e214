package visibility.tools.night;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visibility.tools.coordinates.CoordinateTransform;
import visibility.tools.coordinates.EquatorialPosition;
import visibility.tools.coordinates.GeoCoordinates;
import visibility.tools.coordinates.HorizontalPosition;
import visibility.tools.horizon.HorizonProfile;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Samples a target's altitude across a night and derives its ideal window and best observation time.
 * Instances hold only immutable settings and can be shared between threads.
 **/
public class VisibilityWindowGenerator {

    private static final Logger log = LoggerFactory.getLogger(VisibilityWindowGenerator.class);

    private final VisibilitySettings settings;

    public VisibilityWindowGenerator() {
        this(VisibilitySettings.defaults());
    }

    public VisibilityWindowGenerator(VisibilitySettings settings) {
        this.settings = settings;
    }

    public List<AltitudeSample> nightSeries(EquatorialPosition target, GeoCoordinates observer, NightInterval night) {
        return nightSeries(target, observer, night.sunset(), night.sunrise());
    }

    /**
     * Generates altitude/azimuth samples from sunset to sunrise, both inclusive. The interval is
     * max(minSampleMinutes, floor(totalMinutes / targetSampleCount)).
     *
     * @param target   the target's equatorial position
     * @param observer the observer's location
     * @param sunset   start of the night
     * @param sunrise  end of the night
     * @return the chronological series, empty when sunset is not before sunrise
     **/
    public List<AltitudeSample> nightSeries(EquatorialPosition target, GeoCoordinates observer, Instant sunset, Instant sunrise) {

        if (sunset == null || sunrise == null || !sunset.isBefore(sunrise)) {
            log.warn("Night interval {} -> {} is empty or inverted, no samples generated", sunset, sunrise);
            return Collections.emptyList();
        }

        Duration step = samplingInterval(sunset, sunrise);
        List<AltitudeSample> series = new ArrayList<>();

        for (Instant current = sunset; !current.isAfter(sunrise); current = current.plus(step)) {
            HorizontalPosition position = CoordinateTransform.horizontalPosition(target, observer, current);
            series.add(new AltitudeSample(current, position.altitude(), position.azimuth(),
                    position.altitude() > settings.idealAltitudeFloor()));
        }

        log.debug("Generated {} samples every {} min for {}", series.size(), step.toMinutes(), target);
        return series;
    }

    /**
     * @return the sampling step for a night
     **/
    public Duration samplingInterval(Instant sunset, Instant sunrise) {
        long totalMinutes = Duration.between(sunset, sunrise).toMinutes();
        long interval = Math.max(settings.minSampleMinutes(), totalMinutes / settings.targetSampleCount());
        return Duration.ofMinutes(interval);
    }

    /**
     * The altitude a target must reach to be ideal at an azimuth: the altitude floor, or the local horizon where it
     * is higher.
     *
     * @param azimuth the target's azimuth
     * @param horizon the observer's horizon, null for a clear horizon
     **/
    public double effectiveThreshold(double azimuth, HorizonProfile horizon) {
        double horizonAltitude = horizon == null ? 0 : horizon.altitudeAt(azimuth);
        return Math.max(settings.idealAltitudeFloor(), horizonAltitude);
    }

    public double clearance(AltitudeSample sample, HorizonProfile horizon) {
        return sample.altitude() - effectiveThreshold(sample.azimuth(), horizon);
    }

    public boolean isIdeal(AltitudeSample sample, HorizonProfile horizon) {
        return sample.altitude() >= effectiveThreshold(sample.azimuth(), horizon);
    }

    /**
     * First and last sample at or above the effective threshold
     **/
    public VisibilityWindow idealWindow(List<AltitudeSample> series, HorizonProfile horizon) {

        Instant start = null;
        Instant end = null;

        for (AltitudeSample sample : series) {
            if (isIdeal(sample, horizon)) {
                if (start == null) {
                    start = sample.time();
                }
                end = sample.time();
            }
        }

        return start == null ? VisibilityWindow.NONE : new VisibilityWindow(start, end);
    }

    /**
     * The sample with the greatest margin over whatever is binding at its azimuth (the floor or the horizon). This
     * is not necessarily the highest sample. Ties keep the earliest sample.
     *
     * @return the best sample, or null for an empty series
     **/
    public AltitudeSample bestObservation(List<AltitudeSample> series, HorizonProfile horizon) {

        AltitudeSample best = null;
        double bestClearance = Double.NEGATIVE_INFINITY;

        for (AltitudeSample sample : series) {
            double clearance = clearance(sample, horizon);
            if (best == null || clearance > bestClearance) {
                best = sample;
                bestClearance = clearance;
            }
        }

        return best;
    }

    public AltitudeSample highestSample(List<AltitudeSample> series) {

        AltitudeSample highest = null;
        for (AltitudeSample sample : series) {
            if (highest == null || sample.altitude() > highest.altitude()) {
                highest = sample;
            }
        }
        return highest;
    }

    /**
     * Splits the series into contiguous runs of ideal samples
     **/
    public List<VisibilityWindow> idealRanges(List<AltitudeSample> series, HorizonProfile horizon) {

        List<VisibilityWindow> ranges = new ArrayList<>();
        Instant rangeStart = null;
        Instant previous = null;

        for (AltitudeSample sample : series) {
            boolean ideal = isIdeal(sample, horizon);
            if (ideal && rangeStart == null) {
                rangeStart = sample.time();
            } else if (!ideal && rangeStart != null) {
                ranges.add(new VisibilityWindow(rangeStart, previous));
                rangeStart = null;
            }
            previous = sample.time();
        }
        if (rangeStart != null) {
            ranges.add(new VisibilityWindow(rangeStart, previous));
        }

        return ranges;
    }

    /**
     * Recomputes every summary value from the raw series
     *
     * @param series  a chronological night series
     * @param horizon the observer's horizon, null for a clear horizon
     **/
    public NightSummary summarize(List<AltitudeSample> series, HorizonProfile horizon) {

        if (series.isEmpty()) {
            return NightSummary.NO_VISIBILITY;
        }

        AltitudeSample best = bestObservation(series, horizon);
        return new NightSummary(
                idealWindow(series, horizon),
                best,
                clearance(best, horizon),
                highestSample(series),
                idealRanges(series, horizon));
    }

    public VisibilitySettings getSettings() {
        return settings;
    }

}
