package visibility.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visibility.tools.coordinates.CompassDirection;
import visibility.tools.coordinates.EquatorialPosition;
import visibility.tools.coordinates.GeoCoordinates;
import visibility.tools.coordinates.SexagesimalParser;
import visibility.tools.geometry.FootprintAggregator;
import visibility.tools.geometry.FootprintCorners;
import visibility.tools.geometry.FootprintGeometry;
import visibility.tools.geometry.ImageFootprint;
import visibility.tools.geometry.ViewBounds;
import visibility.tools.horizon.HorizonFileReader;
import visibility.tools.horizon.HorizonProfile;
import visibility.tools.night.AltitudeSample;
import visibility.tools.night.NightInterval;
import visibility.tools.night.NightSummary;
import visibility.tools.night.SunTimeException;
import visibility.tools.night.SunTimeProvider;
import visibility.tools.night.VisibilityWindowGenerator;
import visibility.tools.output.ReportGenerator;
import visibility.tools.utilities.AppConfig;
import visibility.tools.utilities.FileUtils;
import visibility.tools.utilities.TimeUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Plans one night for one target: night series and summary against the observer's horizon, plus the sky map view
 * and corners of the observer's plate-solved images.
 **/
public class VisibilityPlanner {

    private static final Logger log = LoggerFactory.getLogger(VisibilityPlanner.class);

    private final AppConfig appConfig;
    private final SunTimeProvider sunTimeProvider;
    private final VisibilityWindowGenerator generator;

    public VisibilityPlanner(AppConfig appConfig, SunTimeProvider sunTimeProvider) {
        this.appConfig = appConfig;
        this.sunTimeProvider = sunTimeProvider;
        this.generator = new VisibilityWindowGenerator(appConfig.visibilitySettings());
    }

    /**
     * Runs the plan and writes the reports to the configured output directory
     *
     * @return the files written
     * @throws IOException if an input file cannot be read or a report cannot be written
     **/
    public List<Path> run() throws IOException {

        ReportGenerator reportGenerator = new ReportGenerator(FileUtils.ensureDirectory(appConfig.outputPath()));
        List<Path> written = new ArrayList<>();

        NightReport nightReport = planNight();
        written.add(reportGenerator.saveAsJSON(nightReport, "night_" + appConfig.observationDate()));
        written.add(reportGenerator.saveAsCSV(seriesAsCsv(nightReport), "series_" + appConfig.observationDate()));

        if (appConfig.useFootprintsFile()) {
            List<ImageFootprint> footprints = FileUtils.footprintsFromFile(Path.of(appConfig.footprintsPath()));
            written.add(reportGenerator.saveAsJSON(mapFootprints(footprints), "footprints"));
        }

        written.forEach(path -> log.info("Wrote {}", path));
        return written;
    }

    public NightReport planNight() throws IOException {

        GeoCoordinates observer = new GeoCoordinates(appConfig.observerLatitude(), appConfig.observerLongitude());
        EquatorialPosition target = SexagesimalParser.parse(appConfig.targetRa(), appConfig.targetDec())
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unreadable target coordinates: " + appConfig.targetRa() + " " + appConfig.targetDec()));

        HorizonProfile horizon = appConfig.useHorizonFile()
                ? HorizonFileReader.read(Path.of(appConfig.horizonPath()))
                : HorizonProfile.empty();

        NightInterval night = null;
        List<AltitudeSample> series = List.of();
        try {
            night = sunTimeProvider.nightOf(appConfig.observationDate(), observer);
            series = generator.nightSeries(target, observer, night);
        } catch (SunTimeException e) {
            log.warn("No night on {}: {}", appConfig.observationDate(), e.getMessage());
        }

        NightSummary summary = generator.summarize(series, horizon);

        if (summary.hasBestObservation()) {
            AltitudeSample best = summary.bestObservation();
            log.info("{}: ideal {} - {}, best at {} (alt {} toward {})", appConfig.targetName(),
                    TimeUtils.hourMinute(summary.idealWindow().start()), TimeUtils.hourMinute(summary.idealWindow().end()),
                    TimeUtils.hourMinute(best.time()), String.format(Locale.ROOT, "%.1f", best.altitude()), CompassDirection.of(best.azimuth()));
        } else {
            log.info("{}: not observable on {}", appConfig.targetName(), appConfig.observationDate());
        }

        List<Double> horizonAltitudes = series.stream().map(sample -> horizon.altitudeAt(sample.azimuth())).toList();

        return new NightReport(appConfig.targetName(), target, observer, night,
                appConfig.idealAltitudeFloor(), series, horizonAltitudes, summary);
    }

    /**
     * Corners for each footprint, keyed by id, and the view that contains them
     **/
    public FootprintReport mapFootprints(List<ImageFootprint> footprints) {

        Map<String, FootprintCorners> cornersById = new LinkedHashMap<>();
        footprints.forEach(footprint -> cornersById.put(footprint.getId(), FootprintGeometry.corners(footprint)));

        ViewBounds view = FootprintAggregator.boundingView(footprints);
        log.info("{} footprints, view centered at {},{} with fov {}", footprints.size(),
                view.centerRa(), view.centerDec(), view.fieldOfViewDeg());

        return new FootprintReport(view, cornersById);
    }

    private List<String> seriesAsCsv(NightReport report) {
        List<String> lines = new ArrayList<>();
        lines.add("time,altitude,azimuth,horizon,ideal");
        for (int i = 0; i < report.series().size(); i++) {
            AltitudeSample sample = report.series().get(i);
            double horizonAltitude = report.horizonAltitudes().get(i);
            boolean ideal = sample.altitude() >= Math.max(report.idealAltitudeFloor(), horizonAltitude);
            lines.add(sample.time() + "," + sample.altitude() + "," + sample.azimuth() + "," + horizonAltitude + "," + ideal);
        }
        return lines;
    }

    public record NightReport(String targetName,
                              EquatorialPosition target,
                              GeoCoordinates observer,
                              NightInterval night,
                              double idealAltitudeFloor,
                              List<AltitudeSample> series,
                              List<Double> horizonAltitudes,
                              NightSummary summary) {

    }

    public record FootprintReport(ViewBounds view, Map<String, FootprintCorners> corners) {

    }

}
