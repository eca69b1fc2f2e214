package visibility.tools;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import visibility.tools.geometry.FootprintCorners;
import visibility.tools.geometry.ImageFootprint;
import visibility.tools.night.NightInterval;
import visibility.tools.night.NightSummary;
import visibility.tools.night.SunTimeException;
import visibility.tools.night.SunTimeProvider;
import visibility.tools.utilities.AppConfig;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class VisibilityPlannerTest {

    private static final LocalDate DATE = LocalDate.of(2025, 1, 15);
    private static final Instant SUNSET = Instant.parse("2025-01-15T16:20:00Z");
    private static final Instant SUNRISE = Instant.parse("2025-01-16T07:50:00Z");

    private static final SunTimeProvider FIXED_NIGHT = (date, location) -> new NightInterval(SUNSET, SUNRISE);

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void plansOrionNebulaFromGreenwich() throws IOException {
        VisibilityPlanner planner = new VisibilityPlanner(config("05h 35m 17.3s", "-05d 23m 28s", null, null), FIXED_NIGHT);

        VisibilityPlanner.NightReport report = planner.planNight();

        // 930 minutes split in 60 gives 15 minute steps
        assertEquals(63, report.series().size());
        assertEquals(report.series().size(), report.horizonAltitudes().size());
        assertTrue(report.summary().hasBestObservation());
        assertTrue(report.summary().bestObservation().altitude() > 30);
        assertTrue(report.summary().idealWindow().start().isAfter(SUNSET));
        assertTrue(report.summary().idealWindow().end().isBefore(SUNRISE));
    }

    @Test
    public void horizonFileRaisesTheThreshold() throws IOException, URISyntaxException {
        String horizon = Path.of(Objects.requireNonNull(getClass().getResource("/horizon.test.txt")).toURI()).toString();
        VisibilityPlanner planner = new VisibilityPlanner(config("83.82", "-5.39", horizon, null), FIXED_NIGHT);

        VisibilityPlanner.NightReport report = planner.planNight();

        for (int i = 0; i < report.series().size(); i++) {
            assertTrue(report.horizonAltitudes().get(i) >= 5);
        }
        assertTrue(report.summary().bestClearance() < report.summary().highestSample().altitude() - 20 + 1e-9);
    }

    @Test
    public void noNightMeansNoVisibility() throws IOException {
        SunTimeProvider midnightSun = (date, location) -> {
            throw new SunTimeException(SunTimeException.Kind.NEVER_SETS, "The sun never sets");
        };
        VisibilityPlanner planner = new VisibilityPlanner(config("83.82", "-5.39", null, null), midnightSun);

        VisibilityPlanner.NightReport report = planner.planNight();

        assertNull(report.night());
        assertTrue(report.series().isEmpty());
        assertSame(NightSummary.NO_VISIBILITY, report.summary());
    }

    @Test(expected = IllegalArgumentException.class)
    public void unreadableTargetIsRejected() throws IOException {
        new VisibilityPlanner(config("somewhere", "-5.39", null, null), FIXED_NIGHT).planNight();
    }

    @Test
    public void malformedSexagesimalTargetIsRejected() throws IOException {
        try {
            new VisibilityPlanner(config("05h 35m 1.2.3s", "-05d 23m 28s", null, null), FIXED_NIGHT).planNight();
            fail("Expected an unreadable target");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().startsWith("Unreadable target coordinates"));
        }
    }

    @Test
    public void writesReports() throws IOException, URISyntaxException {
        String footprints = Path.of(Objects.requireNonNull(getClass().getResource("/footprints.test.json")).toURI()).toString();
        VisibilityPlanner planner = new VisibilityPlanner(config("83.82", "-5.39", null, footprints), FIXED_NIGHT);

        List<Path> written = planner.run();

        assertEquals(3, written.size());
        Path output = folder.getRoot().toPath().resolve("out");
        assertTrue(Files.exists(output.resolve("night_2025-01-15.json")));
        assertTrue(Files.exists(output.resolve("footprints.json")));

        List<String> csv = Files.readAllLines(output.resolve("series_2025-01-15.csv"), StandardCharsets.UTF_8);
        assertEquals("time,altitude,azimuth,horizon,ideal", csv.get(0));
        assertEquals(64, csv.size());
        assertTrue(csv.get(1).startsWith("2025-01-15T16:20:00Z,"));
    }

    @Test
    public void mapsFootprintsById() throws IOException {
        VisibilityPlanner planner = new VisibilityPlanner(config("83.82", "-5.39", null, null), FIXED_NIGHT);

        VisibilityPlanner.FootprintReport report = planner.mapFootprints(Arrays.asList(
                new ImageFootprint("b", 83.8, -5.4, 1, 1, 0),
                new ImageFootprint("a", 84.2, -5.0, 1, 1, 0)));

        Map<String, FootprintCorners> corners = report.corners();
        assertEquals(List.of("b", "a"), List.copyOf(corners.keySet()));
        assertTrue(corners.get("a").contains(84.2, -5.0));
        assertEquals(84.0, report.view().centerRa(), 1e-9);
    }

    private AppConfig config(String ra, String dec, String horizonPath, String footprintsPath) {
        String output = folder.getRoot().toPath().resolve("out").toString();
        return new AppConfig(51.4779, -0.0015, "M42", ra, dec, DATE, horizonPath, footprintsPath, output, 20, 10, 60);
    }

}
