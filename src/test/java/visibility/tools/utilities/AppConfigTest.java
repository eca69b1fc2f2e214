package visibility.tools.utilities;

import org.apache.commons.configuration2.ex.ConfigurationException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import visibility.tools.night.VisibilitySettings;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Objects;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class AppConfigTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void loadsProperties() throws ConfigurationException, URISyntaxException {
        AppConfig config = new AppConfig(resource("/config.test.properties"));

        assertEquals(-33.8688, config.observerLatitude(), 0);
        assertEquals(151.2093, config.observerLongitude(), 0);
        assertEquals("Omega Centauri", config.targetName());
        assertEquals("13h 26m 47.3s", config.targetRa());
        assertEquals("-47d 28m 46s", config.targetDec());
        assertEquals(LocalDate.of(2025, 4, 10), config.observationDate());
        assertEquals("horizon.test.txt", config.horizonPath());
        assertTrue(config.useHorizonFile());
        assertNull(config.footprintsPath());
        assertFalse(config.useFootprintsFile());
        assertEquals("build/reports", config.outputPath());
    }

    @Test
    public void samplingSettingsFallBackToDefaults() throws ConfigurationException, URISyntaxException {
        VisibilitySettings settings = new AppConfig(resource("/config.test.properties")).visibilitySettings();

        assertEquals(25.5, settings.idealAltitudeFloor(), 0);
        assertEquals(5, settings.minSampleMinutes());
        assertEquals(VisibilitySettings.DEFAULT_TARGET_SAMPLE_COUNT, settings.targetSampleCount());
    }

    @Test
    public void loadsJson() throws ConfigurationException, URISyntaxException {
        AppConfig config = new AppConfig(resource("/config.test.json"));

        assertEquals(51.4779, config.observerLatitude(), 0);
        assertEquals("target", config.targetName());
        assertEquals("83.8221", config.targetRa());
        assertEquals(LocalDate.of(2025, 1, 15), config.observationDate());
        assertFalse(config.useHorizonFile());
        assertEquals(VisibilitySettings.DEFAULT_IDEAL_ALTITUDE_FLOOR, config.idealAltitudeFloor(), 0);
        assertEquals(30, config.targetSampleCount());
    }

    @Test(expected = ConfigurationException.class)
    public void missingFile() throws ConfigurationException {
        new AppConfig(new File(folder.getRoot(), "nowhere.properties").getPath());
    }

    @Test(expected = ConfigurationException.class)
    public void invalidDate() throws ConfigurationException, IOException {
        Path file = folder.newFile("bad.properties").toPath();
        Files.writeString(file, "observer_latitude=1\nobserver_longitude=2\ntarget_ra=1\ntarget_dec=2\nobservation_date=15/01/2025\n");
        new AppConfig(file.toString());
    }

    @Test(expected = ConfigurationException.class)
    public void missingDate() throws ConfigurationException, IOException {
        Path file = folder.newFile("nodate.properties").toPath();
        Files.writeString(file, "observer_latitude=1\nobserver_longitude=2\ntarget_ra=1\ntarget_dec=2\n");
        new AppConfig(file.toString());
    }

    private String resource(String name) throws URISyntaxException {
        return Path.of(Objects.requireNonNull(getClass().getResource(name)).toURI()).toString();
    }

}
