package visibility.tools.utilities;

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.JSONConfiguration;
import org.apache.commons.configuration2.builder.fluent.Configurations;
import org.apache.commons.configuration2.ex.ConfigurationException;
import visibility.tools.night.VisibilitySettings;

import java.io.File;
import java.time.LocalDate;
import java.util.Locale;

public record AppConfig(
        double observerLatitude,
        double observerLongitude,
        String targetName,
        String targetRa,
        String targetDec,
        LocalDate observationDate,
        String horizonPath,
        String footprintsPath,
        String outputPath,
        double idealAltitudeFloor,
        int minSampleMinutes,
        int targetSampleCount
) {
    public AppConfig(String configFilePath) throws ConfigurationException {
        this(loadConfiguration(configFilePath));
    }

    private AppConfig(Configuration config) throws ConfigurationException {
        this(
                config.getDouble("observer_latitude"),
                config.getDouble("observer_longitude"),
                config.getString("target_name", "target"),
                config.getString("target_ra"),
                config.getString("target_dec"),
                TimeUtils.parseDate(config.getString("observation_date")),
                optional(config.getString("horizon_path")),
                optional(config.getString("footprints_path")),
                config.getString("output_path", "."),
                config.getDouble("ideal_altitude_floor", VisibilitySettings.DEFAULT_IDEAL_ALTITUDE_FLOOR),
                config.getInt("min_sample_minutes", VisibilitySettings.DEFAULT_MIN_SAMPLE_MINUTES),
                config.getInt("target_sample_count", VisibilitySettings.DEFAULT_TARGET_SAMPLE_COUNT)
        );
    }

    public VisibilitySettings visibilitySettings() {
        return new VisibilitySettings(idealAltitudeFloor, minSampleMinutes, targetSampleCount);
    }

    public boolean useHorizonFile() {
        return horizonPath != null;
    }

    public boolean useFootprintsFile() {
        return footprintsPath != null;
    }

    private static Configuration loadConfiguration(String configFilePath) throws ConfigurationException {
        Configurations configs = new Configurations();
        if (configFilePath.toLowerCase(Locale.ROOT).endsWith(".json")) {
            return configs.fileBased(JSONConfiguration.class, new File(configFilePath));
        }
        return configs.properties(configFilePath);
    }

    private static String optional(String value) {
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }

}
