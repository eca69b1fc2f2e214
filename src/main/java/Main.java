import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visibility.tools.VisibilityPlanner;
import visibility.tools.night.SunTimeCalculator;
import visibility.tools.utilities.AppConfig;

import java.io.IOException;

public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {

        String configPath = args.length > 0 ? args[0] : "config.properties";

        AppConfig appConfig;
        try {
            appConfig = new AppConfig(configPath);
        } catch (ConfigurationException e) {
            log.error("Error trying to load configurations from {}. Exiting. {}", configPath, e.getMessage());
            System.exit(100);
            return;
        }

        try {
            new VisibilityPlanner(appConfig, new SunTimeCalculator()).run();
        } catch (IOException e) {
            log.error("Error reading inputs or writing reports. Exiting.", e);
            System.exit(101);
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}. Exiting.", e.getMessage());
            System.exit(102);
        }

    }

}
