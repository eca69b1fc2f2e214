package visibility.tools.horizon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads horizon files: one whitespace-separated "azimuth altitude" pair per line, '#' comments and blank lines
 * ignored.
 **/
public class HorizonFileReader {

    private static final Logger log = LoggerFactory.getLogger(HorizonFileReader.class);

    private HorizonFileReader() {

    }

    /**
     * Reads a horizon file from disk, naming the profile after the file
     *
     * @param path the horizon file
     * @return a normalized and sorted HorizonProfile
     * @throws IOException if the file cannot be read
     **/
    public static HorizonProfile read(Path path) throws IOException {
        String text = Files.readString(path, StandardCharsets.UTF_8);
        HorizonProfile profile = parse(path.getFileName().toString(), text);
        log.info("Loaded horizon profile {} with {} points", path, profile.size());
        return profile;
    }

    public static HorizonProfile parse(String text) {
        return parse(null, text);
    }

    public static HorizonProfile parse(String name, String text) {

        List<HorizonPoint> points = new ArrayList<>();

        List<String> lines = text.lines().toList();
        for (int i = 0; i < lines.size(); i++) {
            String trimmed = lines.get(i).trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            HorizonPoint point = parseLine(trimmed);
            if (point == null) {
                log.debug("Skipping malformed horizon line {}: {}", i + 1, trimmed);
            } else {
                points.add(point);
            }
        }

        return HorizonProfile.of(name, points);
    }

    private static HorizonPoint parseLine(String line) {
        var data = line.split("\\s+");
        if (data.length < 2) {
            return null;
        }
        try {
            double azimuth = Double.parseDouble(data[0]);
            double altitude = Double.parseDouble(data[1]);
            if (Double.isNaN(azimuth) || Double.isNaN(altitude)) {
                return null;
            }
            return new HorizonPoint(azimuth, altitude);
        } catch (NumberFormatException e) {
            return null;
        }
    }

}
