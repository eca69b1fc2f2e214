package visibility.tools.geometry;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds footprints from image metadata carrying a "plate_solve" object. Different solvers name their fields
 * differently, so every value is looked up through a list of aliases.
 **/
public class PlateSolveFootprintMapper {

    private static final Logger log = LoggerFactory.getLogger(PlateSolveFootprintMapper.class);

    /* Sizes above this are taken to be arcminutes */
    static final double ARCMINUTE_THRESHOLD = 10.0;
    static final double DEFAULT_WIDTH_DEG = 1.0;
    static final double DEFAULT_ASPECT_RATIO = 0.75;

    // Stacked_120_M42_10.0s_...
    private static final Pattern STACKED_FILENAME = Pattern.compile("Stacked_(\\d+)_.*?_(\\d+(?:\\.\\d+)?)s_", Pattern.CASE_INSENSITIVE);

    private PlateSolveFootprintMapper() {

    }

    public static Optional<ImageFootprint> fromMetadata(String id, String filename, String metadataJson) {
        return fromMetadata(id, filename, metadataJson, null, null);
    }

    public static Optional<ImageFootprint> fromMetadata(String id, String filename, String metadataJson,
                                                        String collectionId, String collectionName) {
        if (metadataJson == null || metadataJson.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonElement element = JsonParser.parseString(metadataJson);
            if (!element.isJsonObject()) {
                return Optional.empty();
            }
            return fromMetadata(id, filename, element.getAsJsonObject(), collectionId, collectionName);
        } catch (JsonParseException e) {
            log.warn("Unreadable metadata for image {}: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @param metadata the image's metadata object
     * @return the footprint, or empty when the image has not been plate-solved
     **/
    public static Optional<ImageFootprint> fromMetadata(String id, String filename, JsonObject metadata,
                                                        String collectionId, String collectionName) {

        if (metadata == null || !metadata.has("plate_solve") || !metadata.get("plate_solve").isJsonObject()) {
            return Optional.empty();
        }
        JsonObject plateSolve = metadata.getAsJsonObject("plate_solve");

        Double centerRa = number(plateSolve, "center_ra", "ra");
        Double centerDec = number(plateSolve, "center_dec", "dec");
        if (centerRa == null || centerDec == null) {
            return Optional.empty();
        }

        double widthDeg = toDegrees(number(plateSolve, "width_deg", "field_width", "width", "fieldw"));
        double heightDeg = toDegrees(number(plateSolve, "height_deg", "field_height", "height", "fieldh"));

        if (widthDeg == 0) {
            widthDeg = DEFAULT_WIDTH_DEG;
        }
        if (heightDeg == 0) {
            heightDeg = widthDeg * DEFAULT_ASPECT_RATIO;
        }

        Double rotation = number(plateSolve, "orientation", "rotation");

        return Optional.of(new ImageFootprint(id, filename, centerRa, centerDec, widthDeg, heightDeg,
                rotation == null ? 0 : rotation, collectionId, collectionName,
                exposureSeconds(metadata, filename)));
    }

    /**
     * Total exposure, from the integration time, frames times per-frame exposure, a single exposure value, or a
     * Seestar style filename, in that order
     **/
    static double exposureSeconds(JsonObject metadata, String filename) {

        Double total = number(metadata, "total_integration_time");
        if (total != null && total > 0) {
            return total;
        }

        Double frames = number(metadata, "stacked_frames", "stackedFrames", "frames", "STACKCNT");
        Double perFrame = number(metadata, "exposure", "exposure_time", "exptime");
        if (frames != null && frames > 0 && perFrame != null && perFrame > 0) {
            return frames * perFrame;
        }

        Double exposure = number(metadata, "exposure");
        if (exposure != null && exposure > 0) {
            return exposure;
        }
        Double exposureTime = number(metadata, "exposure_time");
        if (exposureTime != null && exposureTime > 0) {
            return exposureTime;
        }

        if (filename != null) {
            Matcher matcher = STACKED_FILENAME.matcher(filename);
            if (matcher.find()) {
                try {
                    return Integer.parseInt(matcher.group(1)) * Double.parseDouble(matcher.group(2));
                } catch (NumberFormatException e) {
                    log.debug("Frame count out of range in {}", filename);
                }
            }
        }

        return 0;
    }

    private static double toDegrees(Double size) {
        if (size == null || size <= 0) {
            return 0;
        }
        return size > ARCMINUTE_THRESHOLD ? size / 60 : size;
    }

    /**
     * @return the first alias holding a JSON number, or null
     **/
    private static Double number(JsonObject object, String... aliases) {
        for (String alias : aliases) {
            JsonElement value = object.get(alias);
            if (value != null && value.isJsonPrimitive() && value.getAsJsonPrimitive().isNumber()) {
                return value.getAsDouble();
            }
        }
        return null;
    }

}
