package visibility.tools.utilities;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visibility.tools.geometry.ImageFootprint;
import visibility.tools.geometry.PlateSolveFootprintMapper;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class FileUtils {

    private static final Logger log = LoggerFactory.getLogger(FileUtils.class);

    private FileUtils() {

    }

    /**
     * Reads an image list and keeps the plate-solved ones. The file holds a JSON array of objects with "id",
     * "filename", optional "collection_id" and "collection_name", and a "metadata" object or string.
     *
     * @param path the image list
     * @return the footprints of the solved images, in file order
     * @throws IOException if the file cannot be read or is not a JSON array
     */
    public static List<ImageFootprint> footprintsFromFile(Path path) throws IOException {

        JsonElement root;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new IOException("Malformed image list " + path, e);
        }

        if (!root.isJsonArray()) {
            throw new IOException("Expected a JSON array of images in " + path);
        }

        List<ImageFootprint> footprints = new ArrayList<>();
        JsonArray images = root.getAsJsonArray();
        int unsolved = 0;

        for (JsonElement element : images) {
            if (!element.isJsonObject()) {
                unsolved++;
                continue;
            }
            JsonObject image = element.getAsJsonObject();
            String id = string(image, "id");
            if (id == null) {
                log.warn("Skipping image entry without a usable id: {}", image);
                unsolved++;
                continue;
            }
            String filename = string(image, "filename");
            String collectionId = string(image, "collection_id");
            String collectionName = string(image, "collection_name");
            JsonElement metadata = image.get("metadata");

            Optional<ImageFootprint> footprint = Optional.empty();
            if (metadata != null && metadata.isJsonObject()) {
                footprint = PlateSolveFootprintMapper.fromMetadata(id, filename, metadata.getAsJsonObject(), collectionId, collectionName);
            } else if (metadata != null && metadata.isJsonPrimitive()) {
                footprint = PlateSolveFootprintMapper.fromMetadata(id, filename, metadata.getAsString(), collectionId, collectionName);
            }

            if (footprint.isPresent()) {
                footprints.add(footprint.get());
            } else {
                unsolved++;
            }
        }

        log.info("Read {} footprints from {} ({} images without a plate solve)", footprints.size(), path, unsolved);
        return footprints;
    }

    /**
     * Creates a directory if it does not exist yet
     */
    public static Path ensureDirectory(String outputPath) throws IOException {
        Path directory = Path.of(outputPath);
        if (!Files.isDirectory(directory)) {
            Files.createDirectories(directory);
            log.info("Output directory didn't exist, so it was created: {}", directory);
        }
        return directory;
    }

    private static String string(JsonObject object, String key) {
        JsonElement value = object.get(key);
        return value != null && value.isJsonPrimitive() ? value.getAsString() : null;
    }

}
