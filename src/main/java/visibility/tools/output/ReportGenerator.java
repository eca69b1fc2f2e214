package visibility.tools.output;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public class ReportGenerator {

    private static final String JSON_EXTENSION = ".json";
    private static final String CSV_EXTENSION = ".csv";
    private final Path outputPath;
    private final Gson gson;

    public ReportGenerator(Path outputPath) {
        this.outputPath = outputPath;
        this.gson = new GsonBuilder()
                .registerTypeAdapter(Instant.class, (JsonSerializer<Instant>) (src, type, context) -> new JsonPrimitive(src.toString()))
                .registerTypeAdapter(LocalDate.class, (JsonSerializer<LocalDate>) (src, type, context) -> new JsonPrimitive(src.toString()))
                .serializeSpecialFloatingPointValues()
                .setPrettyPrinting()
                .create();
    }

    public String toJson(Object obj) {
        return gson.toJson(obj);
    }

    /**
     * Saves an Object to a JSON interpretation
     * @param obj the object to be stored
     * @param name the name of the file, without extension
     * @return the written file
     */
    public Path saveAsJSON(Object obj, String name) throws IOException {
        Path file = outputPath.resolve(name + JSON_EXTENSION);
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            gson.toJson(obj, writer);
        }
        return file;
    }

    /**
     * Saves a String List to a new file, each entry as a line
     * @param entryList the lines to be stored
     * @param name the name of the file, without extension
     * @return the written file
     */
    public Path saveAsCSV(List<String> entryList, String name) throws IOException {
        Path file = outputPath.resolve(name + CSV_EXTENSION);
        Files.write(file, entryList, StandardCharsets.UTF_8);
        return file;
    }

}
