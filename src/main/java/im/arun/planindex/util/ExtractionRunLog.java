package im.arun.planindex.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Accumulates structured events of one extraction run and rewrites them as a JSON array
 * after every event, so a crashed run still leaves its trail under the log directory.
 */
public class ExtractionRunLog {
    private static final Logger systemLogger = LoggerFactory.getLogger(ExtractionRunLog.class);
    static final Path DEFAULT_DIRECTORY = Paths.get("./logs");

    private final Path logPath;
    private final List<Map<String, Object>> entries = new ArrayList<>();
    private final ObjectMapper objectMapper;

    public ExtractionRunLog(UUID projectId) {
        this(DEFAULT_DIRECTORY, projectId);
    }

    public ExtractionRunLog(Path directory, UUID projectId) {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);

        String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        String logFileName = String.format("extraction_%s_%s.json", projectId, timestamp);

        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            systemLogger.error("Failed to create log directory {}", directory, e);
        }
        this.logPath = directory.resolve(logFileName);
    }

    public void event(String name, Map<String, ?> fields) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("event", name);
        entry.put("at", Instant.now());
        if (fields != null) {
            entry.putAll(fields);
        }
        append(entry);
    }

    public void warn(String name, String message) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("event", name);
        entry.put("level", "WARNING");
        entry.put("message", message);
        append(entry);
    }

    private synchronized void append(Map<String, Object> entry) {
        entries.add(entry);
        writeToFile();
    }

    private void writeToFile() {
        try {
            objectMapper.writeValue(logPath.toFile(), entries);
        } catch (IOException e) {
            systemLogger.error("Failed to write run log: {}", logPath, e);
        }
    }

    public Path getLogPath() {
        return logPath;
    }

    public synchronized List<Map<String, Object>> getEntries() {
        return List.copyOf(entries);
    }
}
