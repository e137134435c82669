package io.paramfetch.error;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;

/** Appends one JSON object per failed item: {@code {"ts","itemKey","scope","error"}}. */
public class FileItemFailureLog implements ItemFailureLog {
    private static final Logger log = LoggerFactory.getLogger(FileItemFailureLog.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path file;
    private final Clock clock;

    public FileItemFailureLog(Path file) throws IOException {
        this(file, Clock.systemUTC());
    }

    public FileItemFailureLog(Path file, Clock clock) throws IOException {
        this.file = file;
        this.clock = clock;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE);
        }
    }

    @Override
    public synchronized void recordFailure(String itemKey, String scope, Exception e) {
        ObjectNode line = MAPPER.createObjectNode();
        line.put("ts", clock.instant().toString());
        line.put("itemKey", itemKey);
        line.put("scope", scope);
        line.put("error", String.valueOf(e));
        try {
            Files.writeString(file, MAPPER.writeValueAsString(line) + System.lineSeparator(),
                    StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException io) {
            log.warn("could not append failure for {} to {}: {}", itemKey, file, io.toString());
        }
    }

    public Path file() { return file; }
}
