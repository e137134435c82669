package io.paramfetch.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.paramfetch.core.CaseFile;
import io.paramfetch.core.FileStateAccessor;
import io.paramfetch.core.ParameterFile;
import io.paramfetch.model.CalendarDates;
import io.paramfetch.model.ParameterValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads cached files from a directory: {@code parameter-<id>.json} and {@code case-<id>.json}.
 * Dates may be UK ({@code 1-Jan-26}) or ISO.
 */
public class JsonFileStateAccessor implements FileStateAccessor {
    private static final Logger log = LoggerFactory.getLogger(JsonFileStateAccessor.class);

    private final Path dir;
    private final ObjectMapper mapper;

    public JsonFileStateAccessor(Path dir, ObjectMapper mapper) {
        this.dir = dir;
        this.mapper = mapper;
    }

    @Override
    public Optional<ParameterFile> parameterFile(String objectId) {
        return read("parameter-" + objectId + ".json").map(root -> {
            List<ParameterValue> values = new ArrayList<>();
            for (JsonNode v : root.path("values")) values.add(parseValue(v));
            return new ParameterFile(objectId, values);
        });
    }

    @Override
    public Optional<CaseFile> caseFile(String objectId) {
        return read("case-" + objectId + ".json").map(root -> {
            Map<String, Object> data = new LinkedHashMap<>();
            root.fields().forEachRemaining(e -> {
                if (!e.getValue().isNull()) data.put(e.getKey(), mapper.convertValue(e.getValue(), Object.class));
            });
            return new CaseFile(objectId, data);
        });
    }

    private Optional<JsonNode> read(String fileName) {
        Path file = dir.resolve(fileName);
        if (!Files.isRegularFile(file)) return Optional.empty();
        try {
            return Optional.of(mapper.readTree(file.toFile()));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + file, e);
        }
    }

    ParameterValue parseValue(JsonNode v) {
        return ParameterValue.builder()
                .sliceDsl(text(v, "sliceDSL"))
                .window(date(v, "window_from"), date(v, "window_to"))
                .cohort(date(v, "cohort_from"), date(v, "cohort_to"))
                .daily(dates(v.path("dates")), longs(v.path("n_daily")), longs(v.path("k_daily")))
                .aggregate(v.hasNonNull("mean") ? v.get("mean").asDouble() : null,
                        v.hasNonNull("n") ? v.get("n").asLong() : null,
                        v.hasNonNull("k") ? v.get("k").asLong() : null)
                .querySignature(text(v, "query_signature"))
                .retrievedAt(instant(v.path("data_source").path("retrieved_at")))
                .build();
    }

    private static String text(JsonNode v, String field) {
        return v.hasNonNull(field) ? v.get(field).asText() : null;
    }

    private static LocalDate date(JsonNode v, String field) {
        return v.hasNonNull(field) ? CalendarDates.parse(v.get(field).asText()) : null;
    }

    private static List<LocalDate> dates(JsonNode arr) {
        if (!arr.isArray()) return null;
        List<LocalDate> out = new ArrayList<>();
        for (JsonNode d : arr) out.add(CalendarDates.parse(d.asText()));
        return out;
    }

    private static List<Long> longs(JsonNode arr) {
        if (!arr.isArray()) return null;
        List<Long> out = new ArrayList<>();
        for (JsonNode n : arr) out.add(n.isNull() ? null : n.asLong());
        return out;
    }

    private static Instant instant(JsonNode n) {
        if (n.isMissingNode() || n.isNull()) return null;
        try {
            return Instant.parse(n.asText());
        } catch (RuntimeException e) {
            log.debug("unparseable retrieved_at '{}'", n.asText());
            return null;
        }
    }
}
