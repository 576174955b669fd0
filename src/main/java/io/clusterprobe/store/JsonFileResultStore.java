package io.clusterprobe.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.escape.Escaper;
import com.google.common.net.PercentEscaper;
import io.clusterprobe.models.Result;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import static io.clusterprobe.config.Constants.*;

/**
 * Writes each accepted result as a JSON document under
 * {@code <outputDir>/plugins/<producer>/results/<locus>.json}.
 */
@Slf4j
public class JsonFileResultStore implements ResultStore {
    private static final Escaper SEGMENT_ESCAPER = new PercentEscaper("-_.", false);

    private final Path pluginsDir;
    private final ObjectMapper objectMapper;

    public JsonFileResultStore(Path outputDir) {
        this.pluginsDir = outputDir.resolve(PATH_PLUGINS);
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void save(Result result) throws IOException {
        Path target = resolve(result);
        Files.createDirectories(target.getParent());
        Path tmp = Files.createTempFile(target.getParent(), ".result-", ".tmp");
        try {
            objectMapper.writeValue(tmp.toFile(), result);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.debug("Stored result {}/{} at {}", result.getProducer(), result.getLocus(), target);
    }

    Path resolve(Result result) {
        return pluginsDir
            .resolve(safeSegment(result.getProducer()))
            .resolve(PATH_RESULTS)
            .resolve(safeSegment(result.getLocus()) + SUFFIX_JSON);
    }

    /**
     * Percent-encode a name into one path segment. Distinct names always map to distinct
     * segments, so {@code a:b} and {@code a_b} never share a file. An empty name becomes a
     * bare {@code %}, which the escaper never emits on its own.
     */
    static String safeSegment(String value) {
        if (value == null || value.isEmpty()) {
            return "%";
        }
        String escaped = SEGMENT_ESCAPER.escape(value);
        if (escaped.equals(".") || escaped.equals("..")) {
            return escaped.replace(".", "%2E");
        }
        return escaped;
    }
}
