package com.gene.evidence.snapshot;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads JSON artifacts without ever failing the caller.
 *
 * <p>A missing file and a file that fails to parse are both reported through
 * {@link LoadedArtifact} and logged; the caller receives its empty value in either case.</p>
 */
public class ArtifactReader {
    private static final Logger log = LoggerFactory.getLogger(ArtifactReader.class);

    private final ObjectMapper mapper;

    public ArtifactReader() {
        this(JsonArtifacts.mapper());
    }

    public ArtifactReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public <T> LoadedArtifact<T> read(Path path, String label, Class<T> type, T emptyValue) {
        return read(path, label, mapper.getTypeFactory().constructType(type), emptyValue);
    }

    public <T> LoadedArtifact<T> read(Path path, String label, TypeReference<T> type, T emptyValue) {
        return read(path, label, mapper.getTypeFactory().constructType(type), emptyValue);
    }

    private <T> LoadedArtifact<T> read(Path path, String label, JavaType type, T emptyValue) {
        if (path == null || !Files.isRegularFile(path)) {
            log.warn("artifact.missing label={} path={}", label, path);
            return LoadedArtifact.missing(path, emptyValue);
        }
        try (InputStream in = Files.newInputStream(path)) {
            T value = mapper.readValue(in, type);
            if (value == null) {
                log.warn("artifact.malformed label={} path={} error=empty document", label, path);
                return LoadedArtifact.malformed(path, emptyValue, "Empty document");
            }
            log.info("artifact.loaded label={} path={}", label, path.getFileName());
            return LoadedArtifact.loaded(path, value);
        } catch (IOException | RuntimeException e) {
            log.warn("artifact.malformed label={} path={} error={}", label, path, e.getMessage());
            return LoadedArtifact.malformed(path, emptyValue, e.getMessage());
        }
    }
}
