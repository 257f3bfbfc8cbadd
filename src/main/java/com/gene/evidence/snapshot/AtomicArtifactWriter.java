package com.gene.evidence.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Publishes artifacts with write-then-rename so readers never observe a partial file.
 *
 * <p>Content is written to a temporary sibling of the target and moved over the target
 * only after it is complete. On any failure the temporary file is removed and the
 * previous artifact stays untouched.</p>
 */
public class AtomicArtifactWriter {
    private static final Logger log = LoggerFactory.getLogger(AtomicArtifactWriter.class);

    /**
     * Writes the body of an artifact.
     */
    @FunctionalInterface
    public interface ContentWriter {
        void write(Writer writer) throws IOException;
    }

    private final ObjectMapper mapper;

    public AtomicArtifactWriter() {
        this(JsonArtifacts.mapper());
    }

    public AtomicArtifactWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public void writeJson(Path target, Object value) {
        write(target, writer -> mapper.writeValue(writer, value));
    }

    public void write(Path target, ContentWriter content) {
        Path directory = target.toAbsolutePath().getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "." + target.getFileName(), ".tmp");
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                content.write(writer);
            }
            publish(temp, target);
            log.info("artifact.written path={} bytes={}", target, Files.size(target));
        } catch (IOException | RuntimeException e) {
            deleteQuietly(temp);
            throw new SnapshotWriteException("Failed to write artifact " + target + ": " + e.getMessage(), e);
        }
    }

    private void publish(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, using replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("artifact.tempCleanupFailed path={} error={}", temp, e.getMessage());
        }
    }
}
