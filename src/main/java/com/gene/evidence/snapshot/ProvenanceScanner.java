package com.gene.evidence.snapshot;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Collects {@code _provenance} blocks from the JSON artifacts of a directory.
 * Unreadable files are logged and skipped.
 */
public class ProvenanceScanner {
    private static final Logger log = LoggerFactory.getLogger(ProvenanceScanner.class);
    private static final String PROVENANCE_FIELD = "_provenance";
    private static final TypeReference<Map<String, Object>> OBJECT = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public ProvenanceScanner() {
        this(JsonArtifacts.mapper());
    }

    public ProvenanceScanner(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<ProvenanceAuditEntry> scan(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            return List.of();
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.json")) {
            stream.forEach(files::add);
        } catch (IOException e) {
            log.warn("provenance.scanFailed directory={} error={}", directory, e.getMessage());
            return List.of();
        }
        files.sort(null);

        List<ProvenanceAuditEntry> entries = new ArrayList<>();
        for (Path file : files) {
            try {
                JsonNode root = mapper.readTree(file.toFile());
                JsonNode block = root != null ? root.get(PROVENANCE_FIELD) : null;
                if (block != null && block.isObject()) {
                    entries.add(new ProvenanceAuditEntry(file.getFileName().toString(),
                            mapper.convertValue(block, OBJECT)));
                }
            } catch (IOException e) {
                log.warn("provenance.unreadable path={} error={}", file, e.getMessage());
            }
        }
        log.debug("provenance.scanned directory={} blocks={}", directory, entries.size());
        return List.copyOf(entries);
    }
}
