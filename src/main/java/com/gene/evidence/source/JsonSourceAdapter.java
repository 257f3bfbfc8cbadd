package com.gene.evidence.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gene.evidence.core.model.GeneSymbol;
import com.gene.evidence.core.model.SourceEvidence;
import com.gene.evidence.snapshot.ArtifactLoadException;
import com.gene.evidence.snapshot.JsonArtifacts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Base class for adapters backed by a JSON object keyed by gene symbol.
 * Subclasses convert one value node into {@link SourceEvidence}, or skip it.
 */
public abstract class JsonSourceAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(JsonSourceAdapter.class);

    private final Path path;
    private final ObjectMapper mapper;

    protected JsonSourceAdapter(Path path) {
        this(path, JsonArtifacts.mapper());
    }

    protected JsonSourceAdapter(Path path, ObjectMapper mapper) {
        this.path = path;
        this.mapper = mapper;
    }

    @Override
    public Map<String, SourceEvidence> load() {
        Optional<JsonNode> root = readRoot();
        if (root.isEmpty()) {
            return Map.of();
        }
        JsonNode genes = selectGenes(root.get());
        Map<String, SourceEvidence> result = new LinkedHashMap<>();
        if (genes == null || !genes.isObject()) {
            log.warn("source.unexpectedShape source={} path={}", getSource(), path);
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = genes.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String symbol = GeneSymbol.normalize(field.getKey());
            if (symbol == null || symbol.isEmpty()) {
                continue;
            }
            toEvidence(field.getValue()).ifPresent(evidence -> result.merge(symbol, evidence, this::combine));
        }
        log.info("source.loaded source={} genes={}", getSource(), result.size());
        return result;
    }

    public Path getPath() {
        return path;
    }

    /**
     * Selects the object holding symbol keys. Defaults to the document root.
     */
    protected JsonNode selectGenes(JsonNode root) {
        return root;
    }

    /**
     * Converts the value stored for one symbol.
     */
    protected abstract Optional<SourceEvidence> toEvidence(JsonNode value);

    /**
     * Resolves two entries whose keys normalize to the same symbol. Keeps the richer one.
     */
    protected SourceEvidence combine(SourceEvidence first, SourceEvidence second) {
        return second.count() > first.count() ? second : first;
    }

    /**
     * Text of a detail element: plain strings as-is, objects by their {@code name} field.
     */
    protected static String textOf(JsonNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        if (node.isObject()) {
            JsonNode name = node.get("name");
            return name != null && !name.isNull() ? name.asText() : node.toString();
        }
        return node.asText();
    }

    protected static List<String> textList(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array != null && array.isArray()) {
            for (JsonNode element : array) {
                values.add(textOf(element));
            }
        }
        return values;
    }

    private Optional<JsonNode> readRoot() {
        if (path == null || !Files.isRegularFile(path)) {
            log.warn("source.missing source={} path={} (continuing without it)", getSource(), path);
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readTree(path.toFile()));
        } catch (IOException e) {
            throw new ArtifactLoadException(path, "Failed to parse " + getSource() + " file " + path, e);
        }
    }
}
