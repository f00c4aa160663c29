package org.iceforge.terra.gateway.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.terra.gateway.config.TerraProperties;
import org.iceforge.terra.gateway.engine.ErrorCode;
import org.iceforge.terra.gateway.engine.QueryException;
import org.iceforge.terra.gateway.entity.SimilarityScorer;
import org.iceforge.terra.gateway.model.DatasetDescriptor;
import org.iceforge.terra.gateway.model.DatasetManifest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Dataset descriptors from the manifest, loaded once on first use.
 */
@Component
public class DatasetCatalog {

    private static final Logger log = LoggerFactory.getLogger(DatasetCatalog.class);

    private static final double SIMILAR_ID_MIN_SCORE = 0.5;
    private static final int MAX_SIMILAR_IDS = 5;

    private final ObjectMapper yamlMapper;
    private final ResourceLoader resourceLoader;
    private final TerraProperties props;
    private final SimilarityScorer scorer;

    private volatile Map<String, DatasetDescriptor> cached;

    public DatasetCatalog(@Qualifier("yamlObjectMapper") ObjectMapper yamlObjectMapper, ResourceLoader resourceLoader,
                          TerraProperties props, SimilarityScorer scorer) {
        this.yamlMapper = Objects.requireNonNull(yamlObjectMapper);
        this.resourceLoader = Objects.requireNonNull(resourceLoader);
        this.props = Objects.requireNonNull(props);
        this.scorer = Objects.requireNonNull(scorer);
    }

    public List<DatasetDescriptor> all() {
        return List.copyOf(load().values());
    }

    /**
     * Legacy ids are mapped through {@code terra.file-id-aliases} first.
     */
    public Optional<DatasetDescriptor> find(String fileId) {
        if (fileId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(load().get(canonicalId(fileId)));
    }

    public DatasetDescriptor require(String fileId) {
        return find(fileId).orElseThrow(() -> {
            List<String> similar = similarIds(fileId);
            QueryException.Builder b = QueryException.builder(ErrorCode.NOT_FOUND, "Unknown file_id '" + fileId + "'")
                    .context("file_id", fileId)
                    .suggestions(similar);
            b.hint(similar.isEmpty() ? "Use /list_files to see available datasets"
                    : "Did you mean: " + String.join(", ", similar) + "?");
            return b.build();
        });
    }

    public String canonicalId(String fileId) {
        return props.getFileIdAliases().getOrDefault(fileId, fileId);
    }

    public int size() {
        return load().size();
    }

    List<String> similarIds(String fileId) {
        if (fileId == null || fileId.isBlank()) {
            return List.of();
        }
        return load().keySet().stream()
                .map(id -> Map.entry(id, scorer.score(fileId, id)))
                .filter(e -> e.getValue() >= SIMILAR_ID_MIN_SCORE)
                .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry::getKey))
                .limit(MAX_SIMILAR_IDS)
                .map(Map.Entry::getKey)
                .toList();
    }

    private Map<String, DatasetDescriptor> load() {
        Map<String, DatasetDescriptor> local = cached;
        if (local != null) return local;

        synchronized (this) {
            if (cached != null) return cached;
            Resource resource = resourceLoader.getResource(props.getManifest());
            try (InputStream in = resource.getInputStream()) {
                DatasetManifest manifest = yamlMapper.readValue(in, DatasetManifest.class);
                Map<String, DatasetDescriptor> byId = new LinkedHashMap<>();
                for (DatasetDescriptor d : manifest.getFiles()) {
                    if (d.getFileId() == null || d.getFileId().isBlank()) {
                        log.warn("Skipping manifest entry without file_id");
                        continue;
                    }
                    if (!d.hasValidFileId()) {
                        log.warn("file_id '{}' does not follow <sector>-<level>-<grain>", d.getFileId());
                    }
                    if (byId.put(d.getFileId(), d) != null) {
                        log.warn("Duplicate file_id '{}' in manifest; last entry wins", d.getFileId());
                    }
                }
                log.info("Loaded {} datasets from {}", byId.size(), props.getManifest());
                cached = Collections.unmodifiableMap(byId);
                return cached;
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load dataset manifest: " + props.getManifest(), e);
            }
        }
    }
}
