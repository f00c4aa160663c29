package org.iceforge.terra.gateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.terra.gateway.config.TerraProperties;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Function schemas advertised to tool-calling clients, read from {@code terra.tools}.
 */
@Component
public class ToolSchemas {

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final TerraProperties props;

    private volatile JsonNode cached;

    public ToolSchemas(ObjectMapper objectMapper, ResourceLoader resourceLoader, TerraProperties props) {
        this.objectMapper = Objects.requireNonNull(objectMapper);
        this.resourceLoader = Objects.requireNonNull(resourceLoader);
        this.props = Objects.requireNonNull(props);
    }

    public JsonNode load() {
        JsonNode local = cached;
        if (local != null) return local;

        synchronized (this) {
            if (cached != null) return cached;
            try (InputStream in = resourceLoader.getResource(props.getTools()).getInputStream()) {
                cached = objectMapper.readTree(in);
                return cached;
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load tool schemas: " + props.getTools(), e);
            }
        }
    }
}
