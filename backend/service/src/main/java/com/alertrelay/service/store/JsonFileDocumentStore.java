package com.alertrelay.service.store;

import com.alertrelay.core.util.JsonUtils;
import com.alertrelay.pipeline.store.InMemoryDocumentStore;
import com.alertrelay.pipeline.store.PersistenceException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;

// {collection: {documentId: fields}}, rewritten whole after every mutation under the store lock.
public class JsonFileDocumentStore extends InMemoryDocumentStore {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final TypeReference<Map<String, Map<String, Map<String, Object>>>> FILE_TYPE = new TypeReference<>() {
    };

    private final Path file;

    public JsonFileDocumentStore(Path file, Clock clock) {
        super(clock);
        this.file = file;
        loadIfPresent();
    }

    public Path file() {
        return file;
    }

    @Override
    protected void afterWrite() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(file)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, snapshot());
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed writing documents to " + file, e);
        }
    }

    private void loadIfPresent() {
        if (!Files.exists(file)) {
            return;
        }
        try (InputStream in = Files.newInputStream(file)) {
            Map<String, Map<String, Map<String, Object>>> loaded = MAPPER.readValue(in, FILE_TYPE);
            if (loaded != null) {
                restore(loaded);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading documents from " + file, e);
        }
    }
}
