package com.agentfederation.core.registry;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Stores the registry as pretty-printed JSON in {@code <dataDir>/federation-registry.json}.
 *
 * <p>Writes go to a sibling temp file that is then moved over the target, so a crash
 * mid-write leaves the previous document intact.
 */
public class JsonFileRegistryStore implements RegistryStore {

    public static final String FILE_NAME = "federation-registry.json";

    private final Path file;
    private final ObjectMapper mapper;

    public JsonFileRegistryStore(Path dataDir) {
        this(dataDir, new ObjectMapper().registerModule(new JavaTimeModule()));
    }

    public JsonFileRegistryStore(Path dataDir, ObjectMapper mapper) {
        this.file = dataDir.resolve(FILE_NAME);
        this.mapper = mapper.copy()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public RegistryDocument load() throws IOException {
        if (!Files.exists(file)) {
            return null;
        }
        return mapper.readValue(file.toFile(), RegistryDocument.class);
    }

    @Override
    public void save(RegistryDocument document) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, FILE_NAME, ".tmp");
        try {
            mapper.writeValue(tmp.toFile(), document);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    public Path file() {
        return file;
    }
}
