package com.policysync.cache;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Persists a cache as a single JSON document. Writes go to a sibling temp file
 * that is then moved over the target, so a crash never leaves a torn file.
 * Reads and writes of one store never overlap.
 */
public class JsonFilePolicyCacheStore implements PolicyCacheStore {

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFilePolicyCacheStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    public Path getFile() {
        return file;
    }

    @Override
    public synchronized Optional<CachedPolicy> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), CachedPolicy.class));
        } catch (IOException ex) {
            throw new PolicyStoreException("failed to read policy cache " + file, ex);
        }
    }

    @Override
    public synchronized void store(CachedPolicy policy) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(temp.toFile(), policy);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            throw new PolicyStoreException("failed to write policy cache " + file, ex);
        }
    }
}
