package com.example.supplymatch.infrastructure.mapping;

import com.example.supplymatch.domain.mapping.LearnedMappingStore;
import com.example.supplymatch.domain.mapping.MappingKeys;
import com.example.supplymatch.domain.model.LearnedMapping;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link LearnedMappingStore} kept in a single JSON file:
 * <pre>
 * {"Молоко 3.2%": {"id": "...", "name": "...", "code": "..."}}
 * </pre>
 * Reads share a lock; writes re-read the file, merge and replace it through a temp file under the
 * exclusive lock, so concurrent readers never see a half-written file. A file that cannot be parsed
 * is copied to {@code <name>.bak} before the first write replaces it.
 */
public class JsonFileLearnedMappingStore implements LearnedMappingStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileLearnedMappingStore.class);
    private static final TypeReference<LinkedHashMap<String, StoredMapping>> FILE_TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public JsonFileLearnedMappingStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<LearnedMapping> get(String lineText) {
        String key = MappingKeys.normalize(lineText);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            StoredMapping stored = load().get(key);
            if (stored == null || stored.id() == null || stored.id().isBlank()) {
                return Optional.empty();
            }
            return Optional.of(new LearnedMapping(key, stored.id(), stored.name(), stored.code()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void remove(String lineText) {
        String key = MappingKeys.normalize(lineText);
        if (key.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            Map<String, StoredMapping> data = loadForUpdate();
            if (data.remove(key) != null) {
                write(data);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void save(Map<String, LearnedMapping> mappings) {
        if (mappings == null || mappings.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            Map<String, StoredMapping> data = loadForUpdate();
            int merged = 0;
            for (Map.Entry<String, LearnedMapping> entry : mappings.entrySet()) {
                String key = MappingKeys.normalize(entry.getKey());
                LearnedMapping mapping = entry.getValue();
                if (key.isEmpty() || mapping == null || mapping.id() == null || mapping.id().isBlank()) {
                    continue;
                }
                data.put(key, new StoredMapping(mapping.id(),
                        mapping.name() == null ? "" : mapping.name(),
                        mapping.code() == null ? "" : mapping.code()));
                merged++;
            }
            if (merged > 0) {
                write(data);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Map<String, StoredMapping> load() {
        try {
            return read();
        } catch (IOException e) {
            log.warn("Unable to load product mappings from {}: {}", file, e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    /**
     * Loads the mappings about to be rewritten. When the file is unreadable its content is kept in
     * the backup file, since the following write starts from an empty map.
     */
    private Map<String, StoredMapping> loadForUpdate() {
        try {
            return read();
        } catch (IOException e) {
            Path backup = backupFile();
            try {
                Files.copy(file, backup, StandardCopyOption.REPLACE_EXISTING);
                log.warn("Unable to load product mappings from {} ({}); previous content kept in {}",
                        file, e.getMessage(), backup);
            } catch (IOException copyFailure) {
                log.warn("Unable to load product mappings from {} ({}) or back it up to {}: {}",
                        file, e.getMessage(), backup, copyFailure.getMessage());
            }
            return new LinkedHashMap<>();
        }
    }

    private Map<String, StoredMapping> read() throws IOException {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        LinkedHashMap<String, StoredMapping> data = objectMapper.readValue(file.toFile(), FILE_TYPE);
        return data == null ? new LinkedHashMap<>() : data;
    }

    Path backupFile() {
        return file.resolveSibling(file.getFileName() + ".bak");
    }

    private void write(Map<String, StoredMapping> data) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), data);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            log.warn("Unable to save product mappings to {}: {}", file, e.getMessage());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StoredMapping(String id, String name, @JsonAlias({"productCode", "number"}) String code) {
    }
}
