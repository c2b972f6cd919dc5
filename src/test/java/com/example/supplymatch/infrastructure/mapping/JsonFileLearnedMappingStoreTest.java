package com.example.supplymatch.infrastructure.mapping;

import com.example.supplymatch.domain.model.LearnedMapping;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class JsonFileLearnedMappingStoreTest {

    @TempDir
    Path tempDir;

    private Path file;
    private JsonFileLearnedMappingStore store;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("data").resolve("product-mappings.json");
        store = new JsonFileLearnedMappingStore(file, new ObjectMapper());
    }

    @Test
    void savedMappingIsFoundUnderNormalizedText() {
        store.save(Map.of("Молоко  3.2%", mapping("Молоко  3.2%", "p-1", "Молоко", "00375")));

        assertThat(Files.exists(file)).isTrue();
        assertThat(store.get(" Молоко 3.2% ")).hasValueSatisfying(found -> {
            assertThat(found.key()).isEqualTo("Молоко 3.2%");
            assertThat(found.id()).isEqualTo("p-1");
            assertThat(found.name()).isEqualTo("Молоко");
            assertThat(found.code()).isEqualTo("00375");
        });
    }

    @Test
    void saveMergesWithExistingEntriesAndOverwritesSameKey() {
        store.save(Map.of("Молоко", mapping("Молоко", "p-1", "Молоко", "")));
        store.save(Map.of("Кефир", mapping("Кефир", "p-2", "Кефир", "")));
        store.save(Map.of("Молоко", mapping("Молоко", "p-3", "Молоко 2,5%", "")));

        assertThat(store.get("Молоко")).map(LearnedMapping::id).contains("p-3");
        assertThat(store.get("Кефир")).map(LearnedMapping::id).contains("p-2");
    }

    @Test
    void entriesWithoutIdAreNotStored() {
        Map<String, LearnedMapping> batch = new LinkedHashMap<>();
        batch.put("Соль", mapping("Соль", "", "Соль", ""));
        batch.put("Сахар", mapping("Сахар", null, "Сахар", ""));

        store.save(batch);

        assertThat(Files.exists(file)).isFalse();
        assertThat(store.get("Соль")).isEmpty();
    }

    @Test
    void removeDeletesOnlyTheGivenLine() {
        store.save(Map.of("Молоко", mapping("Молоко", "p-1", "Молоко", ""),
                "Кефир", mapping("Кефир", "p-2", "Кефир", "")));

        store.remove("Молоко");
        store.remove("Неизвестно");

        assertThat(store.get("Молоко")).isEmpty();
        assertThat(store.get("Кефир")).isPresent();
    }

    @Test
    void corruptFileReadsAsEmptyAndIsBackedUpBeforeSave() throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{not json", StandardCharsets.UTF_8);

        assertThat(store.get("Молоко")).isEmpty();
        assertThat(Files.exists(store.backupFile())).isFalse();

        store.save(Map.of("Молоко", mapping("Молоко", "p-1", "Молоко", "")));

        assertThat(store.get("Молоко")).isPresent();
        assertThat(store.backupFile()).hasFileName("product-mappings.json.bak");
        assertThat(Files.readString(store.backupFile(), StandardCharsets.UTF_8)).isEqualTo("{not json");
    }

    @Test
    void concurrentSavesKeepEveryEntry() throws Exception {
        int writers = 8;
        int savesPerWriter = 10;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int writer = 0; writer < writers; writer++) {
                int writerId = writer;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < savesPerWriter; i++) {
                        String line = "Товар " + writerId + "-" + i;
                        store.save(Map.of(line, mapping(line, "p-" + writerId + "-" + i, line, "")));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        for (int writer = 0; writer < writers; writer++) {
            for (int i = 0; i < savesPerWriter; i++) {
                assertThat(store.get("Товар " + writer + "-" + i))
                        .map(LearnedMapping::id)
                        .contains("p-" + writer + "-" + i);
            }
        }
        Map<?, ?> persisted = new ObjectMapper().readValue(file.toFile(), Map.class);
        assertThat(persisted).hasSize(writers * savesPerWriter);
    }

    @Test
    void readsCodeStoredUnderLegacyFieldName() throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{\"Сыр\": {\"id\": \"p-7\", \"name\": \"Сыр\", \"productCode\": \"123\", \"extra\": 1}}",
                StandardCharsets.UTF_8);

        assertThat(store.get("Сыр")).map(LearnedMapping::code).contains("123");
    }

    private static LearnedMapping mapping(String key, String id, String name, String code) {
        return new LearnedMapping(key, id, name, code);
    }
}
