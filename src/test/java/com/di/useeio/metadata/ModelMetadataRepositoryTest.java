package com.di.useeio.metadata;

import com.di.useeio.support.PostgresIntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
@DisplayName("ModelMetadataRepository Tests")
class ModelMetadataRepositoryTest extends PostgresIntegrationTestSupport {

    private ModelMetadataRepository repository;

    @BeforeEach
    void setUp() {
        repository = new ModelMetadataRepository(jdbc, sql);
    }

    private static ModelMetadata version(String name, Integer economic, Boolean active) {
        return ModelMetadata.builder()
            .modelVersion(name)
            .economicYear(economic)
            .satelliteYearMin(2015)
            .satelliteYearMax(2020)
            .isActive(active)
            .build();
    }

    @Test
    @DisplayName("Should default the flag and both timestamps on insert")
    void testInsert_Defaults() {
        repository.insert(ModelMetadata.builder().modelVersion("v2.0").build());

        ModelMetadata row = repository.findByVersion("v2.0").orElseThrow();
        assertFalse(row.getIsActive());
        assertNotNull(row.getCreatedAt());
        assertNotNull(row.getUpdatedAt());
        assertNull(row.getEconomicYear());
        assertNull(row.getSatelliteYearMin());
    }

    @Test
    @DisplayName("Should reject a second row for the same version")
    void testInsert_Duplicate() {
        repository.insert(version("v2.1", 2018, true));

        assertThrows(DuplicateKeyException.class, () -> repository.insert(version("v2.1", 2019, false)));
    }

    @Test
    @DisplayName("Should move updated_at forward on update, whatever the caller sent")
    void testUpdate_TriggerSetsUpdatedAt() {
        repository.insert(version("v2.1", 2018, false));
        ModelMetadata before = repository.findByVersion("v2.1").orElseThrow();

        // an explicit stale timestamp is overridden by the trigger
        jdbc.update("UPDATE model_metadata SET updated_at = '2000-01-01T00:00:00Z' WHERE model_version = 'v2.1'");
        ModelMetadata afterRaw = repository.findByVersion("v2.1").orElseThrow();
        assertTrue(afterRaw.getUpdatedAt().isAfter(Instant.parse("2000-01-02T00:00:00Z")));

        ModelMetadata changed = version("v2.1", 2019, true);
        assertEquals(1, repository.update(changed));
        ModelMetadata after = repository.findByVersion("v2.1").orElseThrow();

        assertEquals(2019, after.getEconomicYear());
        assertTrue(after.getIsActive());
        assertEquals(before.getCreatedAt(), after.getCreatedAt());
        assertFalse(after.getUpdatedAt().isBefore(before.getUpdatedAt()));
    }

    @Test
    @DisplayName("Should report zero rows when updating an unknown version")
    void testUpdate_Unknown() {
        assertEquals(0, repository.update(version("v9", 2018, true)));
        assertEquals(0, repository.setActive("v9", true));
    }

    @Test
    @DisplayName("Should insert or overwrite on upsert")
    void testUpsert() {
        repository.upsert(version("v2.1", 2018, false));
        repository.upsert(version("v2.1", 2019, true));

        List<ModelMetadata> all = repository.findAll();
        assertEquals(1, all.size());
        assertEquals(2019, all.get(0).getEconomicYear());
        assertTrue(all.get(0).getIsActive());
    }

    @Test
    @DisplayName("Should allow several active rows and list them newest first")
    void testFindActive_Several() {
        repository.insert(version("v2.0", 2017, true));
        repository.insert(version("v2.1", 2018, true));
        repository.insert(version("v1.0", 2012, false));
        repository.setActive("v2.0", true);

        List<String> active = repository.findActive().stream()
            .map(ModelMetadata::getModelVersion)
            .collect(Collectors.toList());

        assertEquals(List.of("v2.0", "v2.1"), active);
    }

    @Test
    @DisplayName("Should deactivate every other version")
    void testDeactivateAllExcept() {
        repository.insert(version("v2.0", 2017, true));
        repository.insert(version("v2.1", 2018, true));

        assertEquals(1, repository.deactivateAllExcept("v2.1"));
        assertFalse(repository.findByVersion("v2.0").orElseThrow().getIsActive());
        assertTrue(repository.findByVersion("v2.1").orElseThrow().getIsActive());
    }

    @Test
    @DisplayName("Should delete by version")
    void testDelete() {
        repository.insert(version("v2.1", 2018, true));

        assertEquals(1, repository.deleteByVersion("v2.1"));
        assertTrue(repository.findByVersion("v2.1").isEmpty());
        assertEquals(0, repository.deleteByVersion("v2.1"));
    }
}
