package com.di.useeio.gwp;

import com.di.useeio.support.PostgresIntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
@DisplayName("GwpReferenceRepository Tests")
class GwpReferenceRepositoryTest extends PostgresIntegrationTestSupport {

    private GwpReferenceRepository repository;

    @BeforeEach
    void setUp() {
        repository = new GwpReferenceRepository(jdbc, sql);
    }

    private static GwpReference row(String gas, String ar, String value, String display) {
        return GwpReference.builder()
            .gasName(gas)
            .arVersion(ar)
            .gwpValue(value != null ? new BigDecimal(value) : null)
            .gwpDisplay(display)
            .category("Major GHG")
            .build();
    }

    @Test
    @DisplayName("Should store and read back a reference row")
    void testInsertAndFind() {
        repository.insert(row("Methane (non-fossil)", "AR5", "28", null));

        GwpReference found = repository.findByKey("Methane (non-fossil)", "AR5").orElseThrow();
        assertEquals(0, new BigDecimal("28").compareTo(found.getGwpValue()));
        assertNull(found.getGwpDisplay());
        assertEquals("Major GHG", found.getCategory());
    }

    @Test
    @DisplayName("Should reject a duplicate (gas, AR) pair")
    void testInsert_Duplicate() {
        repository.insert(row("Nitrous oxide", "AR5", "265", null));

        assertThrows(DuplicateKeyException.class, () -> repository.insert(row("Nitrous oxide", "AR5", "298", null)));
    }

    @Test
    @DisplayName("Should accept the same gas under another AR version")
    void testInsert_SameGasOtherAr() {
        repository.insert(row("Nitrous oxide", "AR5", "265", null));
        repository.insert(row("Nitrous oxide", "AR6", "273", null));

        assertEquals(2, repository.findByGasName("Nitrous oxide").size());
        assertEquals(1, repository.findByArVersion("AR6").size());
    }

    @Test
    @DisplayName("Should store a bound with a null value and a display text")
    void testInsert_NullValueWithDisplay() {
        repository.insert(row("HFO-1132a", "AR5", null, "<1"));

        GwpReference found = repository.findByKey("HFO-1132a", "AR5").orElseThrow();
        assertNull(found.getGwpValue());
        assertEquals("<1", found.displayValue());
    }

    @Test
    @DisplayName("Should reject a missing AR version")
    void testInsert_NullKey() {
        assertThrows(DataIntegrityViolationException.class, () -> repository.insert(row("Methane", null, "28", null)));
    }

    @Test
    @DisplayName("Should overwrite value, display and category on upsert")
    void testUpsertAll() {
        repository.insert(row("PFC-c216", "AR4", "1", null));

        int sent = repository.upsertAll(List.of(
            GwpReference.builder().gasName("PFC-c216").arVersion("AR4")
                .gwpValue(new BigDecimal("17340")).gwpDisplay(">17,340").category("Fully Fluorinated Species").build(),
            row("PFC-c216", "AR5", "9200", null)));

        assertEquals(2, sent);
        GwpReference ar4 = repository.findByKey("PFC-c216", "AR4").orElseThrow();
        assertEquals(">17,340", ar4.getGwpDisplay());
        assertEquals("Fully Fluorinated Species", ar4.getCategory());
        assertEquals(2, repository.findAll().size());
    }

    @Test
    @DisplayName("Should delete by key, by gas and by suffix")
    void testDeletes() {
        repository.upsertAll(List.of(
            row("HFC-134 a", "AR4", "1300", null),
            row("HFC-134a", "AR4", "1430", null),
            row("Methane – fossil", "AR5", "30", null),
            row("Methane – fossil", "AR6", "29.8", null),
            row("Carbon dioxide", "AR5", "1", null)));

        assertEquals(1, repository.deleteByGasNameSuffix(" a"));
        assertTrue(repository.findByKey("HFC-134a", "AR4").isPresent());
        assertEquals(2, repository.deleteByGasName("Methane – fossil"));
        assertEquals(1, repository.delete("Carbon dioxide", "AR5"));
        assertEquals(0, repository.delete("Carbon dioxide", "AR5"));
        assertEquals(1, repository.findAll().size());
    }
}
