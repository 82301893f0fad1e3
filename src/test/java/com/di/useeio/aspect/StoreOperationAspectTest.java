package com.di.useeio.aspect;

import com.di.useeio.util.StoreEventLogger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;
import org.springframework.dao.DuplicateKeyException;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StoreOperationAspect Tests")
class StoreOperationAspectTest {

    /** Keeps every event instead of only logging it. */
    static class RecordingEventLogger extends StoreEventLogger {
        final List<String> types = new ArrayList<>();
        final List<Map<String, Object>> contexts = new ArrayList<>();
        final List<String> runIds = new ArrayList<>();

        RecordingEventLogger() {
            super("useeio-store-test");
        }

        @Override
        public String logEvent(String eventType, Map<String, Object> context, String runId, Throwable exception) {
            types.add(eventType);
            contexts.add(new LinkedHashMap<>(context));
            runIds.add(runId);
            return super.logEvent(eventType, context, runId, exception);
        }
    }

    static class SampleStore {
        @LogStoreOperation(eventType = "SAMPLE_PURGE", parameterNames = {"modelVersion"})
        public int purge(String modelVersion) {
            return 3;
        }

        @LogStoreOperation(eventType = "SAMPLE_LIST", includeResult = true)
        public List<String> list(List<String> versions) {
            return versions;
        }

        @LogStoreOperation(eventType = "SAMPLE_INSERT")
        public void insert(String modelVersion) {
            throw new DuplicateKeyException("duplicate key", new SQLException("duplicate key", "23505"));
        }

        public String plain() {
            return "plain";
        }
    }

    private RecordingEventLogger events;
    private SampleStore store;

    @BeforeEach
    void setUp() {
        events = new RecordingEventLogger();
        AspectJProxyFactory factory = new AspectJProxyFactory(new SampleStore());
        factory.setProxyTargetClass(true);
        factory.addAspect(new StoreOperationAspect(events));
        store = factory.getProxy();
    }

    @AfterEach
    void clearMdc() {
        MDC.remove(StoreOperationAspect.RUN_ID_KEY);
    }

    @Test
    @DisplayName("Should emit STARTED and COMPLETED with the named parameters")
    void testCompletedEvent() {
        MDC.put(StoreOperationAspect.RUN_ID_KEY, "run-42");

        assertEquals(3, store.purge("v2.1"));

        assertEquals(List.of("SAMPLE_PURGE_STARTED", "SAMPLE_PURGE_COMPLETED"), events.types);
        assertEquals("v2.1", events.contexts.get(0).get("modelVersion"));
        assertEquals("purge", events.contexts.get(0).get("method"));
        assertTrue(events.contexts.get(1).containsKey("durationMs"));
        assertEquals(List.of("run-42", "run-42"), events.runIds);
    }

    @Test
    @DisplayName("Should summarize collection arguments and results by size")
    void testCollectionSummary() {
        store.list(List.of("v1", "v2"));

        assertEquals("size=2", events.contexts.get(0).get("versions"));
        Map<String, Object> completed = events.contexts.get(1);
        assertEquals(2, completed.get("resultSize"));
    }

    @Test
    @DisplayName("Should emit FAILED with the error category and rethrow the original exception")
    void testFailedEvent() {
        DuplicateKeyException thrown = assertThrows(DuplicateKeyException.class, () -> store.insert("v2.1"));

        assertEquals("duplicate key", thrown.getMessage());
        assertEquals(List.of("SAMPLE_INSERT_STARTED", "SAMPLE_INSERT_FAILED"), events.types);
        Map<String, Object> failed = events.contexts.get(1);
        assertEquals("CONSTRAINT_VIOLATION", failed.get("errorCategory"));
        assertEquals("DuplicateKeyException", failed.get("errorType"));
        assertEquals("23505", failed.get("sqlState"));
    }

    @Test
    @DisplayName("Should leave methods without the annotation alone")
    void testUnannotatedMethod() {
        assertEquals("plain", store.plain());
        assertTrue(events.types.isEmpty());
    }
}
