package com.di.useeio.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Writes store-operation events as one JSON line each ({@code [EVT] {...}}).
 *
 * <p>Each event carries the event type, an ISO-8601 timestamp, the application instance id,
 * the run id taken from MDC, the thread, and the caller's context map.
 */
@Slf4j
@Component
public class StoreEventLogger {

    private static final int STACK_TRACE_LINES = 5;

    private final ObjectMapper mapper = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private final String applicationId;

    public StoreEventLogger(@Value("${spring.application.name:useeio-store}") String applicationName) {
        this.applicationId = applicationName + "-" + UUID.randomUUID().toString().substring(0, 8);
        log.info("[EVT] StoreEventLogger initialized with applicationId: {}", applicationId);
    }

    public String getApplicationId() {
        return applicationId;
    }

    public void logEvent(String eventType, Map<String, Object> context, String runId) {
        logEvent(eventType, context, runId, null);
    }

    /**
     * Logs one event; failures add a short stack trace summary and are logged at WARN.
     *
     * @return the JSON line that was logged
     */
    public String logEvent(String eventType, Map<String, Object> context, String runId, Throwable exception) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("eventType", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("applicationId", applicationId);
        event.put("runId", runId != null ? runId : "unknown");
        event.put("threadName", Thread.currentThread().getName());

        Map<String, Object> ctx = context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>();
        if (exception != null) {
            ctx.put("stackTraceSummary", stackTraceSummary(exception, STACK_TRACE_LINES));
        }
        if (!ctx.isEmpty()) {
            event.put("context", ctx);
        }

        String json = toJson(event);
        if (exception != null) {
            log.warn("[EVT] {}", json);
        } else {
            log.info("[EVT] {}", json);
        }
        return json;
    }

    private String toJson(Map<String, Object> event) {
        try {
            return mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            // Context values that Jackson cannot write are logged by their string form.
            Map<String, Object> flat = new LinkedHashMap<>();
            event.forEach((k, v) -> flat.put(k, v instanceof String || v instanceof Number ? v : String.valueOf(v)));
            try {
                return mapper.writeValueAsString(flat);
            } catch (JsonProcessingException again) {
                return flat.toString();
            }
        }
    }

    static String stackTraceSummary(Throwable exception, int maxLines) {
        StringWriter sw = new StringWriter();
        exception.printStackTrace(new PrintWriter(sw));
        String[] lines = sw.toString().split("\n");
        int count = Math.min(maxLines, lines.length);
        StringBuilder summary = new StringBuilder();
        for (int i = 0; i < count; i++) {
            if (i > 0) summary.append(" | ");
            summary.append(lines[i].trim());
        }
        if (lines.length > maxLines) {
            summary.append(" | ... (").append(lines.length - maxLines).append(" more lines)");
        }
        return summary.toString();
    }
}
