package com.di.useeio.aspect;

import com.di.useeio.util.StoreEventLogger;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.sql.SQLException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Logs STARTED / COMPLETED / FAILED events around methods annotated with {@link LogStoreOperation}.
 * The run id comes from MDC key {@value #RUN_ID_KEY}. Exceptions are re-thrown unchanged.
 */
@Slf4j
@Aspect
@Component
public class StoreOperationAspect {

    public static final String RUN_ID_KEY = "runId";

    private final StoreEventLogger eventLogger;

    public StoreOperationAspect(StoreEventLogger eventLogger) {
        this.eventLogger = eventLogger;
    }

    @Around("@annotation(com.di.useeio.aspect.LogStoreOperation)")
    public Object logOperation(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        LogStoreOperation annotation = method.getAnnotation(LogStoreOperation.class);
        if (annotation == null) {
            return joinPoint.proceed();
        }

        String eventType = annotation.eventType();
        String runId = MDC.get(RUN_ID_KEY);
        long startTime = System.currentTimeMillis();
        Map<String, Object> context = extractContext(joinPoint.getArgs(), method, annotation);

        eventLogger.logEvent(eventType + "_STARTED", context, runId);
        try {
            Object result = joinPoint.proceed();
            context.put("durationMs", System.currentTimeMillis() - startTime);
            if (annotation.includeResult() && result != null) {
                context.put("resultType", result.getClass().getSimpleName());
                if (result instanceof Collection) {
                    context.put("resultSize", ((Collection<?>) result).size());
                }
            }
            eventLogger.logEvent(eventType + "_COMPLETED", context, runId);
            return result;
        } catch (Throwable e) {
            ErrorCategory category = ErrorCategory.categorize(e);
            context.put("durationMs", System.currentTimeMillis() - startTime);
            context.put("errorMessage", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            context.put("errorType", e.getClass().getSimpleName());
            context.put("errorCategory", category.name());
            context.put("errorCategoryDescription", category.getDescription());
            Throwable rootCause = rootCause(e);
            if (rootCause != e) {
                context.put("rootCauseType", rootCause.getClass().getSimpleName());
                context.put("rootCauseMessage", rootCause.getMessage());
                if (rootCause instanceof SQLException) {
                    context.put("sqlState", ((SQLException) rootCause).getSQLState());
                }
            }
            eventLogger.logEvent(eventType + "_FAILED", context, runId, e);
            throw e;
        }
    }

    private Map<String, Object> extractContext(Object[] args, Method method, LogStoreOperation annotation) {
        Map<String, Object> context = new LinkedHashMap<>();
        String[] names = annotation.parameterNames();
        if (names.length > 0) {
            for (int i = 0; i < Math.min(names.length, args.length); i++) {
                if (names[i] != null && !names[i].isEmpty()) {
                    context.put(names[i], summarize(args[i]));
                }
            }
        } else {
            Parameter[] parameters = method.getParameters();
            for (int i = 0; i < parameters.length && i < args.length; i++) {
                context.put(parameters[i].getName(), summarize(args[i]));
            }
        }
        context.put("method", method.getName());
        context.put("className", method.getDeclaringClass().getSimpleName());
        return context;
    }

    /** Collections are logged by size; everything else by value. */
    private static Object summarize(Object value) {
        if (value instanceof Collection) {
            return "size=" + ((Collection<?>) value).size();
        }
        return value;
    }

    private static Throwable rootCause(Throwable exception) {
        Throwable current = exception;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }
}
