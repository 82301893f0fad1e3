package com.di.useeio.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a store operation for event logging by {@link StoreOperationAspect}.
 *
 * <p>The aspect emits {@code <eventType>_STARTED}, {@code <eventType>_COMPLETED} and
 * {@code <eventType>_FAILED} events carrying the named parameters, the duration and,
 * on failure, the {@link ErrorCategory}.
 *
 * <pre>
 * {@code
 * @LogStoreOperation(eventType = "MODEL_VERSION_PURGE", parameterNames = {"modelVersion"})
 * public PurgeResult purge(String modelVersion) { ... }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface LogStoreOperation {

    /** Event type prefix, e.g. "GWP_REFERENCE_REFRESH". */
    String eventType();

    /**
     * Names for the leading method arguments to copy into the event context.
     * Empty means every argument, named by reflection.
     */
    String[] parameterNames() default {};

    /** Adds the result's type (and size, for collections) to the completed event. */
    boolean includeResult() default false;
}
