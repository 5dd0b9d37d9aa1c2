package com.di.enrichment.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Carries SLF4J MDC ({@code taskId}, {@code entityId}, {@code entityKind}) from the submitting
 * thread into fetch workers and async dispatch, so their log lines stay correlated with the run.
 */
public final class MdcPropagation {

    public static final String TASK_ID = "taskId";
    public static final String ENTITY_ID = "entityId";
    public static final String ENTITY_KIND = "entityKind";

    private MdcPropagation() {
    }

    /**
     * Captures the current MDC now and returns a Runnable that restores it around {@code task}.
     */
    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                task.run();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Supplier counterpart of {@link #wrapRunnable(Runnable)}, for {@code CompletableFuture.supplyAsync}.
     */
    public static <T> Supplier<T> wrapSupplier(Supplier<T> task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                return task.get();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Executor that wraps every command with the submitter's MDC.
     */
    public static Executor wrapExecutor(Executor delegate) {
        return command -> delegate.execute(wrapRunnable(command));
    }

    /**
     * Copy of the current MDC; never null.
     */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    private static void setMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.forEach(MDC::put);
        }
    }

    private static void clearMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.keySet().forEach(MDC::remove);
        }
    }
}
