package com.proxyhub.common.trace;

import org.slf4j.MDC;

/**
 * Scopes the {@code configId} MDC key around a unit of work.
 *
 * <p>Background refresh workers run on pooled threads, so the key is removed again
 * in a {@code finally} block; it must never leak into the next task on that thread.
 */
public final class MdcBridge {

    public static final String CONFIG_ID_KEY = "configId";

    private MdcBridge() {}

    /**
     * Runs {@code action} with {@code configId} present in the MDC, restoring the
     * previous value (if any) afterwards.
     *
     * @param configId  the configuration being worked on
     * @param action    the work to execute
     */
    public static void withConfigId(long configId, Runnable action) {
        String previous = MDC.get(CONFIG_ID_KEY);
        MDC.put(CONFIG_ID_KEY, Long.toString(configId));
        try {
            action.run();
        } finally {
            if (previous == null) {
                MDC.remove(CONFIG_ID_KEY);
            } else {
                MDC.put(CONFIG_ID_KEY, previous);
            }
        }
    }
}
