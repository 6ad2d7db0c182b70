package com.proxyhub.common.trace;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class MdcBridgeTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void keyIsVisibleInsideAndRemovedAfter() {
        AtomicReference<String> seen = new AtomicReference<>();

        MdcBridge.withConfigId(42L, () -> seen.set(MDC.get(MdcBridge.CONFIG_ID_KEY)));

        assertEquals("42", seen.get());
        assertNull(MDC.get(MdcBridge.CONFIG_ID_KEY));
    }

    @Test
    void previousValueIsRestoredEvenOnFailure() {
        MDC.put(MdcBridge.CONFIG_ID_KEY, "7");

        assertThrows(IllegalStateException.class, () ->
            MdcBridge.withConfigId(8L, () -> {
                throw new IllegalStateException("boom");
            }));

        assertEquals("7", MDC.get(MdcBridge.CONFIG_ID_KEY));
    }
}
