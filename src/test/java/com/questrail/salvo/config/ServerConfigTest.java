package com.questrail.salvo.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class ServerConfigTest {

    @Test
    void builderOverridesDefaults() {
        ServerConfig c = ServerConfig.builder()
                .withPort(0)
                .withLegacyPort(0)
                .withHeartbeatInterval(Duration.ZERO)
                .build();

        assertEquals(0, c.port());
        assertTrue(c.legacyEnabled());
        assertEquals(ServerConfig.DEFAULT_MAX_LINE_LENGTH, c.maxLineLength());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.builder().withPort(70000).build());
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.builder().withPort(-1).build());
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.builder().withLegacyPort(5000).build());
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.builder().withMaxLineLength(0).build());
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.builder().withMaxPendingWrites(0).build());
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.builder().withWorkerThreads(-2).build());
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.builder()
                .withHeartbeatInterval(Duration.ofSeconds(10))
                .withLivenessTimeout(Duration.ofSeconds(5))
                .build());
    }

    @Test
    void anyNegativeLegacyPortDisablesTheRoom() {
        assertFalse(ServerConfig.builder().withLegacyPort(-5).build().legacyEnabled());
    }
}
