package io.causelog.config;

import io.causelog.model.MissingParentPolicy;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StoreSettingsTest {
    @Test
    void missingFileYieldsDefaults() throws Exception {
        Path root = Files.createTempDirectory("causelog-test-settings-default-");
        try {
            CauseLogConfig config = CauseLogConfig.fromRoot(root.toString());
            StoreSettings settings = config.settings();
            assertTrue(settings.walEnabled());
            assertTrue(settings.cache().enabled());
            assertEquals(1000, settings.cache().maxSize());
            assertEquals(300_000L, settings.cache().ttlMs());
            assertEquals(StoreSettings.Indexes.defaults(), settings.indexes());
            assertEquals(MissingParentPolicy.NEW_CORRELATION, settings.missingParentPolicy());
            assertFalse(settings.allowReset());
            assertEquals(1000, settings.pageSize());
            assertEquals(root.toAbsolutePath().normalize().resolve("causelog.db"), config.dbFile());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void partialFileOverridesOnlyTheFieldsItNames() throws Exception {
        Path root = Files.createTempDirectory("causelog-test-settings-partial-");
        try {
            Files.writeString(CauseLogConfig.fromRoot(root.toString()).settingsFile(), """
                    {
                      "walEnabled": false,
                      "cache": {"maxSize": 50},
                      "indexes": {"command": true, "causationId": false},
                      "missingParentPolicy": "reject",
                      "pageSize": 250,
                      "somethingNew": 1
                    }
                    """, StandardCharsets.UTF_8);

            StoreSettings settings = CauseLogConfig.fromRoot(root.toString()).settings();

            assertFalse(settings.walEnabled());
            assertTrue(settings.cache().enabled());
            assertEquals(50, settings.cache().maxSize());
            assertEquals(300_000L, settings.cache().ttlMs());
            assertTrue(settings.indexes().correlationId());
            assertFalse(settings.indexes().causationId());
            assertTrue(settings.indexes().command());
            assertEquals(MissingParentPolicy.REJECT, settings.missingParentPolicy());
            assertEquals(250, settings.pageSize());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void policyNamesAreLenient() {
        assertEquals(MissingParentPolicy.NEW_CORRELATION, MissingParentPolicy.fromString("new-correlation"));
        assertEquals(MissingParentPolicy.NEW_CORRELATION, MissingParentPolicy.fromString(""));
        assertEquals(MissingParentPolicy.REJECT, MissingParentPolicy.fromString(" REJECT "));
        assertThrows(IllegalArgumentException.class, () -> MissingParentPolicy.fromString("ignore"));
    }

    @Test
    void invalidCacheBoundsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new StoreSettings.Cache(true, 0, 10L));
        assertThrows(IllegalArgumentException.class, () -> new StoreSettings.Cache(true, 10, -1L));
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
