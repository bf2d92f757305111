package io.chatvault.config;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.chatvault.TestDirs;
import io.chatvault.model.Tier;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

final class SettingsCacheTest {

    @Test
    void missingFileIsCreatedWithDefaults() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-settings-");
        try {
            SettingsCache cache = new SettingsCache(root.resolve("settings").resolve("app.json"));

            ObjectNode loaded = cache.load();

            Assertions.assertTrue(Files.exists(cache.file()));
            Assertions.assertEquals(SettingsCache.SCHEMA, loaded.path("schema").asInt());
            Assertions.assertTrue(cache.cachedTier().isEmpty());
            Assertions.assertNull(cache.cachedHasAdmin());
            Assertions.assertTrue(cache.signupRequiresApproval());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void partialFileIsForwardFilledWithoutLosingValues() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-settings-fill-");
        try {
            Path file = root.resolve("app.json");
            Files.writeString(file, "{\"auth\":{\"signup_requires_approval\":false},\"custom\":7}", StandardCharsets.UTF_8);
            SettingsCache cache = new SettingsCache(file);

            ObjectNode loaded = cache.load();

            Assertions.assertFalse(cache.signupRequiresApproval());
            Assertions.assertEquals(7, loaded.path("custom").asInt());
            Assertions.assertTrue(loaded.path("auth").has("has_admin"));
            Assertions.assertTrue(loaded.path("security").has("mode"));
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void recordTierOnlyWritesOnChange() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-settings-tier-");
        try {
            SettingsCache cache = new SettingsCache(root.resolve("app.json"));

            Assertions.assertTrue(cache.recordTier(Tier.STRICT));
            Assertions.assertFalse(cache.recordTier(Tier.STRICT));
            Assertions.assertEquals(Tier.STRICT, cache.cachedTier().orElseThrow());
            Assertions.assertTrue(cache.recordTier(Tier.OPEN));
            Assertions.assertEquals(Tier.OPEN, new SettingsCache(cache.file()).cachedTier().orElseThrow());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void adminPresenceIsTriState() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-settings-admin-");
        try {
            SettingsCache cache = new SettingsCache(root.resolve("app.json"));

            Assertions.assertFalse(cache.recordAdminPresence(null));
            Assertions.assertTrue(cache.recordAdminPresence(false));
            Assertions.assertEquals(Boolean.FALSE, cache.cachedHasAdmin());
            Assertions.assertTrue(cache.recordAdminPresence(true));
            Assertions.assertEquals(Boolean.TRUE, cache.cachedHasAdmin());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void unparseableModeIsTreatedAsUnknown() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-settings-mode-");
        try {
            Path file = root.resolve("app.json");
            Files.writeString(file, "{\"security\":{\"mode\":42}}", StandardCharsets.UTF_8);

            Assertions.assertTrue(new SettingsCache(file).cachedTier().isEmpty());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void environmentOverridesIgnoreInvalidTier() {
        Assertions.assertTrue(EnvironmentOverrides.from(Map.of(EnvironmentOverrides.DB_MODE, "paranoid")).tier().isEmpty());
        Assertions.assertEquals(Tier.SECURE,
                EnvironmentOverrides.from(Map.of(EnvironmentOverrides.DB_MODE, " Secure ")).tier().orElseThrow());
    }

    @Test
    void configResolvesRootFromEnvironmentWhenNotExplicit() {
        EnvironmentOverrides env = EnvironmentOverrides.from(Map.of(EnvironmentOverrides.DATA_DIR, "/tmp/cv-env-root"));

        Assertions.assertEquals(Path.of("/tmp/cv-env-root"), ChatVaultConfig.resolve(null, env).rootDir());
        Assertions.assertEquals(Path.of("/tmp/cv-explicit").resolve("chatvault.db"),
                ChatVaultConfig.resolve("/tmp/cv-explicit", env).dbFile());
    }
}
