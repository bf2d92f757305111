package io.chatvault.storage;

import io.chatvault.TestDirs;
import io.chatvault.config.EnvironmentOverrides;
import io.chatvault.model.Tier;
import io.chatvault.security.InMemorySecretStore;
import io.chatvault.security.KeyKind;
import io.chatvault.security.KeyManager;
import io.chatvault.security.KeyUnavailableException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;
import java.util.Optional;

final class ConnectionOpenerTest {
    private static final String HEX_A = "00112233445566778899aabbccddeeff00112233445566778899aabbccddeeff";
    private static final String HEX_B = "ffeeddccbbaa99887766554433221100ffeeddccbbaa99887766554433221100";

    @Test
    void openFileOpensWithoutAnyKey() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-opener-open-");
        try {
            Path file = root.resolve("chatvault.db");
            StorageFixtures.schemaDatabase(file, Tier.OPEN).close();
            InMemorySecretStore store = new InMemorySecretStore();
            KeyManager keys = new KeyManager(Optional.of(store), EnvironmentOverrides.none());

            try (StoreConnection conn = new ConnectionOpener(EngineCapability.PLAINTEXT_ONLY, keys).open(file)) {
                Assertions.assertEquals(Tier.OPEN, conn.tier());
                Assertions.assertEquals("wal", SqliteEngine.pragmaValue(conn.connection(), "journal_mode").orElseThrow());
                Assertions.assertEquals("1", SqliteEngine.pragmaValue(conn.connection(), "foreign_keys").orElseThrow());
            }
            Assertions.assertEquals(0, store.writes());
            Assertions.assertTrue(store.get(KeyKind.DATABASE.account()).isEmpty());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void plaintextFileClaimingStrictIsAnEngineMismatch() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-opener-mismatch-");
        try {
            Path file = root.resolve("chatvault.db");
            StorageFixtures.schemaDatabase(file, Tier.STRICT).close();
            KeyManager keys = new KeyManager(Optional.empty(), EnvironmentOverrides.none());

            IntegrityException e = Assertions.assertThrows(IntegrityException.class,
                    () -> new ConnectionOpener(EngineCapability.PLAINTEXT_AND_ENCRYPTED, keys).open(file));

            Assertions.assertEquals(IntegrityException.Reason.ENGINE_MISMATCH, e.reason());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void plaintextFileWithoutMetaIsRejected() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-opener-nometa-");
        try {
            Path file = root.resolve("chatvault.db");
            try (Connection conn = SqliteEngine.openPlain(file)) {
                StorageFixtures.exec(conn, "CREATE TABLE unrelated(id INTEGER PRIMARY KEY)");
            }
            KeyManager keys = new KeyManager(Optional.empty(), EnvironmentOverrides.none());

            IntegrityException e = Assertions.assertThrows(IntegrityException.class,
                    () -> new ConnectionOpener(EngineCapability.PLAINTEXT_ONLY, keys).open(file));

            Assertions.assertEquals(IntegrityException.Reason.META_MISSING, e.reason());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void encryptedLookingFileWithoutKeyFailsWithKeyError() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-opener-nokey-");
        try {
            Path file = root.resolve("chatvault.db");
            StorageFixtures.writeGarbage(file);
            InMemorySecretStore store = new InMemorySecretStore();
            KeyManager keys = new KeyManager(Optional.of(store), EnvironmentOverrides.none());

            KeyUnavailableException e = Assertions.assertThrows(KeyUnavailableException.class,
                    () -> new ConnectionOpener(EngineCapability.PLAINTEXT_AND_ENCRYPTED, keys).open(file));

            Assertions.assertEquals(KeyKind.DATABASE, e.kind());
            Assertions.assertEquals(0, store.writes());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void encryptedFileOpensWithItsKey() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-opener-secure-");
        try {
            Path file = root.resolve("chatvault.db");
            StorageFixtures.encryptedSchemaDatabase(file, Tier.SECURE, StorageFixtures.databaseKey(HEX_A)).close();
            InMemorySecretStore store = new InMemorySecretStore().put(KeyKind.DATABASE.account(), HEX_A);
            KeyManager keys = new KeyManager(Optional.of(store), EnvironmentOverrides.none());

            try (StoreConnection conn = new ConnectionOpener(EngineCapability.detect(), keys).open(file)) {
                Assertions.assertEquals(Tier.SECURE, conn.tier());
                Assertions.assertEquals(SchemaManager.SCHEMA_VERSION,
                        SchemaManager.readMeta(conn.connection(), "schema_version").orElseThrow());
            }
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void encryptedFileWithoutKeyFailsWithKeyError() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-opener-secure-nokey-");
        try {
            Path file = root.resolve("chatvault.db");
            StorageFixtures.encryptedSchemaDatabase(file, Tier.SECURE, StorageFixtures.databaseKey(HEX_A)).close();
            InMemorySecretStore store = new InMemorySecretStore();
            KeyManager keys = new KeyManager(Optional.of(store), EnvironmentOverrides.none());

            KeyUnavailableException e = Assertions.assertThrows(KeyUnavailableException.class,
                    () -> new ConnectionOpener(EngineCapability.detect(), keys).open(file));

            Assertions.assertEquals(KeyKind.DATABASE, e.kind());
            Assertions.assertEquals(0, store.writes());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void encryptedFileWithWrongKeyFailsWithKeyError() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-opener-secure-wrongkey-");
        try {
            Path file = root.resolve("chatvault.db");
            StorageFixtures.encryptedSchemaDatabase(file, Tier.STRICT, StorageFixtures.databaseKey(HEX_A)).close();
            KeyManager keys = new KeyManager(Optional.empty(),
                    EnvironmentOverrides.from(Map.of(KeyKind.DATABASE.envVar(), HEX_B)));

            KeyUnavailableException e = Assertions.assertThrows(KeyUnavailableException.class,
                    () -> new ConnectionOpener(EngineCapability.detect(), keys).open(file));

            Assertions.assertEquals(KeyKind.DATABASE, e.kind());
            Assertions.assertTrue(e.getCause() instanceof SQLException);
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void corruptEncryptedFileFailsIntegrityCheck() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-opener-secure-corrupt-");
        try {
            Path file = root.resolve("chatvault.db");
            try (Connection conn = StorageFixtures.encryptedSchemaDatabase(file, Tier.SECURE,
                    StorageFixtures.databaseKey(HEX_A))) {
                StorageFixtures.breakIndex(conn);
            }
            KeyManager keys = new KeyManager(Optional.empty(),
                    EnvironmentOverrides.from(Map.of(KeyKind.DATABASE.envVar(), HEX_A)));

            IntegrityException e = Assertions.assertThrows(IntegrityException.class,
                    () -> new ConnectionOpener(EngineCapability.detect(), keys).open(file));

            Assertions.assertEquals(IntegrityException.Reason.CHECK_FAILED, e.reason());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void corruptPlaintextFileFailsIntegrityCheck() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-opener-corrupt-");
        try {
            Path file = root.resolve("chatvault.db");
            try (Connection conn = StorageFixtures.schemaDatabase(file, Tier.OPEN)) {
                StorageFixtures.breakIndex(conn);
            }
            KeyManager keys = new KeyManager(Optional.empty(), EnvironmentOverrides.none());

            IntegrityException e = Assertions.assertThrows(IntegrityException.class,
                    () -> new ConnectionOpener(EngineCapability.detect(), keys).open(file));

            Assertions.assertEquals(IntegrityException.Reason.CHECK_FAILED, e.reason());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void nonPlaintextFileWithoutEncryptedEngineIsAConfigurationError() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-opener-noengine-");
        try {
            Path file = root.resolve("chatvault.db");
            StorageFixtures.writeGarbage(file);
            KeyManager keys = new KeyManager(Optional.empty(), EnvironmentOverrides.none());

            Assertions.assertThrows(ConfigurationException.class,
                    () -> new ConnectionOpener(EngineCapability.PLAINTEXT_ONLY, keys).open(file));
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void missingFileIsAConfigurationError() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-opener-missing-");
        try {
            KeyManager keys = new KeyManager(Optional.empty(), EnvironmentOverrides.none());

            Assertions.assertThrows(ConfigurationException.class,
                    () -> new ConnectionOpener(EngineCapability.PLAINTEXT_ONLY, keys).open(root.resolve("none.db")));
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }
}
