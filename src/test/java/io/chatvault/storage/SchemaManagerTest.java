package io.chatvault.storage;

import io.chatvault.TestDirs;
import io.chatvault.model.Tier;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;

final class SchemaManagerTest {

    @Test
    void freshSchemaIsTaggedWithItsTier() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-schema-");
        try (Connection conn = StorageFixtures.schemaDatabase(root.resolve("t.db"), Tier.SECURE)) {
            Assertions.assertEquals("secure", SchemaManager.readMeta(conn, "db_mode").orElseThrow());
            Assertions.assertEquals(SchemaManager.SCHEMA_VERSION, SchemaManager.readMeta(conn, "schema_version").orElseThrow());
            Assertions.assertTrue(SchemaManager.readMeta(conn, "created_at_ms").isPresent());
            Assertions.assertTrue(SchemaManager.readMeta(conn, "updated_at_ms").isPresent());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void reapplyingKeepsTheOriginalTier() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-schema-reapply-");
        try (Connection conn = StorageFixtures.schemaDatabase(root.resolve("t.db"), Tier.OPEN)) {
            SchemaManager.apply(conn, Tier.STRICT);

            Assertions.assertEquals("open", SchemaManager.readMeta(conn, "db_mode").orElseThrow());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void strictTriggersRejectPlaintextContent() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-schema-strict-");
        try (Connection conn = StorageFixtures.schemaDatabase(root.resolve("t.db"), Tier.STRICT)) {
            seedConversation(conn);

            SQLException insert = Assertions.assertThrows(SQLException.class, () -> StorageFixtures.exec(conn,
                    "INSERT INTO message(conversation_id, sender_type, content, created_at_ms) VALUES (1, 'user', 'hi', 1)"));
            Assertions.assertTrue(insert.getMessage().contains(SchemaManager.STRICT_REJECTION));
            Assertions.assertThrows(SQLException.class, () -> StorageFixtures.exec(conn,
                    "INSERT INTO persistent_memory(scope, content, created_at_ms) VALUES ('global', 'note', 1)"));

            StorageFixtures.exec(conn, """
                    INSERT INTO message(conversation_id, sender_type, content_ct, content_nonce, content_key_id, created_at_ms)
                    VALUES (1, 'user', x'00', x'000000000000000000000000', 1, 1)
                    """);
            Assertions.assertThrows(SQLException.class,
                    () -> StorageFixtures.exec(conn, "UPDATE message SET content='leak' WHERE id=1"));
            Assertions.assertEquals(1, StorageFixtures.count(conn, "SELECT COUNT(*) FROM message WHERE content IS NULL"));
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void openTierAcceptsPlaintextContent() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-schema-open-");
        try (Connection conn = StorageFixtures.schemaDatabase(root.resolve("t.db"), Tier.OPEN)) {
            seedConversation(conn);

            StorageFixtures.exec(conn,
                    "INSERT INTO message(conversation_id, sender_type, content, created_at_ms) VALUES (1, 'user', 'hi', 1)");

            Assertions.assertEquals(1, StorageFixtures.count(conn, "SELECT COUNT(*) FROM message"));
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    private static void seedConversation(Connection conn) throws SQLException {
        StorageFixtures.exec(conn,
                "INSERT INTO user_profile(id, name, handle, created_at_ms, updated_at_ms) VALUES (1, 'u', 'u', 1, 1)");
        StorageFixtures.exec(conn,
                "INSERT INTO saved_conversation(id, user_id, title, created_at_ms, updated_at_ms) VALUES (1, 1, 't', 1, 1)");
    }
}
