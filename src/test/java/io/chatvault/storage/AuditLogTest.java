package io.chatvault.storage;

import io.chatvault.TestDirs;
import io.chatvault.model.Tier;
import io.chatvault.storage.AuditLog.AuditEvent;
import io.chatvault.storage.AuditLog.ChainVerification;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.Map;

final class AuditLogTest {

    @Test
    void emptyChainIsValid() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-audit-empty-");
        try (Connection conn = StorageFixtures.schemaDatabase(root.resolve("t.db"), Tier.OPEN)) {
            ChainVerification result = AuditLog.verify(conn);
            Assertions.assertTrue(result.valid());
            Assertions.assertEquals(0, result.checkedRows());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void appendedRowsLinkToTheirPredecessor() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-audit-chain-");
        try (Connection conn = StorageFixtures.schemaDatabase(root.resolve("t.db"), Tier.OPEN)) {
            AuditLog.append(conn, AuditEvent.of(null, "user.create", "user:1"));
            AuditLog.append(conn, new AuditEvent(1L, "user.role", "user:2", Map.of("from", "user", "to", "admin")));
            AuditLog.append(conn, AuditEvent.of(1L, "user.delete", "user:2"));

            try (Statement st = conn.createStatement();
                 ResultSet rs = st.executeQuery("SELECT prev_hash, hash FROM audit_log ORDER BY id")) {
                String previous = "";
                while (rs.next()) {
                    Assertions.assertEquals(previous, rs.getString("prev_hash"));
                    Assertions.assertEquals(64, rs.getString("hash").length());
                    previous = rs.getString("hash");
                }
            }
            ChainVerification result = AuditLog.verify(conn);
            Assertions.assertTrue(result.valid());
            Assertions.assertEquals(3, result.checkedRows());
            Assertions.assertNull(result.brokenAtId());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void editedRowBreaksTheChain() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-audit-tamper-");
        try (Connection conn = StorageFixtures.schemaDatabase(root.resolve("t.db"), Tier.OPEN)) {
            AuditLog.append(conn, AuditEvent.of(null, "user.create", "user:1"));
            AuditLog.append(conn, AuditEvent.of(null, "user.create", "user:2"));
            AuditLog.append(conn, AuditEvent.of(null, "user.create", "user:3"));

            StorageFixtures.exec(conn, "UPDATE audit_log SET subject='user:99' WHERE id=2");

            ChainVerification result = AuditLog.verify(conn);
            Assertions.assertFalse(result.valid());
            Assertions.assertEquals(2L, result.brokenAtId());
            Assertions.assertEquals(1, result.checkedRows());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void deletedRowBreaksTheChain() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-audit-delete-");
        try (Connection conn = StorageFixtures.schemaDatabase(root.resolve("t.db"), Tier.OPEN)) {
            AuditLog.append(conn, AuditEvent.of(null, "a", "x"));
            AuditLog.append(conn, AuditEvent.of(null, "b", "x"));
            AuditLog.append(conn, AuditEvent.of(null, "c", "x"));

            StorageFixtures.exec(conn, "DELETE FROM audit_log WHERE id=2");

            ChainVerification result = AuditLog.verify(conn);
            Assertions.assertFalse(result.valid());
            Assertions.assertEquals(3L, result.brokenAtId());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void sensitiveDetailsAreMasked() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-audit-mask-");
        try (Connection conn = StorageFixtures.schemaDatabase(root.resolve("t.db"), Tier.OPEN)) {
            AuditLog.append(conn, new AuditEvent(null, "user.create", "user:1",
                    Map.of("username", "ada", "password", "open-sesame")));

            Assertions.assertEquals(0, StorageFixtures.count(conn,
                    "SELECT COUNT(*) FROM audit_log WHERE details LIKE '%open-sesame%'"));
            Assertions.assertEquals(1, StorageFixtures.count(conn,
                    "SELECT COUNT(*) FROM audit_log WHERE details LIKE '%ada%'"));
            Assertions.assertTrue(AuditLog.verify(conn).valid());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void blankActionIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> AuditEvent.of(null, " ", "x"));
    }
}
