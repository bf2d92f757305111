package io.chatvault.storage;

import io.chatvault.model.Tier;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Structural checks run on every freshly opened connection. On an encrypted file the
 * check walks every page through the cipher, so a page whose HMAC does not verify fails
 * it the same way a corrupt plaintext page does.
 */
public final class IntegrityVerifier {

    private IntegrityVerifier() {
    }

    public static void verify(Connection conn, Tier tier) {
        List<String> rows;
        try {
            rows = SqliteEngine.pragmaRows(conn, "integrity_check");
        } catch (SQLException e) {
            throw new IntegrityException(
                    IntegrityException.Reason.CHECK_FAILED,
                    "Integrity check could not run for " + tier + " database: " + e.getMessage(),
                    e
            );
        }
        if (!rows.equals(List.of("ok"))) {
            throw new IntegrityException(
                    IntegrityException.Reason.CHECK_FAILED,
                    "integrity_check reported: " + String.join("; ", rows)
            );
        }
    }
}
