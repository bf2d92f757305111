package io.chatvault.storage;

import io.chatvault.model.Tier;
import io.chatvault.security.KeyKind;
import io.chatvault.security.KeyManager;
import io.chatvault.security.KeyMaterial;
import io.chatvault.security.KeyUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Optional;

/**
 * Opens an existing database file by detection: plaintext engine first, then the
 * encrypted engine with a key that must already exist. Whatever branch succeeds has to
 * agree with the tier recorded in {@code meta.db_mode}.
 */
public final class ConnectionOpener {
    private static final Logger LOG = LoggerFactory.getLogger(ConnectionOpener.class);

    private final EngineCapability capability;
    private final KeyManager keyManager;

    public ConnectionOpener(EngineCapability capability, KeyManager keyManager) {
        this.capability = capability;
        this.keyManager = keyManager;
    }

    public StoreConnection open(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Database file does not exist: " + file);
        }
        Optional<Connection> plain = tryPlaintext(file);
        if (plain.isPresent()) {
            return finish(file, plain.get(), false);
        }
        if (!capability.encrypted()) {
            throw new ConfigurationException(
                    "Database is not a plaintext SQLite file and no encrypted engine is available: " + file);
        }
        KeyMaterial dbKey = keyManager.getOrCreate(KeyKind.DATABASE, true)
                .orElseThrow(() -> new KeyUnavailableException(KeyKind.DATABASE,
                        "Database is encrypted but no key is available (secret store or "
                                + KeyKind.DATABASE.envVar() + ")"));
        Connection conn;
        try {
            conn = SqliteEngine.openEncrypted(file, dbKey);
        } catch (SQLException e) {
            throw new IntegrityException(IntegrityException.Reason.CHECK_FAILED,
                    "Failed to open encrypted database: " + file, e);
        }
        try {
            checkUnlocked(file, conn, dbKey);
            IntegrityVerifier.verify(conn, Tier.SECURE);
        } catch (RuntimeException e) {
            closeAfterFailure(conn, e);
            throw e;
        }
        return finish(file, conn, true);
    }

    /** The first page read after keying decides whether the key matches the file. */
    private static void checkUnlocked(Path file, Connection conn, KeyMaterial dbKey) {
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT count(*) FROM sqlite_master")) {
            rs.next();
        } catch (SQLException e) {
            if (SqliteEngine.isNotADatabase(e)) {
                throw new KeyUnavailableException(KeyKind.DATABASE,
                        "Database key from " + dbKey.source() + " does not unlock " + file, e);
            }
            throw new IntegrityException(IntegrityException.Reason.CHECK_FAILED,
                    "Encrypted database is not readable: " + file + ": " + e.getMessage(), e);
        }
    }

    private Optional<Connection> tryPlaintext(Path file) {
        Connection conn;
        try {
            conn = SqliteEngine.openPlain(file);
        } catch (SQLException e) {
            LOG.debug("Plaintext engine could not open {}: {}", file, e.getMessage());
            return Optional.empty();
        }
        List<String> rows;
        try {
            rows = SqliteEngine.pragmaRows(conn, "integrity_check");
        } catch (SQLException e) {
            // Not a database for the plaintext engine: the encrypted branch gets a turn.
            LOG.debug("Plaintext integrity_check failed on {}: {}", file, e.getMessage());
            closeAfterFailure(conn, e);
            return Optional.empty();
        }
        if (rows.equals(List.of("ok"))) {
            return Optional.of(conn);
        }
        IntegrityException failure = new IntegrityException(IntegrityException.Reason.CHECK_FAILED,
                "integrity_check reported: " + String.join("; ", rows));
        closeAfterFailure(conn, failure);
        throw failure;
    }

    private StoreConnection finish(Path file, Connection conn, boolean encrypted) {
        try {
            Tier tier = recordedTier(conn, encrypted);
            if (tier.fieldsSealed()) {
                keyManager.require(KeyKind.FIELD);
            }
            SqliteEngine.applyCommonPragmas(conn);
            LOG.info("Opened {} database {}", tier, file);
            return new StoreConnection(file, conn, tier);
        } catch (SQLException e) {
            closeAfterFailure(conn, e);
            throw new RuntimeException("Failed to configure database connection: " + file, e);
        } catch (RuntimeException e) {
            closeAfterFailure(conn, e);
            throw e;
        }
    }

    private static Tier recordedTier(Connection conn, boolean encrypted) {
        Optional<String> raw;
        try {
            raw = SchemaManager.readMeta(conn, "db_mode");
        } catch (SQLException e) {
            throw new IntegrityException(IntegrityException.Reason.META_MISSING,
                    "meta table is not readable: " + e.getMessage(), e);
        }
        if (raw.isEmpty()) {
            throw new IntegrityException(IntegrityException.Reason.META_MISSING, "meta.db_mode is missing");
        }
        Tier tier = Tier.parse(raw.get()).orElseThrow(() -> new IntegrityException(
                IntegrityException.Reason.ENGINE_MISMATCH, "meta.db_mode has unknown value: " + raw.get()));
        if (tier.fileEncrypted() != encrypted) {
            throw new IntegrityException(IntegrityException.Reason.ENGINE_MISMATCH,
                    "meta.db_mode is " + tier + " but the file opened with the "
                            + (encrypted ? "encrypted" : "plaintext") + " engine");
        }
        return tier;
    }

    private static void closeAfterFailure(Connection conn, Exception failure) {
        try {
            conn.close();
        } catch (SQLException closeError) {
            failure.addSuppressed(closeError);
        }
    }
}
