package io.chatvault.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * What the linked SQLite engine can open. Resolved once at bootstrap and passed to every
 * component that may need the encrypted engine.
 */
public enum EngineCapability {
    PLAINTEXT_ONLY,
    PLAINTEXT_AND_ENCRYPTED;

    private static final Logger LOG = LoggerFactory.getLogger(EngineCapability.class);

    public boolean encrypted() {
        return this == PLAINTEXT_AND_ENCRYPTED;
    }

    /**
     * Probes the driver's native library: a SQLite3 Multiple Ciphers build registers
     * {@code sqlite3mc_version()}, a stock SQLite build fails the call.
     */
    public static EngineCapability detect() {
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite::memory:")) {
            String version = cipherEngineVersion(conn);
            if (version != null && !version.isBlank()) {
                LOG.info("Encrypted engine available ({})", version);
                return PLAINTEXT_AND_ENCRYPTED;
            }
            LOG.info("Encrypted engine not available; only the open tier can be used");
            return PLAINTEXT_ONLY;
        } catch (SQLException e) {
            throw new ConfigurationException("SQLite engine is not usable", e);
        }
    }

    private static String cipherEngineVersion(Connection conn) {
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT sqlite3mc_version()")) {
            return rs.next() ? rs.getString(1) : null;
        } catch (SQLException e) {
            LOG.debug("sqlite3mc_version() unavailable: {}", e.getMessage());
            return null;
        }
    }
}
