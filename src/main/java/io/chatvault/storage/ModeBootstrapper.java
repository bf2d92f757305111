package io.chatvault.storage;

import io.chatvault.config.ChatVaultConfig;
import io.chatvault.config.SettingsCache;
import io.chatvault.model.Tier;
import io.chatvault.security.KeyKind;
import io.chatvault.security.KeyManager;
import io.chatvault.security.KeyMaterial;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * First-run creation and every-run verification of the database under a data root.
 * The tier is fixed at creation; later launches only detect and verify it.
 */
public final class ModeBootstrapper {
    private static final Logger LOG = LoggerFactory.getLogger(ModeBootstrapper.class);

    private final ChatVaultConfig config;
    private final EngineCapability capability;
    private final KeyManager keyManager;
    private final TierSelector selector;
    private final SettingsCache settings;

    public ModeBootstrapper(
            ChatVaultConfig config,
            EngineCapability capability,
            KeyManager keyManager,
            TierSelector selector,
            SettingsCache settings
    ) {
        this.config = config;
        this.capability = capability;
        this.keyManager = keyManager;
        this.selector = selector;
        this.settings = settings;
    }

    /** Creates or verifies the database and returns its tier. */
    public Tier ensureReady() {
        try (StoreConnection conn = bootstrap()) {
            return conn.tier();
        }
    }

    /** Same as {@link #ensureReady()} but hands over the verified connection. */
    public StoreConnection bootstrap() {
        initDirectories();
        Path dbFile = config.dbFile();
        StoreConnection conn;
        if (Files.exists(dbFile)) {
            conn = new ConnectionOpener(capability, keyManager).open(dbFile);
        } else {
            Tier tier = selector.select();
            LOG.info("Creating {} database {}", tier, dbFile);
            conn = create(dbFile, tier);
        }
        reconcileSettings(conn);
        return conn;
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.casDir());
            Files.createDirectories(config.casTmpDir());
            Files.createDirectories(config.settingsDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories under " + config.rootDir(), e);
        }
    }

    private StoreConnection create(Path dbFile, Tier tier) {
        KeyMaterial dbKey = null;
        if (tier.fileEncrypted()) {
            if (!capability.encrypted()) {
                throw new ConfigurationException(
                        "Database mode " + tier + " needs an encrypted SQLite engine, which is not available");
            }
            dbKey = keyManager.getOrCreate(KeyKind.DATABASE, false)
                    .orElseThrow(() -> new ConfigurationException("Database key could not be created"));
            warnIfEphemeral(dbKey);
        }
        if (tier.fieldsSealed()) {
            KeyMaterial fieldKey = keyManager.getOrCreate(KeyKind.FIELD, false)
                    .orElseThrow(() -> new ConfigurationException("Field key could not be created"));
            warnIfEphemeral(fieldKey);
        }

        Connection conn = null;
        try {
            conn = dbKey == null ? SqliteEngine.openPlain(dbFile) : SqliteEngine.openEncrypted(dbFile, dbKey);
            SqliteEngine.applyCommonPragmas(conn);
            SchemaManager.apply(conn, tier);
            IntegrityVerifier.verify(conn, tier);
            return new StoreConnection(dbFile, conn, tier);
        } catch (SQLException e) {
            discard(dbFile, conn, e);
            throw new ConfigurationException("Failed to create " + tier + " database: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            discard(dbFile, conn, e);
            throw e;
        }
    }

    // The sidecar is a cache: a failed write is reported, not fatal.
    private void reconcileSettings(StoreConnection conn) {
        boolean hasAdmin;
        try {
            hasAdmin = AccountStore.countAdmins(conn.connection()) > 0;
        } catch (RuntimeException e) {
            conn.close();
            throw e;
        }
        try {
            if (settings.recordTier(conn.tier())) {
                LOG.info("Settings cache updated to database mode {}", conn.tier());
            }
            settings.recordAdminPresence(hasAdmin);
        } catch (RuntimeException e) {
            LOG.warn("Settings cache {} could not be reconciled", settings.file(), e);
        }
    }

    private static void warnIfEphemeral(KeyMaterial key) {
        if (!key.durable()) {
            LOG.warn("The {} key exists only in this process; set {} to reopen this database later",
                    key.kind(), key.kind().envVar());
        }
    }

    // A half-created file would be detected as corrupt on the next launch.
    private static void discard(Path dbFile, Connection conn, Exception failure) {
        if (conn != null) {
            try {
                conn.close();
            } catch (SQLException closeError) {
                failure.addSuppressed(closeError);
            }
        }
        for (String suffix : new String[]{"", "-wal", "-shm", "-journal"}) {
            Path path = dbFile.resolveSibling(dbFile.getFileName() + suffix);
            try {
                Files.deleteIfExists(path);
            } catch (IOException deleteError) {
                LOG.warn("Failed to remove partially created file {}", path, deleteError);
                failure.addSuppressed(deleteError);
            }
        }
    }
}
