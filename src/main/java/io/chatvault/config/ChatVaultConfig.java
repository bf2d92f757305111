package io.chatvault.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Layout of one installation's data root.
 */
public final class ChatVaultConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DB_FILENAME = "chatvault.db";
    public static final int DEFAULT_CONVERSATION_LIMIT = 50;
    public static final int DEFAULT_MESSAGE_LIMIT = 200;
    public static final int DEFAULT_SIGNUP_LIMIT = 100;

    private final Path rootDir;

    public ChatVaultConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static ChatVaultConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new ChatVaultConfig(resolved.toAbsolutePath().normalize());
    }

    /**
     * Root from the explicit argument, else {@code CHATVAULT_DATA_DIR}, else {@code ./data}.
     */
    public static ChatVaultConfig resolve(String explicitRoot, EnvironmentOverrides env) {
        if (explicitRoot != null && !explicitRoot.isBlank()) {
            return fromRoot(explicitRoot);
        }
        return fromRoot(env.dataDir().orElse(DEFAULT_ROOT));
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve(DB_FILENAME);
    }

    public Path casDir() {
        return rootDir.resolve("cas");
    }

    public Path casTmpDir() {
        return rootDir.resolve("cas_tmp");
    }

    public Path settingsDir() {
        return rootDir.resolve("settings");
    }

    public Path settingsFile() {
        return settingsDir().resolve("app.json");
    }

    public Path logsDir() {
        return rootDir.resolve("logs");
    }
}
