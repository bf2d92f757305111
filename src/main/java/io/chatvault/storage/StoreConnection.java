package io.chatvault.storage;

import io.chatvault.model.Tier;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * The single verified connection of a process, together with the tier it was verified
 * against.
 */
public final class StoreConnection implements AutoCloseable {
    private final Path file;
    private final Connection connection;
    private final Tier tier;

    StoreConnection(Path file, Connection connection, Tier tier) {
        this.file = file;
        this.connection = connection;
        this.tier = tier;
    }

    public Path file() {
        return file;
    }

    public Connection connection() {
        return connection;
    }

    public Tier tier() {
        return tier;
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to close database connection: " + file, e);
        }
    }
}
