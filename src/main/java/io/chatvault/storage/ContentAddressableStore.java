package io.chatvault.storage;

import io.chatvault.model.FileRecord;
import io.chatvault.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Optional;

/**
 * Attachment blobs stored once per SHA-256 under {@code cas/<hex>}, with reference
 * counted metadata in the {@code file} table. Blobs are staged in {@code cas_tmp/} and
 * moved into place atomically.
 */
public final class ContentAddressableStore {
    private static final Logger LOG = LoggerFactory.getLogger(ContentAddressableStore.class);
    private static final String DEFAULT_MIME = "application/octet-stream";

    private final Connection conn;
    private final Path casDir;
    private final Path casTmpDir;

    public ContentAddressableStore(Connection conn, Path casDir, Path casTmpDir) {
        this.conn = conn;
        this.casDir = casDir;
        this.casTmpDir = casTmpDir;
    }

    /**
     * Stores {@code source} under the caller-supplied digest, or takes another reference
     * on an existing entry. The digest is trusted; use {@link #putFile} to hash on write.
     */
    public long put(String sha256Hex, String mime, Path source) {
        String hash = requireHash(sha256Hex);
        String mimeType = mime == null || mime.isBlank() ? DEFAULT_MIME : mime.trim();
        try {
            conn.setAutoCommit(false);
            try {
                Optional<Long> existing = idForHash(hash);
                long fileId;
                if (existing.isPresent()) {
                    fileId = existing.get();
                    try (PreparedStatement ps = conn.prepareStatement(
                            "UPDATE file SET ref_count=ref_count+1 WHERE id=?")) {
                        ps.setLong(1, fileId);
                        ps.executeUpdate();
                    }
                    if (!Files.exists(blobPath(hash))) {
                        LOG.warn("Blob for file {} was missing; restoring it from {}", fileId, source.getFileName());
                        writeBlob(hash, source);
                    }
                } else {
                    writeBlob(hash, source);
                    try (PreparedStatement ps = conn.prepareStatement("""
                            INSERT INTO file(kind, mime, sha256, size_bytes, thumb_sha256, original_name,
                                             ref_count, created_at_ms)
                            VALUES (?, ?, ?, ?, NULL, ?, 1, ?)
                            """)) {
                        ps.setString(1, kindOf(mimeType));
                        ps.setString(2, mimeType);
                        ps.setString(3, hash);
                        ps.setLong(4, Files.size(source));
                        Path name = source.getFileName();
                        Rows.setNullableString(ps, 5, name == null ? null : name.toString());
                        ps.setLong(6, System.currentTimeMillis());
                        ps.executeUpdate();
                    }
                    fileId = Rows.lastInsertId(conn);
                }
                conn.commit();
                return fileId;
            } catch (Exception e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to store blob " + hash, e);
        }
    }

    /** Hashes {@code source} while reading it and stores it. A null MIME type is probed. */
    public long putFile(Path source, String mime) {
        try {
            String hash = Hashing.sha256Hex(source);
            String mimeType = mime;
            if (mimeType == null || mimeType.isBlank()) {
                mimeType = Files.probeContentType(source);
            }
            return put(hash, mimeType, source);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read " + source, e);
        }
    }

    /** Blob path of a file id; empty when the row or the blob is missing. */
    public Optional<Path> pathFor(long fileId) {
        return find(fileId)
                .map(record -> blobPath(record.sha256()))
                .filter(Files::exists);
    }

    public Optional<FileRecord> find(long fileId) {
        try (PreparedStatement ps = conn.prepareStatement("""
                SELECT id, kind, mime, sha256, size_bytes, thumb_sha256, original_name, ref_count, created_at_ms
                FROM file WHERE id=?
                """)) {
            ps.setLong(1, fileId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new FileRecord(
                        rs.getLong("id"),
                        rs.getString("kind"),
                        rs.getString("mime"),
                        rs.getString("sha256"),
                        rs.getLong("size_bytes"),
                        rs.getString("thumb_sha256"),
                        rs.getString("original_name"),
                        rs.getInt("ref_count"),
                        rs.getLong("created_at_ms")
                ));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read file " + fileId, e);
        }
    }

    /** Rehashes the blob; false when it is missing or no longer matches its digest. */
    public boolean verify(long fileId) {
        Optional<FileRecord> record = find(fileId);
        if (record.isEmpty()) {
            return false;
        }
        Path blob = blobPath(record.get().sha256());
        if (!Files.exists(blob)) {
            return false;
        }
        try {
            return Hashing.sha256Hex(blob).equals(record.get().sha256());
        } catch (IOException e) {
            throw new RuntimeException("Failed to hash blob " + blob, e);
        }
    }

    /**
     * Drops one reference. At zero the row goes and the blob is deleted; a blob that
     * cannot be deleted is only logged.
     *
     * @return false when the file id is unknown
     */
    public boolean release(long fileId) {
        String hash = null;
        try {
            conn.setAutoCommit(false);
            try {
                Optional<FileRecord> record = find(fileId);
                if (record.isEmpty()) {
                    conn.rollback();
                    return false;
                }
                if (record.get().refCount() > 1) {
                    try (PreparedStatement ps = conn.prepareStatement(
                            "UPDATE file SET ref_count=ref_count-1 WHERE id=?")) {
                        ps.setLong(1, fileId);
                        ps.executeUpdate();
                    }
                } else {
                    try (PreparedStatement ps = conn.prepareStatement("DELETE FROM file WHERE id=?")) {
                        ps.setLong(1, fileId);
                        ps.executeUpdate();
                    }
                    hash = record.get().sha256();
                }
                conn.commit();
            } catch (Exception e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to release file " + fileId, e);
        }
        if (hash != null) {
            deleteBlob(hash);
        }
        return true;
    }

    public boolean setThumbnail(long fileId, String thumbSha256Hex) {
        String thumb = requireHash(thumbSha256Hex);
        try (PreparedStatement ps = conn.prepareStatement("UPDATE file SET thumb_sha256=? WHERE id=?")) {
            ps.setString(1, thumb);
            ps.setLong(2, fileId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to set thumbnail of file " + fileId, e);
        }
    }

    static String kindOf(String mime) {
        String m = mime == null ? "" : mime.toLowerCase(Locale.ROOT);
        if (m.startsWith("image/")) {
            return "image";
        }
        if (m.startsWith("audio/")) {
            return "audio";
        }
        if (m.startsWith("video/")) {
            return "video";
        }
        if (m.startsWith("text/") || m.equals("application/pdf") || m.equals("application/rtf")
                || m.contains("msword") || m.contains("officedocument") || m.contains("opendocument")) {
            return "doc";
        }
        return "other";
    }

    private Path blobPath(String hash) {
        return casDir.resolve(hash);
    }

    private void writeBlob(String hash, Path source) throws IOException {
        Path target = blobPath(hash);
        if (Files.exists(target)) {
            return;
        }
        Files.createDirectories(casDir);
        Files.createDirectories(casTmpDir);
        Path tmp = Files.createTempFile(casTmpDir, hash, ".part");
        try {
            Files.copy(source, tmp, StandardCopyOption.REPLACE_EXISTING);
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private void deleteBlob(String hash) {
        Path blob = blobPath(hash);
        try {
            Files.deleteIfExists(blob);
        } catch (IOException e) {
            LOG.warn("Failed to delete unreferenced blob {}", blob, e);
        }
    }

    private Optional<Long> idForHash(String hash) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT id FROM file WHERE sha256=?")) {
            ps.setString(1, hash);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getLong(1)) : Optional.empty();
            }
        }
    }

    private static String requireHash(String raw) {
        String hash = Hashing.normalizeSha256Hex(raw);
        if (hash.isEmpty()) {
            throw new IllegalArgumentException("Not a SHA-256 hex digest: " + raw);
        }
        return hash;
    }
}
