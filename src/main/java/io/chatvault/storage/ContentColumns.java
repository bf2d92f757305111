package io.chatvault.storage;

import io.chatvault.model.Content;
import io.chatvault.model.ReadableText;
import io.chatvault.model.Tier;
import io.chatvault.security.DecryptionException;
import io.chatvault.security.FieldCodec;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;

/**
 * Maps text to the {@code content, content_ct, content_nonce, content_key_id} column
 * group. The tier decides the shape; callers never do. A sealed body is bound to its
 * table and row id as associated data, so it cannot be moved to another row.
 *
 * <p>Rows are inserted with the group left NULL and filled by {@link #write} once the row
 * id is known, inside the caller's transaction.
 */
final class ContentColumns {
    private final Tier tier;
    private final FieldCodec codec;
    private final String table;

    ContentColumns(Tier tier, FieldCodec codec, String table) {
        if (tier.fieldsSealed() && codec == null) {
            throw new IllegalArgumentException(tier + " tier requires a field codec");
        }
        this.tier = tier;
        this.codec = codec;
        this.table = table;
    }

    void write(Connection conn, long rowId, String text) throws SQLException {
        String value = text == null ? "" : text;
        Content content = tier.fieldsSealed() ? codec.seal(value, context(rowId)) : new Content.Plain(value);
        try (PreparedStatement ps = conn.prepareStatement("UPDATE " + table
                + " SET content=?, content_ct=?, content_nonce=?, content_key_id=? WHERE id=?")) {
            bind(ps, 1, content);
            ps.setLong(5, rowId);
            if (ps.executeUpdate() != 1) {
                throw new SQLException("No " + table + " row " + rowId + " to write content to");
            }
        }
    }

    /** Reads the group of the current row; the result set must also carry {@code id}. */
    ReadableText read(ResultSet rs) throws SQLException {
        byte[] ciphertext = rs.getBytes("content_ct");
        if (ciphertext == null) {
            return ReadableText.of(rs.getString("content"));
        }
        byte[] nonce = rs.getBytes("content_nonce");
        int keyId = rs.getInt("content_key_id");
        if (nonce == null) {
            return ReadableText.failed(new DecryptionException("Sealed content has no nonce"));
        }
        if (codec == null) {
            return ReadableText.failed(new DecryptionException("Sealed content found but no field key is loaded"));
        }
        return codec.read(new Content.Sealed(ciphertext, nonce, keyId), context(rs.getLong("id")));
    }

    private String context(long rowId) {
        return table + ":" + rowId;
    }

    private static void bind(PreparedStatement ps, int index, Content content) throws SQLException {
        if (content instanceof Content.Sealed sealed) {
            ps.setNull(index, Types.VARCHAR);
            ps.setBytes(index + 1, sealed.ciphertext());
            ps.setBytes(index + 2, sealed.nonce());
            ps.setInt(index + 3, sealed.keyId());
        } else {
            ps.setString(index, ((Content.Plain) content).text());
            ps.setNull(index + 1, Types.BLOB);
            ps.setNull(index + 2, Types.BLOB);
            ps.setNull(index + 3, Types.INTEGER);
        }
    }
}
