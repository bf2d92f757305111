package io.chatvault.model;

public record FileRecord(
        long fileId,
        String kind,
        String mime,
        String sha256,
        long sizeBytes,
        String thumbSha256,
        String originalName,
        int refCount,
        long createdAtMs
) {
}
