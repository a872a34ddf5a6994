package com.eainde.comps.model;

import org.apache.commons.codec.digest.DigestUtils;

/**
 * A spreadsheet file as handed over by the {@code FileResolver}.
 *
 * <p>Either resolved (content present, {@code failureReason == null}) or unresolved
 * (no content, a failure reason). The content version is the SHA-256 of the bytes so
 * that a changed file yields a different cache fingerprint even under the same path.</p>
 *
 * @param id             opaque reference the caller passed in (path, drive item id, ...)
 * @param displayName    name used in logs and in failed_files
 * @param content        raw file bytes, or null when unresolved
 * @param contentVersion hex SHA-256 of {@code content}, or null when unresolved
 * @param failureReason  why resolution failed, or null when resolved
 */
public record FileReference(
        String id,
        String displayName,
        byte[] content,
        String contentVersion,
        String failureReason
) {

    public static FileReference resolved(String id, String displayName, byte[] content) {
        if (content == null) {
            throw new IllegalArgumentException("content must not be null for resolved file " + id);
        }
        return new FileReference(id, displayName, content, DigestUtils.sha256Hex(content), null);
    }

    public static FileReference unresolved(String id, String reason) {
        return new FileReference(id, id, null, null, reason);
    }

    public boolean isResolved() {
        return failureReason == null;
    }

    @Override
    public String toString() {
        return isResolved()
                ? String.format("File[%s, %d bytes, v=%s]", displayName, content.length,
                        contentVersion.substring(0, 8))
                : String.format("File[%s, unresolved: %s]", id, failureReason);
    }
}
