package de.bsommerfeld.sqlcontents.core.domain;

import java.time.Instant;

/**
 * Snapshot of one row of the {@code remote_checkpoints} table.
 *
 * @param id           surrogate id
 * @param path         canonical file path the checkpoint was taken of
 * @param lastModified time the checkpoint was written
 * @param content      decrypted content, {@code null} for listings
 */
public record CheckpointRecord(
        long id,
        String path,
        Instant lastModified,
        byte[] content) {

    public CheckpointRecord withoutContent() {
        return new CheckpointRecord(id, path, lastModified, null);
    }
}
