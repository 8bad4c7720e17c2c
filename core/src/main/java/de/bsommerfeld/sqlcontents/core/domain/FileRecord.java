package de.bsommerfeld.sqlcontents.core.domain;

import java.time.Instant;

/**
 * Snapshot of one row of the {@code files} table.
 *
 * @param id         surrogate id, stable across renames
 * @param parentName canonical directory the file lives in, e.g. {@code /a/}
 * @param name       leaf name, e.g. {@code notes.txt}
 * @param createdAt  time of the last save or rename (doubles as last-modified)
 * @param content    decrypted content, {@code null} when not requested
 */
public record FileRecord(
        long id,
        String parentName,
        String name,
        Instant createdAt,
        byte[] content) {

    /** Canonical full path, e.g. {@code /a/notes.txt}. */
    public String path() {
        return parentName + name;
    }

    public boolean hasContent() {
        return content != null;
    }
}
