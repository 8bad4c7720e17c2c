package de.bsommerfeld.sqlcontents.core.domain;

import java.time.Instant;

/**
 * A decrypted file or checkpoint produced by a bulk export across users.
 *
 * @param id           row id in its source table
 * @param userId       owner of the row
 * @param path         API path (no surrounding slashes)
 * @param lastModified row timestamp
 * @param content      decrypted bytes
 */
public record ExportedContent(
        long id,
        String userId,
        String path,
        Instant lastModified,
        byte[] content) {
}
