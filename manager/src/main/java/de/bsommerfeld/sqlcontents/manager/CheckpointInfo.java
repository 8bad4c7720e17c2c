package de.bsommerfeld.sqlcontents.manager;

import de.bsommerfeld.sqlcontents.core.domain.CheckpointRecord;

import java.time.Instant;

/** Id and timestamp of one checkpoint, as listed to the host. */
public record CheckpointInfo(
        long id,
        Instant lastModified) {

    static CheckpointInfo of(CheckpointRecord record) {
        return new CheckpointInfo(record.id(), record.lastModified());
    }
}
