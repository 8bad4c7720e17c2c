package de.bsommerfeld.sqlcontents.core.event;

/**
 * Events published on the {@link ContentsEventBus}. Paths are API paths.
 * Every event describes a committed change; nothing is posted for a rolled
 * back transaction.
 */
public class ContentsEvents {

    public record FileSavedEvent(String userId, String path) {
    }

    public record DirectoryCreatedEvent(String userId, String path) {
    }

    public record PathRenamedEvent(String userId, String oldPath, String newPath) {
    }

    public record PathDeletedEvent(String userId, String path) {
    }

    public record CheckpointCreatedEvent(String userId, String path, long checkpointId) {
    }

    public record CheckpointRestoredEvent(String userId, String path, long checkpointId) {
    }

    public record UserPurgedEvent(String userId) {
    }

    public record ReencryptionStartedEvent(String userId) {
    }

    /**
     * Fired once per migrated row. {@code table} is {@code files} or
     * {@code remote_checkpoints}.
     */
    public record RowReencryptedEvent(String userId, String table, long rowId) {
    }

    public record ReencryptionFinishedEvent(String userId, int files, int checkpoints) {
    }
}
