package de.bsommerfeld.sqlcontents.core.error;

/**
 * Thrown when a checkpoint id does not exist for the given path.
 */
public class NoSuchCheckpointException extends ContentsException {

    private final long checkpointId;

    public NoSuchCheckpointException(String path, long checkpointId) {
        super("No such checkpoint: [" + path + "] id=" + checkpointId, path);
        this.checkpointId = checkpointId;
    }

    public long getCheckpointId() {
        return checkpointId;
    }
}
