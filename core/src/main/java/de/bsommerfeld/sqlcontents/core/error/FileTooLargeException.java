package de.bsommerfeld.sqlcontents.core.error;

/**
 * Thrown when the stored (encrypted) representation of a file or checkpoint
 * exceeds the configured size limit. Raised before any row is written.
 */
public class FileTooLargeException extends ContentsException {

    private final long size;
    private final long limit;

    public FileTooLargeException(String path, long size, long limit) {
        super("File is too large to save: [" + path + "] (" + size + " > " + limit + " bytes)", path);
        this.size = size;
        this.limit = limit;
    }

    public long getSize() {
        return size;
    }

    public long getLimit() {
        return limit;
    }
}
