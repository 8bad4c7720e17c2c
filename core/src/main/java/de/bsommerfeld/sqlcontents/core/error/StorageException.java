package de.bsommerfeld.sqlcontents.core.error;

/**
 * Thrown when the relational backend fails for a reason that has no domain
 * translation. The enclosing transaction has already been rolled back when
 * this reaches the caller.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
