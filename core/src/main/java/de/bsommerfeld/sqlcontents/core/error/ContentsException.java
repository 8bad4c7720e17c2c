package de.bsommerfeld.sqlcontents.core.error;

/**
 * Base type for every domain condition the storage engine reports. Subclasses
 * name the condition; the host maps each kind to its own response code.
 *
 * <p>
 * All domain errors are unchecked so they can cross the transaction callbacks
 * in {@code SqlDatabase} without wrapping. A thrown {@code ContentsException}
 * always rolls back the enclosing transaction.
 */
public abstract class ContentsException extends RuntimeException {

    private final String path;

    protected ContentsException(String message, String path) {
        super(message);
        this.path = path;
    }

    protected ContentsException(String message, String path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /**
     * The API path the failing operation was addressed to, {@code null} when
     * the condition is not tied to a path.
     */
    public String getPath() {
        return path;
    }
}
