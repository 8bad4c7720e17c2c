package de.bsommerfeld.sqlcontents.core.error;

/**
 * Thrown by a {@code Crypto} strategy when stored bytes cannot be authenticated
 * or decoded under its key material.
 *
 * <p>
 * The fallback strategy aggregates the failures of every strategy it tried as
 * suppressed exceptions, so the full chain stays visible in stack traces.
 */
public class CorruptedFileException extends ContentsException {

    public CorruptedFileException(String message) {
        super(message, null);
    }

    public CorruptedFileException(String message, Throwable cause) {
        super(message, null, cause);
    }
}
