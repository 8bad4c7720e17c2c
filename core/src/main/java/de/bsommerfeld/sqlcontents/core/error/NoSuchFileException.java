package de.bsommerfeld.sqlcontents.core.error;

/**
 * Thrown when no file row exists for the requested path.
 */
public class NoSuchFileException extends ContentsException {

    public NoSuchFileException(String path) {
        super("No such file: [" + path + "]", path);
    }
}
