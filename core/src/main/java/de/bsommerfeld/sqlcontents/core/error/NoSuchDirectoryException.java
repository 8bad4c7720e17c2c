package de.bsommerfeld.sqlcontents.core.error;

/**
 * Thrown when a directory is addressed that does not exist, including the
 * missing parent of a file or directory being created.
 */
public class NoSuchDirectoryException extends ContentsException {

    public NoSuchDirectoryException(String path) {
        super("No such directory: [" + path + "]", path);
    }
}
