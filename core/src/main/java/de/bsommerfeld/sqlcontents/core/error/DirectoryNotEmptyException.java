package de.bsommerfeld.sqlcontents.core.error;

/**
 * Thrown when a directory delete is rejected because files or subdirectories
 * still reference it.
 */
public class DirectoryNotEmptyException extends ContentsException {

    public DirectoryNotEmptyException(String path) {
        super("Directory not empty: [" + path + "]", path);
    }
}
