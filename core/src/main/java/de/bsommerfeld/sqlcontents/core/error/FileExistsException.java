package de.bsommerfeld.sqlcontents.core.error;

/**
 * Thrown when a rename would overwrite an existing file.
 */
public class FileExistsException extends ContentsException {

    public FileExistsException(String path) {
        super("File already exists: [" + path + "]", path);
    }
}
