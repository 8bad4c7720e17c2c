package de.bsommerfeld.sqlcontents.core.error;

/**
 * Thrown when a rename would overwrite an existing directory.
 */
public class DirectoryExistsException extends ContentsException {

    public DirectoryExistsException(String path) {
        super("Directory already exists: [" + path + "]", path);
    }
}
