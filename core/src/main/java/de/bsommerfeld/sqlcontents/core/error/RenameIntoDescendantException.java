package de.bsommerfeld.sqlcontents.core.error;

/**
 * Thrown when a directory would be renamed to a path inside its own subtree.
 */
public class RenameIntoDescendantException extends ContentsException {

    public RenameIntoDescendantException(String path) {
        super("Cannot move a directory into itself: [" + path + "]", path);
    }
}
