package de.bsommerfeld.sqlcontents.core.error;

/**
 * Thrown when a rename addresses the root directory.
 */
public class RenameRootException extends ContentsException {

    public RenameRootException() {
        super("Renaming the root directory is not permitted.", "");
    }
}
