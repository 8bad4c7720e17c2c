package de.bsommerfeld.sqlcontents.core.error;

/**
 * Thrown when a path resolves above the user's root through {@code ..}
 * segments.
 */
public class PathOutsideRootException extends ContentsException {

    public PathOutsideRootException(String path) {
        super("Path outside root: [" + path + "]", path);
    }
}
