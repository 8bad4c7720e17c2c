package de.bsommerfeld.sqlcontents.core.path;

/**
 * A file path decomposed into its owning directory and leaf name.
 *
 * @param directory canonical directory path, always starting and ending with
 *                  {@code /}
 * @param name      leaf file name without any slash
 */
public record SplitPath(String directory, String name) {

    /** Recombines the two halves into the canonical file path. */
    public String fullPath() {
        return directory + name;
    }
}
