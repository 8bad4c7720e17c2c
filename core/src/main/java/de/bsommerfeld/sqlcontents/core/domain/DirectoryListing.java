package de.bsommerfeld.sqlcontents.core.domain;

import java.util.List;

/**
 * Direct children of one directory. Files and subdirectories are fetched by
 * two independent queries; neither list carries file content.
 *
 * @param name           canonical name of the listed directory
 * @param files          files directly inside the directory, ordered by name
 * @param subdirectories canonical names of direct subdirectories, ordered by
 *                       name
 */
public record DirectoryListing(
        String name,
        List<FileRecord> files,
        List<String> subdirectories) {

    public DirectoryListing {
        files = List.copyOf(files);
        subdirectories = List.copyOf(subdirectories);
    }

    public boolean isEmpty() {
        return files.isEmpty() && subdirectories.isEmpty();
    }
}
