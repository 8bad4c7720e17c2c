package de.bsommerfeld.sqlcontents.manager;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * Host-facing view of a file, notebook or directory.
 *
 * <p>
 * The type of {@link #content()} depends on {@link #type()}:
 * <ul>
 * <li>{@link Type#NOTEBOOK}: a {@link JsonNode}, format {@link Format#JSON}</li>
 * <li>{@link Type#FILE}: a {@link String}, either UTF-8 text or base64</li>
 * <li>{@link Type#DIRECTORY}: a {@code List<ContentModel>} of children
 * without content</li>
 * </ul>
 * Content and format are {@code null} when content was not requested.
 *
 * @param name         leaf name, empty for the root
 * @param path         API path without surrounding slashes
 * @param type         entity type
 * @param format       content encoding, {@code null} without content
 * @param mimetype     {@code text/plain} or {@code application/octet-stream}
 *                     for files with content, otherwise {@code null}
 * @param lastModified time of the last save or rename; {@code null} for
 *                     directories, which carry no timestamp
 * @param content      see above
 * @param children     children of a directory read with content, otherwise
 *                     empty; not serialized since {@code content} carries them
 */
public record ContentModel(
        String name,
        String path,
        Type type,
        Format format,
        String mimetype,
        Instant lastModified,
        Object content,
        @JsonIgnore List<ContentModel> children) {

    public ContentModel {
        children = children == null ? List.of() : List.copyOf(children);
    }

    /** A model without children, i.e. a file, a notebook or a directory read without content. */
    public ContentModel(String name, String path, Type type, Format format, String mimetype, Instant lastModified,
            Object content) {
        this(name, path, type, format, mimetype, lastModified, content, List.of());
    }

    public enum Type {
        @JsonProperty("directory") DIRECTORY,
        @JsonProperty("file") FILE,
        @JsonProperty("notebook") NOTEBOOK;

        /** Notebooks are recognized by their {@code .ipynb} extension. */
        static Type forFileName(String name) {
            return name.endsWith(".ipynb") ? NOTEBOOK : FILE;
        }
    }

    public enum Format {
        @JsonProperty("json") JSON,
        @JsonProperty("text") TEXT,
        @JsonProperty("base64") BASE64
    }

    public static ContentModel notebook(String path, JsonNode content) {
        return new ContentModel(nameOf(path), path, Type.NOTEBOOK, Format.JSON, null, null, content);
    }

    public static ContentModel textFile(String path, String text) {
        return new ContentModel(nameOf(path), path, Type.FILE, Format.TEXT, "text/plain", null, text);
    }

    public static ContentModel base64File(String path, String base64) {
        return new ContentModel(nameOf(path), path, Type.FILE, Format.BASE64, "application/octet-stream",
                null, base64);
    }

    public static ContentModel directory(String path) {
        return new ContentModel(nameOf(path), path, Type.DIRECTORY, null, null, null, null);
    }

    /** A directory read with content; the children double as its JSON content. */
    static ContentModel directory(String path, List<ContentModel> children) {
        List<ContentModel> listed = List.copyOf(children);
        return new ContentModel(nameOf(path), path, Type.DIRECTORY, Format.JSON, null, null, listed, listed);
    }

    public boolean hasContent() {
        return content != null;
    }

    static String nameOf(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
