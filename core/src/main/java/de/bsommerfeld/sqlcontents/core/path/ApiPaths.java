package de.bsommerfeld.sqlcontents.core.path;

import de.bsommerfeld.sqlcontents.core.error.PathOutsideRootException;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Conversions between the slash-separated paths callers use ("API paths") and
 * the canonical representation stored in the database.
 *
 * <ul>
 * <li>API path: no leading or trailing slash, root is {@code ""}, e.g.
 * {@code notes/todo.txt}</li>
 * <li>Canonical directory: starts and ends with {@code /}, root is
 * {@code /}, e.g. {@code /notes/}</li>
 * <li>Canonical file: starts with {@code /}, e.g. {@code /notes/todo.txt}</li>
 * </ul>
 *
 * All methods are pure; none of them touch the database.
 */
public final class ApiPaths {

    public static final String ROOT = "/";

    private ApiPaths() {
    }

    /**
     * Resolves {@code .} and {@code ..} segments, collapses repeated slashes
     * and strips surrounding slashes.
     *
     * @throws PathOutsideRootException if {@code ..} climbs above the root
     */
    public static String normalizeApiPath(String apiPath) {
        if (apiPath == null || apiPath.isEmpty())
            return "";

        Deque<String> segments = new ArrayDeque<>();
        for (String segment : apiPath.split("/")) {
            if (segment.isEmpty() || ".".equals(segment))
                continue;
            if ("..".equals(segment)) {
                if (segments.isEmpty()) {
                    throw new PathOutsideRootException(apiPath);
                }
                segments.removeLast();
            } else {
                segments.addLast(segment);
            }
        }
        return String.join("/", segments);
    }

    /** {@code ""} becomes {@code /}, {@code a/b} becomes {@code /a/b/}. */
    public static String fromApiDirname(String apiDirname) {
        if (apiDirname.isEmpty() || ROOT.equals(apiDirname))
            return ROOT;
        StringBuilder sb = new StringBuilder(apiDirname.length() + 2);
        if (!apiDirname.startsWith("/"))
            sb.append('/');
        sb.append(apiDirname);
        if (!apiDirname.endsWith("/"))
            sb.append('/');
        return sb.toString();
    }

    /** {@code a/b.txt} becomes {@code /a/b.txt}. */
    public static String fromApiFilename(String apiPath) {
        return apiPath.startsWith("/") ? apiPath : "/" + apiPath;
    }

    /** Strips all leading and trailing slashes from a canonical path. */
    public static String toApiPath(String dbPath) {
        int start = 0;
        int end = dbPath.length();
        while (start < end && dbPath.charAt(start) == '/')
            start++;
        while (end > start && dbPath.charAt(end - 1) == '/')
            end--;
        return dbPath.substring(start, end);
    }

    /**
     * Splits an API file path at its last slash. A path without a slash lives
     * in the root directory.
     */
    public static SplitPath splitApiFilepath(String apiPath) {
        int idx = apiPath.lastIndexOf('/');
        if (idx < 0)
            return new SplitPath(ROOT, apiPath);
        return new SplitPath(fromApiDirname(apiPath.substring(0, idx)), apiPath.substring(idx + 1));
    }

    /**
     * Returns the canonical parent of a canonical directory, e.g.
     * {@code /a/b/} becomes {@code /a/}. The root has no parent.
     *
     * @return the parent, or {@code null} for the root
     */
    public static String parentDirectory(String canonicalDir) {
        if (ROOT.equals(canonicalDir))
            return null;
        // '/foo/bar/buzz/' -> '/foo/bar/'
        return canonicalDir.substring(0, canonicalDir.lastIndexOf('/', canonicalDir.length() - 2) + 1);
    }

    /** Number of path segments of a canonical directory; the root is 0. */
    public static int depth(String canonicalDir) {
        int slashes = 0;
        for (int i = 0; i < canonicalDir.length(); i++) {
            if (canonicalDir.charAt(i) == '/')
                slashes++;
        }
        return slashes - 1;
    }

    /**
     * Whether {@code candidate} is {@code dir} itself or lies beneath it. Both
     * arguments are canonical directories.
     */
    public static boolean isWithin(String candidate, String dir) {
        return candidate.startsWith(dir);
    }
}
