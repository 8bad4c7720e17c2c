package de.bsommerfeld.sqlcontents.core.path;

import de.bsommerfeld.sqlcontents.core.error.PathOutsideRootException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ApiPathsTest {

    @Test
    void normalizeApiPath_shouldCollapseDotsAndSlashes() {
        assertEquals("a/c", ApiPaths.normalizeApiPath("/a/./b/../c/"));
        assertEquals("a/b", ApiPaths.normalizeApiPath("a//b"));
        assertEquals("", ApiPaths.normalizeApiPath("/"));
        assertEquals("", ApiPaths.normalizeApiPath(""));
        assertEquals("", ApiPaths.normalizeApiPath("a/.."));
    }

    @Test
    void normalizeApiPath_escapingRoot_shouldThrow() {
        var ex = assertThrows(PathOutsideRootException.class, () -> ApiPaths.normalizeApiPath("a/../../etc"));
        assertEquals("a/../../etc", ex.getPath());
        assertThrows(PathOutsideRootException.class, () -> ApiPaths.normalizeApiPath(".."));
    }

    @Test
    void fromApiDirname_shouldWrapInSlashes() {
        assertEquals("/", ApiPaths.fromApiDirname(""));
        assertEquals("/a/", ApiPaths.fromApiDirname("a"));
        assertEquals("/a/b/", ApiPaths.fromApiDirname("a/b"));
    }

    @Test
    void fromApiFilename_shouldPrefixSlash() {
        assertEquals("/a/b.txt", ApiPaths.fromApiFilename("a/b.txt"));
        assertEquals("/x", ApiPaths.fromApiFilename("x"));
    }

    @Test
    void toApiPath_shouldStripSurroundingSlashes() {
        assertEquals("a/b", ApiPaths.toApiPath("/a/b/"));
        assertEquals("a/b.txt", ApiPaths.toApiPath("/a/b.txt"));
        assertEquals("", ApiPaths.toApiPath("/"));
    }

    @Test
    void splitApiFilepath_shouldSeparateDirectoryAndName() {
        assertEquals(new SplitPath("/a/b/", "c.txt"), ApiPaths.splitApiFilepath("a/b/c.txt"));
        assertEquals(new SplitPath("/", "top.txt"), ApiPaths.splitApiFilepath("top.txt"));
        assertEquals("/a/b/c.txt", ApiPaths.splitApiFilepath("a/b/c.txt").fullPath());
    }

    @Test
    void parentDirectory_shouldDropLastSegment() {
        assertEquals("/a/", ApiPaths.parentDirectory("/a/b/"));
        assertEquals("/", ApiPaths.parentDirectory("/a/"));
        assertNull(ApiPaths.parentDirectory("/"));
    }

    @Test
    void depth_shouldCountSegments() {
        assertEquals(0, ApiPaths.depth("/"));
        assertEquals(1, ApiPaths.depth("/a/"));
        assertEquals(3, ApiPaths.depth("/a/b/c/"));
    }

    @Test
    void isWithin_shouldMatchSelfAndDescendantsOnly() {
        assertTrue(ApiPaths.isWithin("/a/", "/a/"));
        assertTrue(ApiPaths.isWithin("/a/b/", "/a/"));
        assertFalse(ApiPaths.isWithin("/ab/", "/a/"));
        assertFalse(ApiPaths.isWithin("/a/", "/a/b/"));
    }
}
