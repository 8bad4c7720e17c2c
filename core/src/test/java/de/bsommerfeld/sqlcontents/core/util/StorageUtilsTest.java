package de.bsommerfeld.sqlcontents.core.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StorageUtilsTest {

    @Test
    void getAppDataDir_shouldContainAppName() {
        Path dir = StorageUtils.getAppDataDir("test-app");
        assertTrue(dir.toString().contains("test-app"));
    }

    @Test
    void getAppDataDir_shouldBeAbsolute() {
        Path dir = StorageUtils.getAppDataDir("test-app");
        assertTrue(dir.isAbsolute());
    }

    @Test
    void getAppDataDir_differentNames_shouldProduceDifferentPaths() {
        assertNotEquals(StorageUtils.getAppDataDir("app-one"), StorageUtils.getAppDataDir("app-two"));
    }

    @Test
    void getDefaultDatabaseFile_shouldLiveInAppDataDir() {
        Path db = StorageUtils.getDefaultDatabaseFile();

        assertEquals(StorageUtils.getAppDataDir(StorageUtils.APP_NAME), db.getParent());
        assertEquals("sqlcontents.db", db.getFileName().toString());
    }

    @Test
    void getDefaultConfigFile_shouldBeToml() {
        assertEquals("config.toml", StorageUtils.getDefaultConfigFile().getFileName().toString());
    }
}
