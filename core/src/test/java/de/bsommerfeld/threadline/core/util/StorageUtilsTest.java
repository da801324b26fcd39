package de.bsommerfeld.threadline.core.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StorageUtilsTest {

    @Test
    void getConfigDir_shouldEndWithAppName() {
        Path dir = StorageUtils.getConfigDir("threadline-test");
        assertEquals("threadline-test", dir.getFileName().toString());
    }

    @Test
    void defaultConfigFile_shouldLiveInThreadlineDir() {
        Path file = StorageUtils.defaultConfigFile();

        assertEquals("threadline.toml", file.getFileName().toString());
        assertEquals("threadline", file.getParent().getFileName().toString());
    }
}
