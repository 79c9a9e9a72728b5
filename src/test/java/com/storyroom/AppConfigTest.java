package com.storyroom;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @Test
    void parsesEqualsAndSpaceSeparatedArgs() {
        AppConfig.Builder builder = new AppConfig.Builder()
            .parseArgs(new String[] {"--port=8081", "--stories", "tales", "--dev"});

        assertEquals(8081, builder.getPreferredPort());
        assertTrue(builder.isDevMode());
        assertEquals(Paths.get("tales").toAbsolutePath().normalize(), builder.getStoriesPath());
    }

    @Test
    void badPortKeepsDefault() {
        AppConfig.Builder builder = new AppConfig.Builder().parseArgs(new String[] {"--port", "abc"});
        assertEquals(7070, builder.getPreferredPort());
        assertFalse(builder.isDevMode());
    }

    @Test
    void storiesDefaultToPlatformFolder() {
        AppConfig.Builder builder = new AppConfig.Builder().parseArgs(new String[0]);
        assertEquals(AppConfig.getDefaultStoriesPath(), builder.getStoriesPath());
    }
}
