package com.storyroom;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyroom.models.EngineSettings;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Engine settings persisted as JSON under {@code <stories>/.story-room/engine-settings.json}.
 */
public class EngineSettingsStore {
    private final ObjectMapper objectMapper;
    private Path settingsPath;

    public EngineSettingsStore(Path storiesRoot, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        configure(storiesRoot);
    }

    public void configure(Path storiesRoot) {
        this.settingsPath = storiesRoot.resolve(".story-room").resolve("engine-settings.json");
    }

    public Path getSettingsPath() {
        return settingsPath;
    }

    /**
     * Missing or unreadable files yield the given defaults; a broken file is logged, not fatal.
     */
    public EngineSettings loadOrDefault(EngineSettings defaults) {
        if (settingsPath == null || !Files.exists(settingsPath)) {
            return defaults;
        }
        try {
            EngineSettings loaded = objectMapper.readValue(settingsPath.toFile(), EngineSettings.class);
            return loaded != null ? loaded : defaults;
        } catch (IOException e) {
            log("Could not read " + settingsPath + ", using defaults: " + e.getMessage());
            return defaults;
        }
    }

    public void save(EngineSettings settings) throws IOException {
        if (settingsPath == null || settings == null) {
            return;
        }
        Files.createDirectories(settingsPath.getParent());
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(settingsPath.toFile(), settings);
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[EngineSettingsStore] " + message);
        } else {
            System.out.println("[EngineSettingsStore] " + message);
        }
    }
}
