package com.storyroom;

import com.storyroom.condition.Condition;
import com.storyroom.engine.StoryEngine;
import com.storyroom.engine.StoryListener;
import com.storyroom.models.EngineSettings;
import com.storyroom.models.StoryGraph;
import com.storyroom.models.StorySession;
import com.storyroom.parser.StoryParser;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Owns the running story sessions and the story folder they are loaded from.
 * Sessions may be used from several request threads; each engine is only ever touched
 * while holding its session's lock.
 */
public class StorySessionService {

    public static final String STORY_EXTENSION = ".ink";
    static final List<String> EXAMPLE_STORIES = List.of("the-forest.ink", "epilogue.ink");

    private final Path storiesRoot;
    private final EngineSettingsStore settingsStore;
    private final Map<String, StorySession> sessions = new ConcurrentHashMap<>();

    public StorySessionService(Path storiesRoot, EngineSettingsStore settingsStore) {
        this.storiesRoot = storiesRoot.toAbsolutePath().normalize();
        this.settingsStore = settingsStore;
    }

    public Path getStoriesRoot() {
        return storiesRoot;
    }

    /**
     * Story files directly under the stories folder, sorted by name.
     */
    public List<String> listStories() throws IOException {
        if (!Files.isDirectory(storiesRoot)) {
            return new ArrayList<>();
        }
        try (Stream<Path> files = Files.list(storiesRoot)) {
            return files
                .filter(Files::isRegularFile)
                .map(p -> p.getFileName().toString())
                .filter(name -> name.endsWith(STORY_EXTENSION))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    /**
     * Copies the bundled example stories into an empty stories folder.
     *
     * @return true when the examples were written
     */
    public boolean seedExamples() throws IOException {
        if (!listStories().isEmpty()) {
            return false;
        }
        Files.createDirectories(storiesRoot);
        for (String name : EXAMPLE_STORIES) {
            try (InputStream in = StorySessionService.class.getResourceAsStream("/stories/" + name)) {
                if (in == null) {
                    throw new FileNotFoundException("Bundled story missing from classpath: " + name);
                }
                Files.copy(in, storiesRoot.resolve(name), StandardCopyOption.REPLACE_EXISTING);
            }
        }
        log("Seeded example stories into " + storiesRoot);
        return true;
    }

    /**
     * @param letPlayerChooseSingleChoice overrides the stored setting when non-null
     */
    public StorySession createFromSource(String source, Boolean letPlayerChooseSingleChoice) {
        EngineSettings settings = settingsFor(letPlayerChooseSingleChoice);
        StoryEngine engine = newEngine(source, storiesRoot, settings);
        return register("inline", engine);
    }

    public StorySession createFromFile(String fileName, Boolean letPlayerChooseSingleChoice) throws IOException {
        Path file = resolveStory(fileName);
        if (!Files.isRegularFile(file)) {
            throw new FileNotFoundException("Story not found: " + fileName);
        }
        EngineSettings settings = settingsFor(letPlayerChooseSingleChoice);
        String source = Files.readString(file, StandardCharsets.UTF_8);
        StoryEngine engine = newEngine(source, file.getParent(), settings);
        return register(storiesRoot.relativize(file).toString().replace('\\', '/'), engine);
    }

    /**
     * INCLUDE directives are confined to the stories folder.
     *
     * @throws SecurityException if an included file lies outside it
     */
    private StoryEngine newEngine(String source, Path baseDir, EngineSettings settings) {
        StoryGraph graph = new StoryParser(settings.getTextSeparator(), storiesRoot).parse(source, baseDir);
        return new StoryEngine(graph, settings, StoryListener.NONE);
    }

    private EngineSettings settingsFor(Boolean letPlayerChooseSingleChoice) {
        EngineSettings settings = settingsStore != null
            ? settingsStore.loadOrDefault(EngineSettings.defaults()).copy()
            : EngineSettings.defaults();
        if (letPlayerChooseSingleChoice != null) {
            settings.setLetPlayerChooseSingleChoice(letPlayerChooseSingleChoice);
        }
        return settings;
    }

    private StorySession register(String storyName, StoryEngine engine) {
        StorySession session = new StorySession(UUID.randomUUID().toString(), storyName, engine);
        synchronized (session) {
            engine.start();
        }
        sessions.put(session.getId(), session);
        log("Session " + session.getId() + " created for " + storyName);
        return session;
    }

    /**
     * @throws SecurityException if the name escapes the stories folder
     */
    Path resolveStory(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("Story file name is required");
        }
        String normalized = fileName.replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        Path resolved = storiesRoot.resolve(normalized).normalize();
        if (!resolved.startsWith(storiesRoot)) {
            throw new SecurityException("Path escapes stories folder: " + fileName);
        }
        return resolved;
    }

    public StorySession find(String sessionId) {
        return sessionId != null ? sessions.get(sessionId) : null;
    }

    public Collection<StorySession> listSessions() {
        return Collections.unmodifiableCollection(sessions.values());
    }

    /**
     * Runs {@code action} against the session's engine under the session lock.
     *
     * @return null when the session does not exist
     */
    public <T> T withEngine(String sessionId, Function<StoryEngine, T> action) {
        StorySession session = find(sessionId);
        if (session == null) {
            return null;
        }
        synchronized (session) {
            return action.apply(session.getEngine());
        }
    }

    /**
     * @return null for an unknown session, otherwise whether the engine accepted the choice
     */
    public Boolean makeChoice(String sessionId, int nodeId) {
        return withEngine(sessionId, engine -> engine.makeChoice(nodeId));
    }

    public boolean reset(String sessionId) {
        Boolean done = withEngine(sessionId, engine -> {
            engine.reset();
            engine.start();
            return true;
        });
        return done != null;
    }

    public boolean setVariable(String sessionId, String name, Object value) {
        Boolean done = withEngine(sessionId, engine -> {
            engine.setVariable(name, value);
            return true;
        });
        return done != null;
    }

    /**
     * @return null for an unknown session
     */
    public Boolean evaluate(String sessionId, Condition condition) {
        return withEngine(sessionId, condition::evaluate);
    }

    public boolean remove(String sessionId) {
        StorySession removed = sessionId != null ? sessions.remove(sessionId) : null;
        if (removed != null) {
            log("Session " + sessionId + " removed");
        }
        return removed != null;
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[StorySessionService] " + message);
        } else {
            System.out.println("[StorySessionService] " + message);
        }
    }
}
