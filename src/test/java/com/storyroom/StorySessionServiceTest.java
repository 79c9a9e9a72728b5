package com.storyroom;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyroom.condition.UnaryCondition;
import com.storyroom.models.ContainerStatus;
import com.storyroom.models.EngineSettings;
import com.storyroom.models.Node;
import com.storyroom.models.StorySession;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StorySessionServiceTest {

    private static final String HELLO = "Hello\n* A -> a\n* B -> b\n== a ==\nGot A\n== b ==\nGot B";

    private StorySessionService service(Path dir) {
        return new StorySessionService(dir, new EngineSettingsStore(dir, new ObjectMapper()));
    }

    private int choiceId(StorySession session, String text) {
        for (Node node : session.getEngine().getAvailableChoices()) {
            if (text.equals(node.getChoiceText())) {
                return node.getId();
            }
        }
        throw new AssertionError("Choice not available: " + text);
    }

    private boolean hasLine(List<String> history, String line) {
        return history.stream().anyMatch(entry -> entry.trim().equals(line));
    }

    @Test
    void createdSessionIsStarted(@TempDir Path dir) {
        StorySessionService service = service(dir);
        StorySession session = service.createFromSource(HELLO, null);

        assertNotNull(service.find(session.getId()));
        assertEquals("inline", session.getStoryName());
        assertEquals(List.of("Hello"), session.getEngine().getStoryHistory());
    }

    @Test
    void choicesAreRoutedToTheSession(@TempDir Path dir) {
        StorySessionService service = service(dir);
        StorySession session = service.createFromSource(HELLO, null);

        assertNull(service.makeChoice("no-such-session", 1));
        assertEquals(Boolean.FALSE, service.makeChoice(session.getId(), 9999));
        assertEquals(Boolean.TRUE, service.makeChoice(session.getId(), choiceId(session, "B")));
        assertTrue(session.getEngine().isComplete());
    }

    @Test
    void resetRestartsTheSession(@TempDir Path dir) {
        StorySessionService service = service(dir);
        StorySession session = service.createFromSource(HELLO, null);
        service.makeChoice(session.getId(), choiceId(session, "A"));

        assertTrue(service.reset(session.getId()));
        assertFalse(session.getEngine().isComplete());
        assertEquals(List.of("Hello"), session.getEngine().getStoryHistory());
        assertFalse(service.reset("no-such-session"));
    }

    @Test
    void variablesAndConditionsUseSessionState(@TempDir Path dir) {
        StorySessionService service = service(dir);
        StorySession session = service.createFromSource(HELLO, null);
        UnaryCondition rich = UnaryCondition.variableGt("gold", 10);

        assertEquals(Boolean.FALSE, service.evaluate(session.getId(), rich));
        assertTrue(service.setVariable(session.getId(), "gold", 11));
        assertEquals(Boolean.TRUE, service.evaluate(session.getId(), rich));
        assertNull(service.evaluate("no-such-session", rich));
    }

    @Test
    void removeDiscardsSession(@TempDir Path dir) {
        StorySessionService service = service(dir);
        StorySession session = service.createFromSource(HELLO, null);
        assertTrue(service.remove(session.getId()));
        assertNull(service.find(session.getId()));
        assertFalse(service.remove(session.getId()));
    }

    @Test
    void storedSettingsApplyAndFlagOverrides(@TempDir Path dir) throws Exception {
        EngineSettingsStore store = new EngineSettingsStore(dir, new ObjectMapper());
        EngineSettings settings = EngineSettings.defaults();
        settings.setAutoEndText("That's all.");
        store.save(settings);
        StorySessionService service = new StorySessionService(dir, store);

        StorySession session = service.createFromSource("Intro\n* Only way\n- After", false);

        assertEquals(List.of("Intro", "Only way", "After", "That's all."), session.getEngine().getStoryHistory());
    }

    @Test
    void storyFilesMustStayInsideStoriesFolder(@TempDir Path dir) {
        StorySessionService service = service(dir.resolve("stories"));
        assertThrows(SecurityException.class, () -> service.createFromFile("../secret.ink", null));
        assertThrows(FileNotFoundException.class, () -> service.createFromFile("absent.ink", null));
        assertThrows(IllegalArgumentException.class, () -> service.createFromFile(" ", null));
    }

    @Test
    void seededExampleStoryPlaysToTheEnd(@TempDir Path dir) throws Exception {
        StorySessionService service = service(dir);
        assertTrue(service.seedExamples());
        assertFalse(service.seedExamples());
        assertEquals(List.of("epilogue.ink", "the-forest.ink"), service.listStories());

        StorySession session = service.createFromFile("the-forest.ink", null);
        assertEquals("the-forest.ink", session.getStoryName());
        List<String> opening = session.getEngine().getStoryHistory();
        assertEquals(List.of("You wake at the edge of a dark forest."), opening);

        assertEquals(Boolean.TRUE, service.makeChoice(session.getId(), choiceId(session, "Walk into the forest")));
        assertTrue(hasLine(session.getEngine().getStoryHistory(), "The forest is quiet."));
        assertEquals(2, session.getEngine().getAvailableChoices().size());

        assertEquals(Boolean.TRUE, service.makeChoice(session.getId(), choiceId(session, "Listen to the birds")));
        List<String> history = session.getEngine().getStoryHistory();
        assertTrue(hasLine(history, "You keep walking."));
        assertTrue(hasLine(history, "The way home is shorter than you remember."));
        assertEquals(EngineSettings.DEFAULT_END_TEXT, history.get(history.size() - 1));
        assertEquals(ContainerStatus.SEEN, session.getEngine().getContainerState("forest.deeper").getStatus());
        assertEquals(ContainerStatus.NOT_CLICKED, session.getEngine().getContainerState("clearing").getStatus());
    }

    @Test
    void includesCannotLeaveStoriesFolder(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("secret.txt"), "TOP SECRET");
        Path stories = Files.createDirectories(dir.resolve("stories"));
        Files.writeString(stories.resolve("escape.ink"), "Hi\nINCLUDE ../secret.txt");
        StorySessionService service = service(stories);

        assertThrows(SecurityException.class, () -> service.createFromSource("Hi\nINCLUDE ../secret.txt", null));
        assertThrows(SecurityException.class, () -> service.createFromFile("escape.ink", null));
        assertTrue(service.listSessions().isEmpty());
    }

    @Test
    void includesInsideStoriesFolderStillWork(@TempDir Path dir) throws Exception {
        Files.createDirectories(dir.resolve("parts"));
        Files.writeString(dir.resolve("parts").resolve("end.ink"), "== finale ==\nThe end.\n-> END");
        StorySessionService service = service(dir);

        StorySession session = service.createFromSource("Start -> finale\nINCLUDE parts/end.ink", null);
        assertEquals(List.of("Start", "The end.", EngineSettings.DEFAULT_END_TEXT), session.getEngine().getStoryHistory());
    }
}
