package com.storyroom.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyroom.StorySessionService;
import com.storyroom.condition.Condition;
import com.storyroom.condition.ConditionValidationException;
import com.storyroom.condition.Conditions;
import com.storyroom.engine.StoryEngine;
import com.storyroom.models.Node;
import com.storyroom.models.StorySession;
import com.storyroom.parser.StoryParseException;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.io.FileNotFoundException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP surface for playing stories: one session per player, driven by choice ids.
 */
public class StoryController implements Controller {
    private final StorySessionService sessionService;
    private final ObjectMapper objectMapper;

    public StoryController(StorySessionService sessionService, ObjectMapper objectMapper) {
        this.sessionService = sessionService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/stories", this::listStories);
        app.post("/api/sessions", this::createSession);
        app.get("/api/sessions/{id}", this::getSession);
        app.delete("/api/sessions/{id}", this::deleteSession);
        app.post("/api/sessions/{id}/choices/{nodeId}", this::makeChoice);
        app.post("/api/sessions/{id}/reset", this::resetSession);
        app.get("/api/sessions/{id}/graph", this::getGraph);
        app.put("/api/sessions/{id}/variables/{name}", this::setVariable);
        app.post("/api/sessions/{id}/conditions/evaluate", this::evaluateCondition);
    }

    private void listStories(Context ctx) {
        try {
            ctx.json(Map.of(
                "root", sessionService.getStoriesRoot().toString(),
                "stories", sessionService.listStories()
            ));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void createSession(Context ctx) {
        JsonNode json;
        try {
            json = readBody(ctx);
        } catch (Exception e) {
            ctx.status(400).json(Map.of("error", "Invalid JSON body"));
            return;
        }
        Boolean letPlayerChoose = json.hasNonNull("letPlayerChooseSingleChoice")
            ? json.get("letPlayerChooseSingleChoice").asBoolean()
            : null;
        try {
            StorySession session;
            if (json.hasNonNull("source")) {
                session = sessionService.createFromSource(json.get("source").asText(), letPlayerChoose);
            } else if (json.hasNonNull("file")) {
                session = sessionService.createFromFile(json.get("file").asText(), letPlayerChoose);
            } else {
                ctx.status(400).json(Map.of("error", "Either 'source' or 'file' is required"));
                return;
            }
            ctx.status(201).json(sessionView(session));
        } catch (StoryParseException | IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (SecurityException e) {
            ctx.status(403).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getSession(Context ctx) {
        StorySession session = sessionService.find(ctx.pathParam("id"));
        if (session == null) {
            sessionNotFound(ctx);
            return;
        }
        ctx.json(sessionView(session));
    }

    private void deleteSession(Context ctx) {
        if (!sessionService.remove(ctx.pathParam("id"))) {
            sessionNotFound(ctx);
            return;
        }
        ctx.status(204);
    }

    private void makeChoice(Context ctx) {
        String id = ctx.pathParam("id");
        int nodeId;
        try {
            nodeId = Integer.parseInt(ctx.pathParam("nodeId"));
        } catch (NumberFormatException e) {
            ctx.status(400).json(Map.of("error", "Choice id must be an integer"));
            return;
        }
        Boolean accepted = sessionService.makeChoice(id, nodeId);
        if (accepted == null) {
            sessionNotFound(ctx);
            return;
        }
        if (!accepted) {
            ctx.status(409).json(Map.of("error", "Choice " + nodeId + " is not available"));
            return;
        }
        ctx.json(sessionView(sessionService.find(id)));
    }

    private void resetSession(Context ctx) {
        String id = ctx.pathParam("id");
        if (!sessionService.reset(id)) {
            sessionNotFound(ctx);
            return;
        }
        ctx.json(sessionView(sessionService.find(id)));
    }

    private void getGraph(Context ctx) {
        Map<String, Object> graph = sessionService.withEngine(ctx.pathParam("id"), engine -> {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("nodes", new ArrayList<>(engine.getNodes().values()));
            body.put("edges", new ArrayList<>(engine.getEdges()));
            return body;
        });
        if (graph == null) {
            sessionNotFound(ctx);
            return;
        }
        ctx.json(graph);
    }

    private void setVariable(Context ctx) {
        JsonNode json;
        try {
            json = readBody(ctx);
        } catch (Exception e) {
            ctx.status(400).json(Map.of("error", "Invalid JSON body"));
            return;
        }
        String name = ctx.pathParam("name");
        Object value = Conditions.scalarValue(json.get("value"));
        try {
            if (!sessionService.setVariable(ctx.pathParam("id"), name, value)) {
                sessionNotFound(ctx);
                return;
            }
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("value", value);
        ctx.json(body);
    }

    private void evaluateCondition(Context ctx) {
        Condition condition;
        try {
            condition = Conditions.fromJson(readBody(ctx));
        } catch (ConditionValidationException e) {
            ctx.status(400).json(Controller.errorBody(e));
            return;
        } catch (Exception e) {
            ctx.status(400).json(Map.of("error", "Invalid JSON body"));
            return;
        }
        Boolean result = sessionService.evaluate(ctx.pathParam("id"), condition);
        if (result == null) {
            sessionNotFound(ctx);
            return;
        }
        ctx.json(Map.of("condition", condition.toString(), "result", result));
    }

    private JsonNode readBody(Context ctx) throws Exception {
        String body = ctx.body();
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        return objectMapper.readTree(body);
    }

    private void sessionNotFound(Context ctx) {
        ctx.status(404).json(Map.of("error", "Session not found: " + ctx.pathParam("id")));
    }

    /**
     * Snapshot of a session for the client: history, offered choices and stats.
     */
    Map<String, Object> sessionView(StorySession session) {
        synchronized (session) {
            StoryEngine engine = session.getEngine();
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("id", session.getId());
            view.put("story", session.getStoryName());
            view.put("history", engine.getStoryHistory());
            view.put("choices", choiceViews(engine.getAvailableChoices()));
            view.put("stats", engine.getStoryStats());
            view.put("containers", new LinkedHashMap<>(engine.getContainerStates()));
            view.put("variables", new LinkedHashMap<>(engine.getGameVariables()));
            view.put("turn", engine.getCurrentTurn());
            return view;
        }
    }

    static List<Map<String, Object>> choiceViews(List<Node> choices) {
        List<Map<String, Object>> views = new ArrayList<>();
        for (Node choice : choices) {
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("id", choice.getId());
            view.put("text", choice.getChoiceText());
            view.put("order", choice.getChoiceOrder());
            view.put("sticky", choice.isSticky());
            view.put("fallback", choice.isFallback());
            views.add(view);
        }
        return views;
    }
}
