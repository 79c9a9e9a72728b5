package com.storyroom.engine;

import com.storyroom.AppLogger;
import com.storyroom.condition.Condition;
import com.storyroom.condition.ContainerStateProvider;
import com.storyroom.models.ContainerState;
import com.storyroom.models.Edge;
import com.storyroom.models.EngineSettings;
import com.storyroom.models.Node;
import com.storyroom.models.NodeType;
import com.storyroom.models.StoryGraph;
import com.storyroom.models.StoryStats;
import com.storyroom.parser.StoryParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Walks a parsed story graph on behalf of one player.
 *
 * The engine owns all run-time state: current position, history, per-node visit counts,
 * consumed one-shot choices, per-container visitation state, game variables and the turn
 * counter. It is not thread-safe; drive it from one caller at a time.
 *
 * Protocol: {@link #start()} once, then {@link #makeChoice(Node)} with one of
 * {@link #getAvailableChoices()} until {@link #isComplete()}.
 */
public class StoryEngine implements ContainerStateProvider {

    static final String CHOICE_BULLET = "• ";

    private final EngineSettings settings;
    private final StoryListener listener;
    private final StoryGraph graph;

    private final Map<Integer, Node> nodes;
    private final List<Edge> edges;
    private final Map<Integer, Set<Integer>> successors = new HashMap<>();

    private final List<String> history = new ArrayList<>();
    private final Map<Integer, Integer> nodeVisited = new HashMap<>();
    private final Map<Integer, Boolean> nodeCanBeVisitedAgain = new HashMap<>();
    private final Map<String, ContainerState> containerStates = new LinkedHashMap<>();
    private final Map<String, Object> gameVariables = new LinkedHashMap<>();

    private int currentNodeId;
    private boolean complete;
    private int currentTurn;

    public StoryEngine(String source) {
        this(source, null, EngineSettings.defaults(), StoryListener.NONE);
    }

    public StoryEngine(String source, Path baseDir, EngineSettings settings, StoryListener listener) {
        this(new StoryParser(settingsOrDefault(settings).getTextSeparator()).parse(source, baseDir), settings, listener);
    }

    public StoryEngine(StoryGraph graph, EngineSettings settings, StoryListener listener) {
        this.settings = settingsOrDefault(settings).copy();
        this.listener = listener != null ? listener : StoryListener.NONE;
        this.graph = graph;
        this.nodes = new LinkedHashMap<>(graph.getNodes());
        this.edges = new ArrayList<>();
        for (Edge edge : graph.getEdges()) {
            addEdge(edge.getSource(), edge.getTarget());
        }

        this.currentNodeId = findStartNode();
        fillAutoEndNodes();
        initializeContainerStates();
    }

    /**
     * Reads a story file as UTF-8; INCLUDE directives resolve against the file's directory.
     */
    public static StoryEngine fromFile(Path file, EngineSettings settings, StoryListener listener) throws IOException {
        String source = Files.readString(file, StandardCharsets.UTF_8);
        Path baseDir = file.toAbsolutePath().getParent();
        return new StoryEngine(source, baseDir, settings, listener);
    }

    private static EngineSettings settingsOrDefault(EngineSettings settings) {
        return settings != null ? settings : EngineSettings.defaults();
    }

    // ---- graph preparation ----

    /**
     * Connects BEGIN to the story's first node unless the source already diverts from BEGIN.
     * The first node is the smallest id without an incoming edge; with no edges at all it is
     * the first node in parse order, or AUTO_END for an empty story.
     */
    int findStartNode() {
        if (successors.containsKey(Node.BEGIN_ID)) {
            return Node.BEGIN_ID;
        }

        Integer start = null;
        if (!edges.isEmpty()) {
            Set<Integer> targets = new HashSet<>();
            for (Edge edge : edges) {
                targets.add(edge.getTarget());
            }
            for (Integer id : nodes.keySet()) {
                if (!Node.isSentinelId(id) && !targets.contains(id) && (start == null || id < start)) {
                    start = id;
                }
            }
        }
        if (start == null) {
            start = firstStoryNode();
        }
        addEdge(Node.BEGIN_ID, start);
        return Node.BEGIN_ID;
    }

    private int firstStoryNode() {
        for (Integer id : nodes.keySet()) {
            if (!Node.isSentinelId(id)) {
                return id;
            }
        }
        return Node.AUTO_END_ID;
    }

    /**
     * Every node that is entered but never left gets an edge to AUTO_END.
     * Nodes that take part in no edge at all are left alone.
     */
    void fillAutoEndNodes() {
        Set<Integer> targets = new HashSet<>();
        for (Edge edge : edges) {
            targets.add(edge.getTarget());
        }
        for (Integer id : new ArrayList<>(nodes.keySet())) {
            if (!Node.isSentinelId(id) && !successors.containsKey(id) && targets.contains(id)) {
                addEdge(id, Node.AUTO_END_ID);
            }
        }
    }

    private void addEdge(int source, int target) {
        edges.add(new Edge(source, target));
        successors.computeIfAbsent(source, k -> new LinkedHashSet<>()).add(target);
    }

    private void initializeContainerStates() {
        for (Node node : nodes.values()) {
            for (String key : containerKeys(node)) {
                containerStates.putIfAbsent(key, new ContainerState());
            }
        }
    }

    private static List<String> containerKeys(Node node) {
        List<String> keys = new ArrayList<>(2);
        String knot = node.getKnotName();
        if (knot == null || Node.HEADER_SCOPE.equals(knot)) {
            return keys;
        }
        keys.add(knot);
        String stitch = node.getStitchName();
        if (stitch != null && !Node.HEADER_SCOPE.equals(stitch)) {
            keys.add(knot + "." + stitch);
        }
        return keys;
    }

    // ---- traversal ----

    public void start() {
        Node current = nodes.get(currentNodeId);
        if (current != null && current.hasContent()) {
            addContent(current.getContent());
        }
        log("INFO", "Story started at node " + currentNodeId);
        followPath();
        notifyChoicesUpdated();
    }

    /**
     * @return false when the story is over or the node is not one of the available choices
     */
    public boolean makeChoice(Node choice) {
        if (complete || choice == null) {
            return false;
        }
        Node chosen = null;
        for (Node available : getAvailableChoices()) {
            if (available.getId() == choice.getId()) {
                chosen = available;
                break;
            }
        }
        if (chosen == null) {
            log("WARN", "Rejected choice " + choice.getId() + " at node " + currentNodeId);
            return false;
        }

        currentTurn++;
        currentNodeId = chosen.getId();

        String choiceText = chosen.getChoiceText();
        if (choiceText != null && !choiceText.isBlank()) {
            addContent(CHOICE_BULLET + choiceText);
        }
        String content = chosen.getContent();
        if (content != null && !content.isBlank() && !content.equals(choiceText)) {
            addContent(content);
        }
        if (!chosen.isSticky()) {
            nodeCanBeVisitedAgain.put(chosen.getId(), false);
        }

        followPath();
        notifyChoicesUpdated();
        return true;
    }

    public boolean makeChoice(int nodeId) {
        Node node = nodes.get(nodeId);
        return node != null && makeChoice(node);
    }

    /**
     * Advances until choices are on offer or the story ends.
     */
    private void followPath() {
        boolean playerPicksSingle = settings.isLetPlayerChooseSingleChoice();
        Set<Integer> visited = new HashSet<>();

        while (visited.add(currentNodeId)) {
            markVisited(currentNodeId);

            List<Integer> next = getNextNodes(currentNodeId);
            if (next.isEmpty()) {
                finish(currentNodeId);
                return;
            }

            List<Node> choices = getChoiceNodes(next);
            if ((playerPicksSingle && !choices.isEmpty()) || choices.size() > 1) {
                return;
            }

            int nextId;
            if (!choices.isEmpty()) {
                nextId = choices.get(0).getId();
            } else {
                nextId = firstNonChoice(next);
            }
            currentNodeId = nextId;

            Node node = nodes.get(nextId);
            if (node != null && node.hasContent()) {
                switch (node.getType()) {
                    case BASE:
                    case GATHER:
                        addContent(node.getContent());
                        break;
                    case CHOICE:
                        if (!playerPicksSingle) {
                            addContent(node.getContent());
                        }
                        break;
                    default:
                        break;
                }
            }
        }
        log("WARN", "Traversal loop detected at node " + currentNodeId + "; stopping until the next choice");
    }

    // A consumed or gated choice is only walked into when nothing else leads on.
    private int firstNonChoice(List<Integer> next) {
        for (int id : next) {
            Node node = nodes.get(id);
            if (node == null || node.getType() != NodeType.CHOICE) {
                return id;
            }
        }
        return next.get(0);
    }

    private void finish(int nodeId) {
        Node node = nodes.get(nodeId);
        NodeType type = node != null ? node.getType() : null;
        if (type == NodeType.END) {
            addContent(settings.getEndOfStoryText());
        } else if (type == NodeType.AUTO_END) {
            addContent(settings.getAutoEndText());
        } else {
            throw new StoryInvariantException("Dead end on a node that is neither END nor AUTO_END", nodeId);
        }
        complete = true;
        log("INFO", "Story complete via " + type);
        listener.onStoryComplete();
    }

    private void markVisited(int nodeId) {
        nodeVisited.merge(nodeId, 1, Integer::sum);
        Node node = nodes.get(nodeId);
        if (node == null) {
            return;
        }
        for (String key : containerKeys(node)) {
            ContainerState state = containerStates.get(key);
            if (state != null) {
                state.markSeen(currentTurn);
            }
        }
    }

    List<Integer> getNextNodes(int nodeId) {
        Set<Integer> targets = successors.get(nodeId);
        if (targets == null) {
            return new ArrayList<>();
        }
        List<Integer> next = new ArrayList<>();
        for (int target : targets) {
            if (nodeCanBeVisitedAgain.getOrDefault(target, true)) {
                next.add(target);
            }
        }
        return next;
    }

    /**
     * Offerable choices among the given successors, in successor order.
     *
     * A choice is eligible when sticky or never visited. Eligible fallback choices are only
     * returned when no regular choice passes its condition. Each choice keeps the position it
     * had the first time it was considered.
     */
    List<Node> getChoiceNodes(List<Integer> nodeIds) {
        List<Node> choices = new ArrayList<>();
        List<Node> fallbacks = new ArrayList<>();
        int order = 1;
        for (int id : nodeIds) {
            Node node = nodes.get(id);
            if (node == null || node.getType() != NodeType.CHOICE) {
                continue;
            }
            if (node.isSticky() || !nodeVisited.containsKey(id)) {
                if (node.getChoiceOrder() == null) {
                    node.setChoiceOrder(order);
                }
                if (node.isFallback()) {
                    fallbacks.add(node);
                } else if (conditionHolds(node.getCondition())) {
                    choices.add(node);
                }
            }
            order++;
        }
        return choices.isEmpty() ? fallbacks : choices;
    }

    private boolean conditionHolds(Condition condition) {
        return condition == null || condition.evaluate(this);
    }

    public List<Node> getAvailableChoices() {
        if (complete) {
            return new ArrayList<>();
        }
        return getChoiceNodes(getNextNodes(currentNodeId));
    }

    /**
     * Back to the start with an empty history. Visit counts, consumed choices, container
     * states, variables and the turn counter carry over.
     */
    public void reset() {
        history.clear();
        currentNodeId = findStartNode();
        complete = false;
        log("INFO", "Story reset");
    }

    private void addContent(String content) {
        history.add(content);
        listener.onContentAdded(content);
    }

    private void notifyChoicesUpdated() {
        listener.onChoicesUpdated(getAvailableChoices());
    }

    // ---- state access ----

    @Override
    public ContainerState getContainerState(String containerReference) {
        if (containerReference == null) {
            throw new IllegalArgumentException("A container reference is required");
        }
        return containerStates.get(containerReference);
    }

    @Override
    public Map<String, Object> getGameVariables() {
        return Collections.unmodifiableMap(gameVariables);
    }

    @Override
    public int getCurrentTurn() {
        return currentTurn;
    }

    /**
     * Sets a game variable read by variable conditions; a null value removes it.
     */
    public void setVariable(String name, Object value) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Variable name is required");
        }
        if (value == null) {
            gameVariables.remove(name);
        } else {
            gameVariables.put(name, value);
        }
    }

    public Map<String, ContainerState> getContainerStates() {
        return Collections.unmodifiableMap(containerStates);
    }

    public List<String> getStoryHistory() {
        return new ArrayList<>(history);
    }

    public StoryStats getStoryStats() {
        return new StoryStats(nodes.size(), edges.size(), currentNodeId, history.size(),
            getAvailableChoices().size(), complete);
    }

    public int getVisitCount(int nodeId) {
        return nodeVisited.getOrDefault(nodeId, 0);
    }

    public Map<Integer, Node> getNodes() {
        return Collections.unmodifiableMap(nodes);
    }

    public Node getNode(int nodeId) {
        return nodes.get(nodeId);
    }

    /**
     * Parsed edges plus the BEGIN and AUTO_END edges added by the engine.
     */
    public List<Edge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public StoryGraph getGraph() {
        return graph;
    }

    public int getCurrentNodeId() {
        return currentNodeId;
    }

    public boolean isComplete() {
        return complete;
    }

    public EngineSettings getSettings() {
        return settings.copy();
    }

    private void log(String level, String message) {
        AppLogger logger = AppLogger.get();
        if (logger == null) {
            System.out.println("[StoryEngine] " + message);
        } else if ("WARN".equals(level)) {
            logger.warn("[StoryEngine] " + message);
        } else {
            logger.info("[StoryEngine] " + message);
        }
    }
}
