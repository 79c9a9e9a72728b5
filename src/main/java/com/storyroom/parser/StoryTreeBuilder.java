package com.storyroom.parser;

import com.storyroom.AppLogger;
import com.storyroom.models.Node;
import com.storyroom.models.NodeType;
import com.storyroom.models.RawKnot;
import com.storyroom.models.RawStory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Groups the merged node stream into story header, knots and stitches in a single pass.
 * Content nodes are post-processed on the way in and tagged with their owning knot and
 * stitch names.
 */
public class StoryTreeBuilder {

    private final NodePostProcessor postProcessor;

    private final Map<Integer, Node> header = new LinkedHashMap<>();
    private final Map<Integer, RawKnot> knots = new LinkedHashMap<>();
    private final Map<Integer, Node> knotsInfo = new LinkedHashMap<>();

    private Integer currentKnotId;
    private Map<Integer, Node> currentKnotHeader = new LinkedHashMap<>();
    private Map<Integer, Map<Integer, Node>> currentStitches = new LinkedHashMap<>();
    private Map<Integer, Node> currentStitchesInfo = new LinkedHashMap<>();
    private Integer currentStitchId;

    private String currentKnotName = Node.HEADER_SCOPE;
    private String currentStitchName = Node.HEADER_SCOPE;

    public StoryTreeBuilder(NodePostProcessor postProcessor) {
        this.postProcessor = postProcessor;
    }

    public RawStory build(Collection<Node> nodes) {
        for (Node node : nodes) {
            process(node);
        }
        finalizeCurrentKnot();
        return new RawStory(header, knots, knotsInfo);
    }

    public void process(Node node) {
        if (node.getType() == NodeType.KNOT) {
            startKnot(node);
        } else if (node.getType() == NodeType.STITCHES) {
            startStitch(node);
        } else {
            Node divert = postProcessor.process(node);
            addContent(node, divert);
        }
    }

    private void startKnot(Node node) {
        finalizeCurrentKnot();
        String name = node.getName() != null && !node.getName().isEmpty() ? node.getName() : Node.HEADER_SCOPE;
        node.setKnotName(name);
        node.setStitchName(Node.HEADER_SCOPE);
        knotsInfo.put(node.getId(), node);
        currentKnotId = node.getId();
        currentKnotName = name;
        currentStitchName = Node.HEADER_SCOPE;
    }

    private void startStitch(Node node) {
        if (currentKnotId == null) {
            log("Stitch '" + node.getName() + "' at line " + node.getLineNumber()
                + " is outside any knot; its content stays in the story header");
            return;
        }
        String name = node.getName() != null && !node.getName().isEmpty() ? node.getName() : Node.HEADER_SCOPE;
        node.setKnotName(currentKnotName);
        node.setStitchName(name);
        currentStitchesInfo.put(node.getId(), node);
        currentStitches.put(node.getId(), new LinkedHashMap<>());
        currentStitchId = node.getId();
        currentStitchName = name;
    }

    private void addContent(Node node, Node divert) {
        tag(node);
        Map<Integer, Node> target;
        if (currentKnotId == null) {
            target = header;
        } else if (currentStitchId != null) {
            target = currentStitches.get(currentStitchId);
        } else {
            target = currentKnotHeader;
        }
        target.put(node.getId(), node);
        if (divert != null) {
            tag(divert);
            target.put(divert.getId(), divert);
        }
    }

    private void tag(Node node) {
        node.setKnotName(currentKnotName);
        node.setStitchName(currentStitchName);
    }

    private void finalizeCurrentKnot() {
        if (currentKnotId != null && (!currentKnotHeader.isEmpty() || !currentStitches.isEmpty())) {
            knots.put(currentKnotId, new RawKnot(currentKnotHeader, currentStitches, currentStitchesInfo));
        }
        currentKnotHeader = new LinkedHashMap<>();
        currentStitches = new LinkedHashMap<>();
        currentStitchesInfo = new LinkedHashMap<>();
        currentStitchId = null;
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[StoryTreeBuilder] " + message);
        } else {
            System.out.println("[StoryTreeBuilder] " + message);
        }
    }
}
