package com.storyroom.parser;

import com.storyroom.AppLogger;
import com.storyroom.models.Edge;
import com.storyroom.models.Node;
import com.storyroom.models.NodeType;
import com.storyroom.models.RawKnot;
import com.storyroom.models.RawStory;
import com.storyroom.models.StoryGraph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a {@link RawStory} into a flat directed graph.
 *
 * Blocks are processed one at a time (story header, then each knot's header and stitches in
 * parse order) with a fresh level stack per block:
 *   - paragraphs and choices hang off the last node one level up;
 *   - a gather at level L receives an edge from every leaf of every level-L sibling, then
 *     takes the place of the last level L-1 node;
 *   - a divert links the last node at its level to the named target.
 *
 * A knot or stitch that opens with a divert has no content of its own; its name resolves
 * straight to the divert's target, following chains of such blocks.
 */
public class GraphBuilder {

    private static final Map<String, Integer> RESERVED_TARGETS = Map.of(
        "END", Node.END_ID,
        "DONE", Node.END_ID,
        "BEGIN", Node.BEGIN_ID,
        "AUTO_END", Node.AUTO_END_ID
    );

    public StoryGraph build(RawStory story) {
        Map<Integer, Node> nodes = new LinkedHashMap<>();
        List<Edge> edges = new ArrayList<>();
        List<Node> diverts = new ArrayList<>();
        Map<String, Integer> rawGlobal = story.getBlockNameToId();

        Map<Integer, Integer> redirects = new HashMap<>();
        for (RawKnot knot : story.getKnots().values()) {
            Map<String, Integer> rawLocal = knot.getBlockNameToId();
            for (Map<Integer, Node> block : knot.getBlocks()) {
                if (block.isEmpty()) {
                    continue;
                }
                Node first = block.values().iterator().next();
                if (first.getType() == NodeType.DIVERT) {
                    redirects.put(first.getId(), resolveTarget(first, rawLocal, rawGlobal));
                }
            }
        }

        Map<String, Integer> global = followRedirects(rawGlobal, redirects, story);
        processBlock(story.getHeader(), Map.of(), global, true, nodes, edges, diverts);
        for (RawKnot knot : story.getKnots().values()) {
            Map<String, Integer> local = followRedirects(knot.getBlockNameToId(), redirects, story);
            for (Map<Integer, Node> block : knot.getBlocks()) {
                processBlock(block, local, global, false, nodes, edges, diverts);
            }
        }

        nodes.put(Node.END_ID, Node.endNode());
        nodes.put(Node.BEGIN_ID, Node.beginNode());
        nodes.put(Node.AUTO_END_ID, Node.autoEndNode());
        return new StoryGraph(nodes, edges, diverts);
    }

    private static Map<String, Integer> followRedirects(Map<String, Integer> table, Map<Integer, Integer> redirects,
                                                        RawStory story) {
        Map<String, Integer> result = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : table.entrySet()) {
            int id = entry.getValue();
            Set<Integer> seen = new HashSet<>();
            while (redirects.containsKey(id)) {
                if (!seen.add(id)) {
                    throw new StoryParseException("Divert cycle with no content", story.getNode(id).getLineNumber(),
                        entry.getKey());
                }
                id = redirects.get(id);
            }
            result.put(entry.getKey(), id);
        }
        return result;
    }

    void processBlock(Map<Integer, Node> block, Map<String, Integer> local, Map<String, Integer> global,
                      boolean storyHeader, Map<Integer, Node> nodes, List<Edge> edges, List<Node> diverts) {
        Map<Integer, List<Integer>> nodeAtLevel = new HashMap<>();
        Set<Integer> blockIds = new HashSet<>();
        for (Node node : block.values()) {
            if (node.getType() != NodeType.DIVERT) {
                blockIds.add(node.getId());
            }
        }

        Integer firstId = block.isEmpty() ? null : block.keySet().iterator().next();
        for (Node node : block.values()) {
            int level = node.getLevel();
            switch (node.getType()) {
                case BASE:
                case CHOICE: {
                    nodes.put(node.getId(), node);
                    atLevel(nodeAtLevel, level).add(node.getId());
                    Integer parent = level > 0 ? lastAt(nodeAtLevel, level - 1) : null;
                    if (parent != null) {
                        edges.add(new Edge(parent, node.getId()));
                    }
                    break;
                }
                case GATHER:
                    nodes.put(node.getId(), node);
                    connectGather(node, nodeAtLevel, blockIds, edges);
                    break;
                case DIVERT:
                    diverts.add(node);
                    if (!storyHeader && firstId == node.getId()) {
                        // block entry, already folded into the name tables
                        break;
                    }
                    connectDivert(node, nodeAtLevel, local, global, storyHeader, edges);
                    break;
                default:
                    break;
            }
        }
    }

    private void connectGather(Node gather, Map<Integer, List<Integer>> nodeAtLevel, Set<Integer> blockIds,
                               List<Edge> edges) {
        int level = gather.getLevel();
        List<Integer> siblings = atLevel(nodeAtLevel, level);
        if (siblings.isEmpty()) {
            Integer parent = lastAt(nodeAtLevel, level - 1);
            if (parent != null) {
                edges.add(new Edge(parent, gather.getId()));
            }
        }
        for (int sibling : siblings) {
            // branches that divert out of the block do not fall through to the gather
            for (int leaf : LeafFinder.findLeaves(sibling, edges)) {
                Edge edge = new Edge(leaf, gather.getId());
                if (leaf != gather.getId() && blockIds.contains(leaf) && !edges.contains(edge)) {
                    edges.add(edge);
                }
            }
        }

        nodeAtLevel.keySet().removeIf(l -> l >= level);
        List<Integer> parentLevel = atLevel(nodeAtLevel, level - 1);
        if (parentLevel.isEmpty()) {
            parentLevel.add(gather.getId());
        } else {
            parentLevel.set(parentLevel.size() - 1, gather.getId());
        }
    }

    private void connectDivert(Node divert, Map<Integer, List<Integer>> nodeAtLevel, Map<String, Integer> local,
                               Map<String, Integer> global, boolean storyHeader, List<Edge> edges) {
        int target = resolveTarget(divert, local, global);

        Integer anchor = null;
        for (int level = divert.getLevel(); level >= 0 && anchor == null; level--) {
            anchor = lastAt(nodeAtLevel, level);
        }
        if (anchor == null && storyHeader) {
            anchor = Node.BEGIN_ID;
        }
        if (anchor == null) {
            log("Divert to '" + divert.getName() + "' at line " + divert.getLineNumber()
                + " has no preceding content in its block and is ignored");
            return;
        }
        edges.add(new Edge(anchor, target));
    }

    /**
     * Reserved names first, then the knot-local stitch table, then the story-wide table.
     */
    public int resolveTarget(Node divert, Map<String, Integer> local, Map<String, Integer> global) {
        String name = divert.getName() != null ? divert.getName().strip() : "";
        Integer reserved = RESERVED_TARGETS.get(name);
        if (reserved != null) {
            return reserved;
        }
        Integer id = local.get(name);
        if (id == null) {
            id = global.get(name);
        }
        if (id == null) {
            throw new StoryParseException("Unresolved divert target", divert.getLineNumber(), name);
        }
        return id;
    }

    private static List<Integer> atLevel(Map<Integer, List<Integer>> nodeAtLevel, int level) {
        return nodeAtLevel.computeIfAbsent(level, k -> new ArrayList<>());
    }

    private static Integer lastAt(Map<Integer, List<Integer>> nodeAtLevel, int level) {
        List<Integer> ids = nodeAtLevel.get(level);
        return ids == null || ids.isEmpty() ? null : ids.get(ids.size() - 1);
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[GraphBuilder] " + message);
        } else {
            System.out.println("[GraphBuilder] " + message);
        }
    }
}
