package com.storyroom.parser;

import com.storyroom.models.Node;
import com.storyroom.models.NodeType;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inline syntax applied once to each content node after merging:
 * divert arrows, choice brackets, glue markers and trailing tags, in that order.
 */
public class NodePostProcessor {

    private static final String DIVERT_ARROW = "->";
    private static final String GLUE = "<>";
    // [inside], ignoring escaped \[ and \]
    private static final Pattern BRACKETS = Pattern.compile("(?<!\\\\)\\[(.*?)(?<!\\\\)]", Pattern.DOTALL);

    private final NodeIdAllocator ids;

    public NodePostProcessor(NodeIdAllocator ids) {
        this.ids = ids;
    }

    /**
     * @return the divert node split off this node's content, or null
     */
    public Node process(Node node) {
        Node divert = extractDivert(node);

        if (node.getType() == NodeType.CHOICE) {
            parseChoice(node);
        }
        parseGlue(node);
        parseInstruction(node);

        if (divert != null) {
            parseGlue(divert);
            parseInstruction(divert);
        }
        return divert;
    }

    Node extractDivert(Node node) {
        String content = node.getContent();
        if (content == null || !content.contains(DIVERT_ARROW)) {
            return null;
        }
        if (node.getType() == NodeType.CHOICE && content.strip().startsWith(DIVERT_ARROW)) {
            node.setFallback(true);
            node.setContent(content.replace(DIVERT_ARROW, ""));
            return null;
        }
        int arrow = content.indexOf(DIVERT_ARROW);
        String target = content.substring(arrow + DIVERT_ARROW.length()).strip();
        node.setContent(content.substring(0, arrow).strip());

        Node divert = new Node(ids.next(), NodeType.DIVERT, DIVERT_ARROW + " " + target, node.getLevel(), node.getLineNumber());
        divert.setName(target);
        return divert;
    }

    void parseChoice(Node node) {
        String[] parts = extractParts(node.getContent(), node.getLineNumber());
        node.setChoiceText(parts[0]);
        node.setContent(parts[1]);
    }

    void parseGlue(Node node) {
        String content = node.getContent();
        if (content == null) {
            return;
        }
        while (content.contains(GLUE)) {
            if (content.startsWith(GLUE)) {
                node.setGlueBefore(true);
                content = content.substring(GLUE.length());
            } else {
                node.setGlueAfter(true);
                content = content.replace(GLUE, "");
            }
        }
        node.setContent(content);
    }

    void parseInstruction(Node node) {
        String content = node.getContent();
        if (content == null) {
            return;
        }
        int hash = content.indexOf('#');
        if (hash < 0) {
            return;
        }
        node.setContent(content.substring(0, hash));
        node.setInstruction(content.substring(hash + 1).strip());
    }

    /**
     * Splits "before[inside]after" into the text shown as the choice ("before" + "inside")
     * and the text shown once it is taken ("before" + "after"). Without brackets both are the
     * input. A second bracket pair is rejected.
     */
    public static String[] extractParts(String text, int lineNumber) {
        if (text == null) {
            return new String[] {null, null};
        }
        Matcher m = BRACKETS.matcher(text);
        if (!m.find()) {
            return new String[] {text, text};
        }
        int start = m.start();
        int end = m.end();
        String inside = m.group(1);
        int occurrences = 1;
        while (m.find()) {
            occurrences++;
        }
        if (occurrences > 1) {
            throw new StoryParseException("Choice has " + occurrences + " occurrences of [...], expected at most one",
                lineNumber, text);
        }
        String before = text.substring(0, start);
        String after = text.substring(end);
        return new String[] {before + inside, before + after};
    }
}
