package com.storyroom.parser;

import com.storyroom.models.EngineSettings;
import com.storyroom.models.Node;
import com.storyroom.models.NodeType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Folds plain-content lines into the preceding choice, gather or paragraph so that a body
 * of text spanning several raw lines becomes one node.
 */
public class LineMerger {

    private final String separator;
    private final Map<Integer, Node> lines = new LinkedHashMap<>();
    private Integer previousId;

    public LineMerger() {
        this(EngineSettings.DEFAULT_SEPARATOR);
    }

    public LineMerger(String separator) {
        this.separator = separator != null ? separator : EngineSettings.DEFAULT_SEPARATOR;
    }

    public void add(Node node) {
        if (canMergeWithPrevious(node)) {
            mergeWithPrevious(node);
        } else {
            lines.put(node.getId(), node);
            previousId = node.getId();
        }
    }

    public boolean canMergeWithPrevious(Node node) {
        if (node.getType() != NodeType.BASE || previousId == null) {
            return false;
        }
        NodeType previousType = lines.get(previousId).getType();
        return previousType == NodeType.BASE || previousType == NodeType.CHOICE || previousType == NodeType.GATHER;
    }

    // The earlier node keeps its id, kind, level and line number.
    private void mergeWithPrevious(Node node) {
        Node previous = lines.get(previousId);
        String before = previous.getContent() != null ? previous.getContent() : "";
        String after = node.getContent() != null ? node.getContent() : "";
        previous.setContent(before.isEmpty() ? after : before + separator + after);
        previous.setRawContent(previous.getRawContent() + "\n" + node.getRawContent());
        if (previous.getCondition() == null && node.getCondition() != null) {
            previous.setCondition(node.getCondition());
        }
    }

    public Map<Integer, Node> getLines() {
        return lines;
    }
}
