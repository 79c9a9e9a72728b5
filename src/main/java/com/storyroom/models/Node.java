package com.storyroom.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.storyroom.condition.Condition;

/**
 * One parsed element of a story script: a paragraph, choice, gather, knot or stitch header,
 * divert, or one of the three sentinels. Relationships between nodes are kept as plain ids
 * in the edge list of a {@link StoryGraph}, never as references.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Node {

    public static final int END_ID = -1;
    public static final int BEGIN_ID = -2;
    public static final int AUTO_END_ID = -3;

    /** Scope name used for content that sits outside any knot or stitch. */
    public static final String HEADER_SCOPE = "HEADER";

    private int id;
    private NodeType type;
    private String rawContent;
    private int level;
    private int lineNumber;
    private String name;
    private String content;
    private String choiceText;
    private Integer choiceOrder;
    private boolean glueBefore;
    private boolean glueAfter;
    private String instruction;
    private boolean fallback;
    private boolean sticky;
    private String knotName = HEADER_SCOPE;
    private String stitchName = HEADER_SCOPE;
    private Condition condition;

    public Node() {}

    public Node(int id, NodeType type, String rawContent, int level, int lineNumber) {
        this.id = id;
        this.type = type;
        this.rawContent = rawContent;
        this.level = level;
        this.lineNumber = lineNumber;
    }

    public static Node endNode() {
        return sentinel(END_ID, NodeType.END, "END");
    }

    public static Node beginNode() {
        return sentinel(BEGIN_ID, NodeType.BEGIN, "BEGIN");
    }

    public static Node autoEndNode() {
        return sentinel(AUTO_END_ID, NodeType.AUTO_END, "AUTO_END");
    }

    private static Node sentinel(int id, NodeType type, String name) {
        Node node = new Node(id, type, "", -1, -1);
        node.setName(name);
        return node;
    }

    public static boolean isSentinelId(int id) {
        return id == END_ID || id == BEGIN_ID || id == AUTO_END_ID;
    }

    public boolean isSentinel() {
        return type == NodeType.END || type == NodeType.BEGIN || type == NodeType.AUTO_END;
    }

    public boolean hasContent() {
        return content != null && !content.isBlank();
    }

    /**
     * Qualified container key ("knot" or "knot.stitch") this node belongs to, or null in the story header.
     */
    public String getContainerKey() {
        if (knotName == null || HEADER_SCOPE.equals(knotName)) {
            return null;
        }
        if (stitchName == null || HEADER_SCOPE.equals(stitchName)) {
            return knotName;
        }
        return knotName + "." + stitchName;
    }

    public int getId() { return id; }
    public void setId(int id) { this.id = id; }

    public NodeType getType() { return type; }
    public void setType(NodeType type) { this.type = type; }

    public String getRawContent() { return rawContent; }
    public void setRawContent(String rawContent) { this.rawContent = rawContent; }

    public int getLevel() { return level; }
    public void setLevel(int level) { this.level = level; }

    public int getLineNumber() { return lineNumber; }
    public void setLineNumber(int lineNumber) { this.lineNumber = lineNumber; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public String getChoiceText() { return choiceText; }
    public void setChoiceText(String choiceText) { this.choiceText = choiceText; }

    public Integer getChoiceOrder() { return choiceOrder; }
    public void setChoiceOrder(Integer choiceOrder) { this.choiceOrder = choiceOrder; }

    public boolean isGlueBefore() { return glueBefore; }
    public void setGlueBefore(boolean glueBefore) { this.glueBefore = glueBefore; }

    public boolean isGlueAfter() { return glueAfter; }
    public void setGlueAfter(boolean glueAfter) { this.glueAfter = glueAfter; }

    public String getInstruction() { return instruction; }
    public void setInstruction(String instruction) { this.instruction = instruction; }

    public boolean isFallback() { return fallback; }
    public void setFallback(boolean fallback) { this.fallback = fallback; }

    public boolean isSticky() { return sticky; }
    public void setSticky(boolean sticky) { this.sticky = sticky; }

    public String getKnotName() { return knotName; }
    public void setKnotName(String knotName) { this.knotName = knotName; }

    public String getStitchName() { return stitchName; }
    public void setStitchName(String stitchName) { this.stitchName = stitchName; }

    public Condition getCondition() { return condition; }
    public void setCondition(Condition condition) { this.condition = condition; }

    @Override
    public String toString() {
        return "Node{" +
            "id=" + id +
            ", type=" + type +
            ", level=" + level +
            ", line=" + lineNumber +
            (name != null ? ", name='" + name + '\'' : "") +
            (content != null ? ", content='" + content + '\'' : "") +
            '}';
    }
}
