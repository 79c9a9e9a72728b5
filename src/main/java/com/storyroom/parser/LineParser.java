package com.storyroom.parser;

import com.storyroom.condition.Condition;
import com.storyroom.models.Node;
import com.storyroom.models.NodeType;

/**
 * Classifies single raw lines of a story script.
 *
 * Precedence, highest first: line comment, block comment, divert, knot/stitch header,
 * choice, gather, plain content. Holds the block-comment flag between calls, so one
 * instance serves exactly one pass over a script.
 */
public class LineParser {

    private final NodeIdAllocator ids;
    private final InlineConditionParser conditionParser;
    private boolean inComment;

    public LineParser(NodeIdAllocator ids) {
        this(ids, new InlineConditionParser());
    }

    public LineParser(NodeIdAllocator ids, InlineConditionParser conditionParser) {
        this.ids = ids;
        this.conditionParser = conditionParser;
    }

    public LineParseResult parseLine(String line, int lineNumber, int lastLevel) {
        if (line == null || isCommentOrEmpty(line)) {
            return LineParseResult.skipped(lastLevel);
        }
        String stripped = line.strip();

        if (stripped.startsWith("->")) {
            Node divert = new Node(ids.next(), NodeType.DIVERT, line, lastLevel, lineNumber);
            divert.setName(stripped.substring(2).strip());
            return LineParseResult.node(divert, lastLevel);
        }

        if (stripped.startsWith("=")) {
            NodeType type = stripped.startsWith("==") ? NodeType.KNOT : NodeType.STITCHES;
            Node header = new Node(ids.next(), type, stripped, 0, lineNumber);
            header.setName(extractKnotName(stripped));
            return LineParseResult.node(header, 0);
        }

        // the inline condition may sit in front of the markers: "{forest} * Go"
        String conditionText = null;
        String body = stripped;
        int open = stripped.indexOf('{');
        int close = open >= 0 ? stripped.indexOf('}', open) : -1;
        if (open >= 0 && close > open) {
            conditionText = stripped.substring(open + 1, close);
            body = (stripped.substring(0, open) + stripped.substring(close + 1)).strip();
        }
        char marker = body.isEmpty() ? ' ' : body.charAt(0);
        if ((marker == '*' || marker == '+' || marker == '-') && !body.startsWith("->")) {
            Condition condition = conditionText != null ? conditionParser.parse(conditionText, lineNumber) : null;
            return parseChoiceOrGather(line, body, marker, condition, lineNumber);
        }

        Node base = new Node(ids.next(), NodeType.BASE, line, lastLevel, lineNumber);
        base.setContent(stripped);
        return LineParseResult.node(base, lastLevel);
    }

    /**
     * Tracks // and block comments. Returns true when the line carries no story content.
     */
    public boolean isCommentOrEmpty(String line) {
        String stripped = line.strip();
        if (inComment) {
            if (stripped.contains("*/")) {
                inComment = false;
            }
            return true;
        }
        if (stripped.isEmpty() || stripped.startsWith("//")) {
            return true;
        }
        if (stripped.startsWith("/*")) {
            if (stripped.length() < 4 || !stripped.endsWith("*/")) {
                inComment = true;
            }
            return true;
        }
        return false;
    }

    public boolean isInComment() {
        return inComment;
    }

    private LineParseResult parseChoiceOrGather(String line, String stripped, char marker, Condition condition,
                                                int lineNumber) {
        int level = 0;
        int idx = 0;
        while (idx < stripped.length()) {
            char c = stripped.charAt(idx);
            if (c == marker) {
                // "->" after a gather dash is a divert, not another level
                if (marker == '-' && idx + 1 < stripped.length() && stripped.charAt(idx + 1) == '>') {
                    break;
                }
                level++;
                idx++;
            } else if (c == ' ' || c == '\t') {
                idx++;
            } else {
                break;
            }
        }

        String text = stripped.substring(idx);

        NodeType type = marker == '-' ? NodeType.GATHER : NodeType.CHOICE;
        Node node = new Node(ids.next(), type, line, level, lineNumber);
        node.setContent(text);
        node.setSticky(marker == '+');
        node.setCondition(condition);
        return LineParseResult.node(node, level);
    }

    /**
     * "== forest ==" -> "forest", "= clearing" -> "clearing".
     */
    public static String extractKnotName(String header) {
        String name = header.strip();
        int start = 0;
        int end = name.length();
        while (start < end && (name.charAt(start) == '=' || Character.isWhitespace(name.charAt(start)))) {
            start++;
        }
        while (end > start && (name.charAt(end - 1) == '=' || Character.isWhitespace(name.charAt(end - 1)))) {
            end--;
        }
        return name.substring(start, end);
    }
}
