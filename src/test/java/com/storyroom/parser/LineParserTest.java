package com.storyroom.parser;

import com.storyroom.condition.ConditionType;
import com.storyroom.condition.UnaryCondition;
import com.storyroom.models.Node;
import com.storyroom.models.NodeType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LineParserTest {

    private final LineParser parser = new LineParser(new NodeIdAllocator());

    @Test
    void choiceLevelCountsMarkers() {
        LineParseResult result = parser.parseLine("** Go north", 1, 0);
        Node node = result.getNode();
        assertEquals(NodeType.CHOICE, node.getType());
        assertEquals(2, node.getLevel());
        assertEquals(2, result.getLevel());
        assertEquals("Go north", node.getContent());
        assertFalse(node.isSticky());
    }

    @Test
    void spacedMarkersCountAsLevels() {
        Node node = parser.parseLine("* * Deeper", 1, 0).getNode();
        assertEquals(2, node.getLevel());
        assertEquals("Deeper", node.getContent());
    }

    @Test
    void plusMarksStickyChoice() {
        Node node = parser.parseLine("+ Wait", 1, 0).getNode();
        assertEquals(NodeType.CHOICE, node.getType());
        assertTrue(node.isSticky());
        assertEquals(1, node.getLevel());
    }

    @Test
    void arrowAfterGatherDashIsNotALevel() {
        Node node = parser.parseLine("- -> END", 4, 2).getNode();
        assertEquals(NodeType.GATHER, node.getType());
        assertEquals(1, node.getLevel());
        assertEquals("-> END", node.getContent());
    }

    @Test
    void divertLineKeepsCurrentLevel() {
        LineParseResult result = parser.parseLine("  -> forest", 3, 2);
        Node node = result.getNode();
        assertEquals(NodeType.DIVERT, node.getType());
        assertEquals("forest", node.getName());
        assertEquals(2, node.getLevel());
        assertEquals(2, result.getLevel());
    }

    @Test
    void knotAndStitchHeaders() {
        LineParseResult knot = parser.parseLine("== forest ==", 1, 2);
        assertEquals(NodeType.KNOT, knot.getNode().getType());
        assertEquals("forest", knot.getNode().getName());
        assertEquals(0, knot.getLevel());

        Node stitch = parser.parseLine("= clearing", 2, 0).getNode();
        assertEquals(NodeType.STITCHES, stitch.getType());
        assertEquals("clearing", stitch.getName());
    }

    @Test
    void plainLineIsStrippedContentAtCarriedLevel() {
        Node node = parser.parseLine("   Hello there  ", 5, 1).getNode();
        assertEquals(NodeType.BASE, node.getType());
        assertEquals("Hello there", node.getContent());
        assertEquals(1, node.getLevel());
        assertEquals(5, node.getLineNumber());
    }

    @Test
    void lineCommentsAndBlankLinesAreSkipped() {
        LineParseResult comment = parser.parseLine("// note to self", 1, 3);
        assertFalse(comment.hasNode());
        assertEquals(3, comment.getLevel());
        assertFalse(parser.parseLine("   ", 2, 0).hasNode());
    }

    @Test
    void blockCommentSpansLines() {
        assertFalse(parser.parseLine("/* start", 1, 0).hasNode());
        assertTrue(parser.isInComment());
        assertFalse(parser.parseLine("* not a choice", 2, 0).hasNode());
        assertFalse(parser.parseLine("end */", 3, 0).hasNode());
        assertFalse(parser.isInComment());
        assertTrue(parser.parseLine("Visible", 4, 0).hasNode());
    }

    @Test
    void singleLineBlockCommentDoesNotOpenComment() {
        assertFalse(parser.parseLine("/* aside */", 1, 0).hasNode());
        assertFalse(parser.isInComment());
    }

    @Test
    void inlineConditionIsExtractedFromChoice() {
        Node node = parser.parseLine("* {not forest} Go", 1, 0).getNode();
        assertEquals("Go", node.getContent());
        UnaryCondition condition = (UnaryCondition) node.getCondition();
        assertEquals(ConditionType.SEEN_COUNT_EQ, condition.getType());
        assertEquals("forest", condition.getContainerReference());
        assertEquals(0, condition.getExpectedValue());
    }

    @Test
    void conditionInFrontOfMarkersStillMakesAChoice() {
        LineParseResult result = parser.parseLine("{forest} ** Go", 1, 0);
        Node node = result.getNode();
        assertEquals(NodeType.CHOICE, node.getType());
        assertEquals(2, result.getLevel());
        assertEquals("Go", node.getContent());
        UnaryCondition condition = (UnaryCondition) node.getCondition();
        assertEquals(ConditionType.SEEN_COUNT_GT, condition.getType());
        assertEquals("forest", condition.getContainerReference());
    }

    @Test
    void bracesInPlainTextAreLeftAlone() {
        Node node = parser.parseLine("A {strange} sign", 1, 0).getNode();
        assertEquals(NodeType.BASE, node.getType());
        assertEquals("A {strange} sign", node.getContent());
        assertNull(node.getCondition());
    }

    @Test
    void unsupportedConditionIsDroppedButLineSurvives() {
        Node node = parser.parseLine("* {x == 1} Go", 1, 0).getNode();
        assertNull(node.getCondition());
        assertEquals("Go", node.getContent());
    }

    @Test
    void idsAreHandedOutInOrder() {
        LineParser fresh = new LineParser(new NodeIdAllocator());
        assertEquals(1, fresh.parseLine("a", 1, 0).getNode().getId());
        fresh.parseLine("// skipped", 2, 0);
        assertEquals(2, fresh.parseLine("b", 3, 0).getNode().getId());
    }

    @Test
    void extractKnotNameTrimsMarkers() {
        assertEquals("dark woods", LineParser.extractKnotName("=== dark woods ==="));
        assertEquals("clearing", LineParser.extractKnotName("= clearing"));
    }
}
