package com.storyroom.parser;

import com.storyroom.models.Node;
import com.storyroom.models.RawKnot;
import com.storyroom.models.RawStory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StoryTreeBuilderTest {

    private RawStory parseRaw(String source) {
        return new StoryParser().parseRaw(source, null);
    }

    @Test
    void groupsContentIntoHeaderKnotsAndStitches() {
        RawStory story = parseRaw("Intro\n== forest ==\nTrees\n= path\nA path\n== lake ==\nWater");

        assertEquals(List.of(1), List.copyOf(story.getHeader().keySet()));
        assertEquals(List.of(2, 6), List.copyOf(story.getKnots().keySet()));

        RawKnot forest = story.getKnots().get(2);
        assertEquals(List.of(3), List.copyOf(forest.getHeader().keySet()));
        assertEquals(List.of(4), List.copyOf(forest.getStitches().keySet()));
        assertEquals(List.of(5), List.copyOf(forest.getStitches().get(4).keySet()));
        assertEquals(Integer.valueOf(3), forest.getFirstId());
    }

    @Test
    void blockNamesPointAtFirstNode() {
        RawStory story = parseRaw("Intro\n== forest ==\nTrees\n= path\nA path\n== lake ==\nWater");
        assertEquals(Map.of("forest", 3, "forest.path", 5, "lake", 7), story.getBlockNameToId());
    }

    @Test
    void contentIsTaggedWithOwningContainer() {
        RawStory story = parseRaw("Intro\n== forest ==\nTrees\n= path\nA path");

        Node intro = story.getNode(1);
        assertEquals(Node.HEADER_SCOPE, intro.getKnotName());
        assertNull(intro.getContainerKey());

        Node trees = story.getNode(3);
        assertEquals("forest", trees.getKnotName());
        assertEquals(Node.HEADER_SCOPE, trees.getStitchName());

        Node path = story.getNode(5);
        assertEquals("forest", path.getKnotName());
        assertEquals("path", path.getStitchName());
        assertEquals("forest.path", path.getContainerKey());
    }

    @Test
    void stitchOutsideKnotLeavesContentInHeader() {
        RawStory story = parseRaw("= orphan\nText");
        assertTrue(story.getKnots().isEmpty());
        assertTrue(story.getHeader().containsKey(2));
        assertEquals(Node.HEADER_SCOPE, story.getNode(2).getStitchName());
    }

    @Test
    void splitDivertIsFiledRightAfterItsSource() {
        RawStory story = parseRaw("A -> b\n== b ==\nB");
        assertEquals(List.of(1, 4), List.copyOf(story.getHeader().keySet()));
        assertEquals("b", story.getNode(4).getName());
    }

    @Test
    void knotWithoutContentIsNotFiled() {
        RawStory story = parseRaw("== empty ==\n== full ==\nText");
        assertEquals(List.of(2), List.copyOf(story.getKnots().keySet()));
        assertEquals(2, story.getKnotsInfo().size());
        assertEquals(Map.of("full", 3), story.getBlockNameToId());
    }
}
