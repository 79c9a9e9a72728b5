package com.storyroom.parser;

import com.storyroom.models.EngineSettings;
import com.storyroom.models.RawStory;
import com.storyroom.models.StoryGraph;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Entry point of the parsing pipeline:
 * includes -> line classification -> merging -> knot/stitch tree -> graph.
 *
 * Each call uses its own id allocator, so parsing the same text twice gives the same ids.
 */
public class StoryParser {

    private final String separator;
    private final IncludeExpander includeExpander;

    public StoryParser() {
        this(EngineSettings.DEFAULT_SEPARATOR);
    }

    public StoryParser(String separator) {
        this(separator, null);
    }

    /**
     * @param includeRoot folder INCLUDE directives may not leave; null for no restriction
     */
    public StoryParser(String separator, Path includeRoot) {
        this.separator = separator != null ? separator : EngineSettings.DEFAULT_SEPARATOR;
        this.includeExpander = new IncludeExpander(includeRoot);
    }

    public StoryGraph parse(String source) {
        return parse(source, null);
    }

    public StoryGraph parse(String source, Path baseDir) {
        return new GraphBuilder().build(parseRaw(source, baseDir));
    }

    public RawStory parseRaw(String source, Path baseDir) {
        NodeIdAllocator ids = new NodeIdAllocator();
        List<String> lines = includeExpander.expand(splitLines(source), baseDir);

        LineParser lineParser = new LineParser(ids);
        LineMerger merger = new LineMerger(separator);
        int level = 0;
        for (int i = 0; i < lines.size(); i++) {
            LineParseResult result = lineParser.parseLine(lines.get(i), i + 1, level);
            level = result.getLevel();
            if (result.hasNode()) {
                merger.add(result.getNode());
            }
        }

        StoryTreeBuilder treeBuilder = new StoryTreeBuilder(new NodePostProcessor(ids));
        return treeBuilder.build(merger.getLines().values());
    }

    static List<String> splitLines(String text) {
        if (text == null || text.isBlank()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(text.strip().split("\\r?\\n")));
    }
}
