package com.storyroom.parser;

import com.storyroom.AppLogger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Expands "INCLUDE file" directives before tokenizing. The directive line is removed and the
 * included lines are appended after the including file's own lines, so included knots never
 * swallow the including file's header content. Paths resolve against the base directory
 * (current directory when none is given). Nested includes are followed; a file is included
 * at most once.
 *
 * When an include root is set, included files must live under it.
 */
public class IncludeExpander {

    private static final String DIRECTIVE = "INCLUDE";

    private final Path includeRoot;

    public IncludeExpander() {
        this(null);
    }

    public IncludeExpander(Path includeRoot) {
        this.includeRoot = includeRoot != null ? includeRoot.toAbsolutePath().normalize() : null;
    }

    public List<String> expand(List<String> lines, Path baseDir) {
        Path base = baseDir != null ? baseDir : Paths.get("").toAbsolutePath();
        return expand(lines, base, new HashSet<>());
    }

    private List<String> expand(List<String> lines, Path base, Set<Path> seen) {
        List<String> own = new ArrayList<>();
        List<String> included = new ArrayList<>();
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            String stripped = line.strip();
            if (!isDirective(stripped)) {
                own.add(line);
                continue;
            }
            String fileName = stripped.substring(DIRECTIVE.length()).strip();
            Path path = base.resolve(fileName).toAbsolutePath().normalize();
            if (includeRoot != null && !path.startsWith(includeRoot)) {
                throw new SecurityException("Included file escapes stories folder: " + fileName);
            }
            if (!seen.add(path)) {
                continue;
            }
            List<String> content = read(path, lineNumber, fileName);
            log("Included " + path + " (" + content.size() + " lines)");
            Path nestedBase = path.getParent() != null ? path.getParent() : base;
            included.addAll(expand(content, nestedBase, seen));
        }
        own.addAll(included);
        return own;
    }

    private boolean isDirective(String stripped) {
        return stripped.startsWith(DIRECTIVE)
            && (stripped.length() == DIRECTIVE.length() || Character.isWhitespace(stripped.charAt(DIRECTIVE.length())));
    }

    private List<String> read(Path path, int lineNumber, String fileName) {
        try {
            String text = Files.readString(path, StandardCharsets.UTF_8);
            return StoryParser.splitLines(text);
        } catch (IOException e) {
            throw new StoryParseException("Cannot read included file " + path, lineNumber, fileName, e);
        }
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[IncludeExpander] " + message);
        }
    }
}
