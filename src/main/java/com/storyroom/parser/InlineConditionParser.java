package com.storyroom.parser;

import com.storyroom.AppLogger;
import com.storyroom.condition.Condition;
import com.storyroom.condition.UnaryCondition;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the body of an inline {...} segment into a condition on container seen counts.
 *
 * Supported forms:
 *   not NAME     -> seen count of NAME == 0
 *   NAME > N     -> seen count of NAME > N
 *   NAME < N     -> seen count of NAME < N
 *   NAME         -> seen count of NAME > 0
 *
 * NAME is a knot or "knot.stitch". Anything else is dropped with a warning and the
 * line parses without a condition.
 */
public class InlineConditionParser {

    private static final String NAME = "[A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)?";
    private static final Pattern NOT_PATTERN = Pattern.compile("^not\\s+(" + NAME + ")$");
    private static final Pattern COMPARE_PATTERN = Pattern.compile("^(" + NAME + ")\\s*([<>])\\s*(\\d+)$");
    private static final Pattern BARE_PATTERN = Pattern.compile("^(" + NAME + ")$");

    public Condition parse(String expression, int lineNumber) {
        String expr = expression != null ? expression.trim() : "";

        Matcher m = NOT_PATTERN.matcher(expr);
        if (m.matches()) {
            return UnaryCondition.seenCountEq(m.group(1), 0);
        }
        m = COMPARE_PATTERN.matcher(expr);
        if (m.matches()) {
            int threshold;
            try {
                threshold = Integer.parseInt(m.group(3));
            } catch (NumberFormatException e) {
                logDropped(expr, lineNumber);
                return null;
            }
            return ">".equals(m.group(2))
                ? UnaryCondition.seenCountGt(m.group(1), threshold)
                : UnaryCondition.seenCountLt(m.group(1), threshold);
        }
        m = BARE_PATTERN.matcher(expr);
        if (m.matches()) {
            return UnaryCondition.seenCountGt(m.group(1), 0);
        }
        logDropped(expr, lineNumber);
        return null;
    }

    private void logDropped(String expr, int lineNumber) {
        String message = "[InlineConditionParser] Ignoring unsupported condition {" + expr + "} at line " + lineNumber;
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn(message);
        } else {
            System.out.println(message);
        }
    }
}
