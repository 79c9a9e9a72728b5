package com.storyroom.parser;

/**
 * Structural error in a story script. Parsing stops at the first one.
 */
public class StoryParseException extends RuntimeException {
    private final int lineNumber;
    private final String token;

    public StoryParseException(String message, int lineNumber, String token) {
        super(format(message, lineNumber, token));
        this.lineNumber = lineNumber;
        this.token = token;
    }

    public StoryParseException(String message, int lineNumber, String token, Throwable cause) {
        super(format(message, lineNumber, token), cause);
        this.lineNumber = lineNumber;
        this.token = token;
    }

    private static String format(String message, int lineNumber, String token) {
        StringBuilder sb = new StringBuilder(message);
        if (token != null) {
            sb.append(": '").append(token).append('\'');
        }
        if (lineNumber > 0) {
            sb.append(" (line ").append(lineNumber).append(')');
        }
        return sb.toString();
    }

    /**
     * Source line of the error, or -1 when not tied to a line.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getToken() {
        return token;
    }
}
