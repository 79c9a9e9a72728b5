package com.storyroom.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Tunables shared by the parser and the story engine. Persisted as JSON next to the stories.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineSettings {

    public static final String DEFAULT_SEPARATOR = " ";
    public static final String DEFAULT_END_TEXT = "END OF STORY";
    public static final String DEFAULT_AUTO_END_TEXT = "AUTO END OF STORY generated by the software";

    private String textSeparator = DEFAULT_SEPARATOR;
    private boolean letPlayerChooseSingleChoice = true;
    private String endOfStoryText = DEFAULT_END_TEXT;
    private String autoEndText = DEFAULT_AUTO_END_TEXT;

    public EngineSettings() {}

    public static EngineSettings defaults() {
        return new EngineSettings();
    }

    public EngineSettings copy() {
        EngineSettings copy = new EngineSettings();
        copy.setTextSeparator(textSeparator);
        copy.setLetPlayerChooseSingleChoice(letPlayerChooseSingleChoice);
        copy.setEndOfStoryText(endOfStoryText);
        copy.setAutoEndText(autoEndText);
        return copy;
    }

    public String getTextSeparator() { return textSeparator != null ? textSeparator : DEFAULT_SEPARATOR; }
    public void setTextSeparator(String textSeparator) { this.textSeparator = textSeparator; }

    public boolean isLetPlayerChooseSingleChoice() { return letPlayerChooseSingleChoice; }
    public void setLetPlayerChooseSingleChoice(boolean letPlayerChooseSingleChoice) {
        this.letPlayerChooseSingleChoice = letPlayerChooseSingleChoice;
    }

    public String getEndOfStoryText() { return endOfStoryText != null ? endOfStoryText : DEFAULT_END_TEXT; }
    public void setEndOfStoryText(String endOfStoryText) { this.endOfStoryText = endOfStoryText; }

    public String getAutoEndText() { return autoEndText != null ? autoEndText : DEFAULT_AUTO_END_TEXT; }
    public void setAutoEndText(String autoEndText) { this.autoEndText = autoEndText; }
}
