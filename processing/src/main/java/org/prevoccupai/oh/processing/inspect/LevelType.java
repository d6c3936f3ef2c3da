package org.prevoccupai.oh.processing.inspect;

/**
 * What the keys found at one nesting level look like.
 */
public enum LevelType {
    EMPTY("No keys"),
    DATE("Calendar dates such as 06-01-2025"),
    TIME("Session start times such as 09-30-00"),
    SIDE("Body side labels such as left or right"),
    GENERIC("Anything else");

    private final String description;

    LevelType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
