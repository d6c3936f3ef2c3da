package org.prevoccupai.oh.etl.profile;

/**
 * Why a profile file was skipped during a directory load.
 */
public enum LoadFailureReason {
    FILE_READ_ERROR("Unable to read profile file"),
    MALFORMED_JSON("Profile file is not valid JSON"),
    NOT_AN_OBJECT("Profile root is not a JSON object");

    private final String description;

    LoadFailureReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
