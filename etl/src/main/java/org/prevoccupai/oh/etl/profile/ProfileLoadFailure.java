package org.prevoccupai.oh.etl.profile;

import java.nio.file.Path;

/**
 * A profile file that could not be loaded.
 */
public record ProfileLoadFailure(
    Path file,
    String subjectId,
    LoadFailureReason reason,
    String detail
) {

    public String message() {
        return file.getFileName() + ": " + reason.getDescription() + " (" + detail + ")";
    }
}
