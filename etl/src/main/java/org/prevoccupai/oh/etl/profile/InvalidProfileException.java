package org.prevoccupai.oh.etl.profile;

import java.io.IOException;

/**
 * Thrown when a file parses as JSON but is not a profile.
 */
public class InvalidProfileException extends IOException {

    public InvalidProfileException(String message) {
        super(message);
    }
}
