package org.prevoccupai.oh.exception;

/**
 * Raised when a caller hands the extraction layer a configuration it cannot honour: an unsupported path segment, an
 * unrecognised pattern syntax, an unknown option name, a merge key that does not exist. These are programmer errors,
 * not data errors, so they are never converted into missing values.
 */
public class ExtractionConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 4177520865211870331L;

    public ExtractionConfigurationException(String message) {
        super(message);
    }

    public ExtractionConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
