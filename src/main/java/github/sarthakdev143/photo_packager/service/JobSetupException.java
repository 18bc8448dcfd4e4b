package github.sarthakdev143.photo_packager.service;

import java.io.IOException;

/**
 * A job could not start: the source directory is missing or the output root cannot be created.
 * Per-file problems never raise this; they are recorded as outcomes.
 */
public class JobSetupException extends IOException {

    public JobSetupException(String message) {
        super(message);
    }

    public JobSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
