package dev.resumetailor.loader;

import java.nio.file.Path;

/**
 * Raised when candidate data or a job description cannot be read.
 */
public class CandidateDataException extends RuntimeException {

    private final transient Path path;

    public CandidateDataException(String message, Path path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public CandidateDataException(String message, Path path) {
        this(message, path, null);
    }

    public Path getPath() {
        return path;
    }
}
