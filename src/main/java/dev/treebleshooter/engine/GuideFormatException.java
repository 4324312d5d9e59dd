package dev.treebleshooter.engine;

import java.io.IOException;

/**
 * A persisted guide or catalog could not be read because its content is malformed.
 * {@link #path()} names the offending key, e.g. {@code nodes.n1.answers[0].is_solution}.
 */
public class GuideFormatException extends IOException {

    private final String path;

    public GuideFormatException(String path, String message) {
        super(path + ": " + message);
        this.path = path;
    }

    public GuideFormatException(String path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
