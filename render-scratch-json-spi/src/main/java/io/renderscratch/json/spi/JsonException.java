package io.renderscratch.json.spi;

import java.util.Optional;

/**
 * Raised when a scratch value can't be written to JSON or a JSON document can't be read as one.
 *
 * <p>Structural failures carry the JSON path of the offending node ({@code $}, {@code $.a[2]}),
 * parser failures carry the underlying library exception as the cause.
 */
public class JsonException extends Exception {
    private final String path;

    public JsonException(String message, Throwable cause) {
        super(message, cause);
        this.path = null;
    }

    /**
     * @param message what went wrong
     * @param path JSON path of the node that caused it, appended to the message
     */
    public JsonException(String message, String path) {
        super(message + " at " + path);
        this.path = path;
    }

    /**
     * JSON path of the offending node, empty when the failure came from the parser or generator.
     */
    public Optional<String> path() {
        return Optional.ofNullable(path);
    }
}
