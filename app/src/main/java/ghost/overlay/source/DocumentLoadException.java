package ghost.overlay.source;

/**
 * Runtime exception raised when a document cannot be read from disk or from a git revision.
 */
public class DocumentLoadException extends RuntimeException {

    public DocumentLoadException(String message) {
        super(message);
    }

    public DocumentLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
