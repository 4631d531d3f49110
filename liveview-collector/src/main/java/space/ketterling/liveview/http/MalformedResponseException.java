package space.ketterling.liveview.http;

/**
 * An upstream response arrived but its document could not be understood.
 */
public class MalformedResponseException extends RuntimeException {
    private final String source;

    public MalformedResponseException(String source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public MalformedResponseException(String source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }

    public String source() {
        return source;
    }
}
