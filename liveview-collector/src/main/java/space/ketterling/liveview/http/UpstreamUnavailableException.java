package space.ketterling.liveview.http;

/**
 * An upstream feed could not be reached or answered with a non-2xx status.
 */
public class UpstreamUnavailableException extends RuntimeException {
    private final String source;
    private final String url;
    private final Integer status;

    public UpstreamUnavailableException(String source, String url, int status) {
        super(source + " request failed: " + status + " url=" + url);
        this.source = source;
        this.url = url;
        this.status = status;
    }

    public UpstreamUnavailableException(String source, String url, Throwable cause) {
        super(source + " request failed: " + cause.getClass().getSimpleName()
                + (cause.getMessage() == null ? "" : " " + cause.getMessage()) + " url=" + url, cause);
        this.source = source;
        this.url = url;
        this.status = null;
    }

    public String source() {
        return source;
    }

    public String url() {
        return url;
    }

    /**
     * HTTP status, or null when the request never got a response.
     */
    public Integer status() {
        return status;
    }
}
