package space.ketterling.gridload.isone;

/**
 * The feed could not be fetched or did not answer with a usable JSON
 * document. {@link #status()} is -1 when no HTTP response was received;
 * {@link #body()} holds whatever bytes did arrive, if any.
 */
public class TransportException extends RuntimeException {
    private final String url;
    private final int status;
    private final transient byte[] body;

    public TransportException(String url, int status, String message, byte[] body) {
        super(message);
        this.url = url;
        this.status = status;
        this.body = body;
    }

    public TransportException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.status = -1;
        this.body = null;
    }

    public String url() {
        return url;
    }

    public int status() {
        return status;
    }

    public byte[] body() {
        return body;
    }

    /** 429, 5xx and I/O failures are worth another attempt. */
    public boolean isRetryable() {
        return status == -1 || status == 429 || (status >= 500 && status < 600);
    }
}
