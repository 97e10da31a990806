package org.example.bookmarksync.karakeep;

/**
 * Thrown when a bookmark page cannot be fetched from Karakeep. Aborts the current sync run.
 */
public class SourceUnavailableException extends RuntimeException {

    private final int status;
    private final String responseBody;

    public SourceUnavailableException(int status, String responseBody) {
        super("Karakeep API request failed: " + status + " " + (responseBody == null ? "" : responseBody).trim());
        this.status = status;
        this.responseBody = responseBody;
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
        this.responseBody = null;
    }

    /**
     * HTTP status returned by the API, or -1 for transport failures.
     */
    public int getStatus() {
        return status;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
