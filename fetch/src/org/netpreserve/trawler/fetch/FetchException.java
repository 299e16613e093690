package org.netpreserve.trawler.fetch;

import org.netpreserve.trawler.util.Url;

/**
 * A fetch failed in a way that may succeed if retried later.
 */
public class FetchException extends Exception {
    private final Url url;
    private final int status;

    public FetchException(Url url, int status) {
        super("HTTP " + status + " for " + url);
        this.url = url;
        this.status = status;
    }

    public FetchException(Url url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.status = -1;
    }

    public Url url() {
        return url;
    }

    /**
     * The HTTP status code or -1 if no response was received.
     */
    public int status() {
        return status;
    }
}
