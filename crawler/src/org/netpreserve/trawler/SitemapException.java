package org.netpreserve.trawler;

/**
 * A sitemap body could not be decompressed or parsed.
 */
public class SitemapException extends Exception {
    public SitemapException(String message) {
        super(message);
    }

    public SitemapException(String message, Throwable cause) {
        super(message, cause);
    }
}
