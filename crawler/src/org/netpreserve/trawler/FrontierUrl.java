package org.netpreserve.trawler;

import org.jetbrains.annotations.NotNull;
import org.netpreserve.trawler.util.Url;

import java.time.Instant;

/**
 * A row of the crawl frontier.
 *
 * @param url         The normalized URL. Unique.
 * @param host        Lowercase host of the URL.
 * @param domain      Registrable domain of the host.
 * @param status      The current state of the URL.
 * @param retryCount  Number of failed fetches so far. Never decreases.
 * @param sitemap     Whether the URL was discovered as, or turned out to be, a sitemap.
 * @param lastError   Message of the most recent failure, if any.
 * @param timeAdded   When the URL was first discovered.
 * @param lastUpdated When the row last changed.
 */
public record FrontierUrl(
        long id,
        @NotNull Url url,
        String host,
        String domain,
        State status,
        int retryCount,
        boolean sitemap,
        String lastError,
        Instant timeAdded,
        Instant lastUpdated
) {
    /**
     * Lifecycle of a URL. VISITED is terminal, ERROR only leaves by operator resume.
     */
    public enum State {
        PENDING, IN_PROGRESS, VISITED, PAUSED, ERROR;

        public boolean canTransitionTo(State target) {
            return switch (this) {
                case PENDING -> target == IN_PROGRESS || target == PAUSED;
                case IN_PROGRESS -> target == VISITED || target == PENDING || target == ERROR;
                case PAUSED, ERROR -> target == PENDING;
                case VISITED -> false;
            };
        }
    }
}
