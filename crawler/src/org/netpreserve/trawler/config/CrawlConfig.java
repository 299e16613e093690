package org.netpreserve.trawler.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.trawler.util.DurationDeserializer;

import java.time.Duration;

/**
 * Configuration for how the crawl should behave.
 *
 * @param userAgent    User-Agent string to identify as to servers
 * @param workers      number of worker threads, 0 to choose from the number of CPUs
 * @param delay        time each worker waits before every request
 * @param timeout      connect and request timeout for a single fetch
 * @param maxRetries   failed attempts a URL may have before it is marked as an error
 * @param retryBackoff delay before the first retry, doubled for each further attempt
 * @param pollInterval how long an idle worker waits for work before checking for shutdown
 */
public record CrawlConfig(
        String userAgent,
        int workers,
        @JsonDeserialize(using = DurationDeserializer.class) Duration delay,
        @JsonDeserialize(using = DurationDeserializer.class) Duration timeout,
        int maxRetries,
        @JsonDeserialize(using = DurationDeserializer.class) Duration retryBackoff,
        @JsonDeserialize(using = DurationDeserializer.class) Duration pollInterval) {
}
