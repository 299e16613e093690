package org.netpreserve.trawler.config;

import java.util.List;

/**
 * Root configuration for a crawl job.
 *
 * @param seeds   URLs (pages or sitemaps) added to the frontier when the job starts
 * @param crawl   how to crawl
 * @param storage where crawl state and output are kept
 */
public record JobConfig(
        List<String> seeds,
        CrawlConfig crawl,
        StorageConfig storage
) {
    public JobConfig {
        if (seeds == null) seeds = List.of();
    }
}
