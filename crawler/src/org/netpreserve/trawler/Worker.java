package org.netpreserve.trawler;

import org.jdbi.v3.core.JdbiException;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.trawler.SitemapExpander.SitemapEntry;
import org.netpreserve.trawler.config.CrawlConfig;
import org.netpreserve.trawler.fetch.ExtractedPage;
import org.netpreserve.trawler.fetch.FetchException;
import org.netpreserve.trawler.fetch.FetchResult;
import org.netpreserve.trawler.fetch.Fetcher;
import org.netpreserve.trawler.fetch.PageExtractor;
import org.netpreserve.trawler.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Takes URLs from the work queue, fetches them and feeds what it finds back into the frontier.
 */
public class Worker {
    private static final Logger log = LoggerFactory.getLogger(Worker.class);
    final String id;
    private final Frontier frontier;
    private final WorkQueue queue;
    private final Fetcher fetcher;
    private final ContentSink sink;
    private final RetryScheduler retryScheduler;
    private final CrawlConfig crawlConfig;
    private final int excerptLength;
    private final AtomicBoolean shutdown;
    private final PageExtractor pageExtractor = new PageExtractor();
    private final SitemapExpander sitemapExpander = new SitemapExpander();
    private Thread thread;
    private volatile Info info;

    public Worker(String id, Frontier frontier, WorkQueue queue, Fetcher fetcher, ContentSink sink,
                  RetryScheduler retryScheduler, CrawlConfig crawlConfig, int excerptLength, AtomicBoolean shutdown) {
        this.id = id;
        this.frontier = frontier;
        this.queue = queue;
        this.fetcher = fetcher;
        this.sink = sink;
        this.retryScheduler = retryScheduler;
        this.crawlConfig = crawlConfig;
        this.excerptLength = excerptLength;
        this.shutdown = shutdown;
        info = new Info(id, null, Instant.now());
    }

    void run() {
        while (!shutdown.get()) {
            Url url;
            try {
                url = queue.poll(crawlConfig.pollInterval());
            } catch (InterruptedException e) {
                return;
            }
            if (url == null) continue;

            try {
                process(url);
            } catch (InterruptedException e) {
                log.atInfo().addKeyValue("url", url).log("Interrupted, releasing URL");
                frontier.release(url);
                return;
            } catch (JdbiException e) {
                log.atError().addKeyValue("url", url).setCause(e).log("Frontier update failed");
                releaseAfterError(url);
            } catch (RuntimeException e) {
                log.atError().addKeyValue("url", url).setCause(e).log("Unexpected error processing URL");
                failedUnexpectedly(url, e);
            } finally {
                updateInfo(new Info(id, null, Instant.now()));
            }
        }
    }

    private void process(Url url) throws InterruptedException {
        FrontierUrl claimed = frontier.claim(url);
        if (claimed == null) {
            log.atDebug().addKeyValue("url", url).log("Skipping URL that is no longer pending");
            return;
        }
        updateInfo(new Info(id, url, Instant.now()));

        Duration delay = crawlConfig.delay();
        if (delay != null && !delay.isZero()) Thread.sleep(delay.toMillis());

        log.atInfo().addKeyValue("url", url).addKeyValue("worker", id).log("Fetching");
        try {
            FetchResult result = fetcher.fetch(url);
            if (SitemapExpander.isSitemap(result, claimed.sitemap())) {
                processSitemap(url, result);
            } else {
                processPage(url, result);
            }
        } catch (FetchException | SitemapException e) {
            failed(claimed, e.getMessage());
        } catch (IOException e) {
            failed(claimed, "Failed to write page record: " + e.getMessage());
        }
    }

    private void processSitemap(Url url, FetchResult result) throws SitemapException {
        List<SitemapEntry> entries = sitemapExpander.expand(url, result.body());
        var sitemaps = new ArrayList<Url>();
        var pages = new ArrayList<Url>();
        for (SitemapEntry entry : entries) {
            (entry.sitemap() ? sitemaps : pages).add(entry.url());
        }
        List<Url> added = new ArrayList<>(frontier.addUrls(sitemaps, true));
        added.addAll(frontier.addUrls(pages, false));
        queue.addAll(added);
        frontier.markVisited(url, true);
        log.atInfo().addKeyValue("url", url).addKeyValue("entries", entries.size())
                .addKeyValue("new", added.size()).log("Visited sitemap");
    }

    private void processPage(Url url, FetchResult result) throws IOException {
        ExtractedPage page = pageExtractor.extract(url, result.text());
        sink.append(new PageRecord(url, page.title(), result.status(), page.excerpt(excerptLength)));
        List<Url> added = frontier.addUrls(page.links(), false);
        queue.addAll(added);
        frontier.markVisited(url, false);
        log.atInfo().addKeyValue("url", url).addKeyValue("links", page.links().size())
                .addKeyValue("new", added.size()).log("Visited page");
    }

    private void failed(FrontierUrl claimed, String error) {
        Url url = claimed.url();
        FrontierUrl.State state = frontier.markRetryOrError(url, error);
        if (state == FrontierUrl.State.PENDING) {
            int retryCount = claimed.retryCount() + 1;
            log.atWarn().addKeyValue("url", url).addKeyValue("retryCount", retryCount)
                    .addKeyValue("error", error).log("Fetch failed, will retry");
            retryScheduler.schedule(url, retryCount);
        } else {
            log.atError().addKeyValue("url", url).addKeyValue("error", error)
                    .log("Fetch failed, giving up");
        }
    }

    /**
     * Hands a claimed URL back to PENDING so it isn't stuck IN_PROGRESS for the rest of the run.
     */
    private void releaseAfterError(Url url) {
        try {
            frontier.release(url);
        } catch (JdbiException e) {
            log.atWarn().addKeyValue("url", url).setCause(e).log("Failed to release URL");
        }
    }

    /**
     * Counts an unexpected error against a URL that is still claimed, like a failed fetch.
     */
    private void failedUnexpectedly(Url url, RuntimeException cause) {
        try {
            FrontierUrl row = frontier.find(url);
            if (row != null && row.status() == FrontierUrl.State.IN_PROGRESS) {
                failed(row, "Unexpected error: " + cause);
            }
        } catch (JdbiException e) {
            log.atWarn().addKeyValue("url", url).setCause(e).log("Failed to record error for URL");
        }
    }

    private void updateInfo(Info info) {
        this.info = info;
    }

    public synchronized void start() {
        log.info("Starting worker {}", id);
        thread = new Thread(() -> {
            try {
                run();
            } catch (Throwable e) {
                log.error("Worker crashed", e);
            }
            log.debug("Worker {} exited", id);
        }, "Worker-" + id);
        thread.start();
    }

    /**
     * Waits for the worker to notice the shutdown flag. If it is still busy after the timeout, it is
     * interrupted.
     *
     * @return true if the worker thread has ended
     */
    boolean join(Duration timeout) {
        Thread thread;
        synchronized (this) {
            thread = this.thread;
        }
        if (thread == null) return true;
        try {
            thread.join(timeout.toMillis());
            if (thread.isAlive()) {
                log.warn("Worker {} still busy after {}, interrupting", id, timeout);
                thread.interrupt();
                thread.join(1000);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !thread.isAlive();
    }

    /**
     * What a worker is doing.
     *
     * @param url the URL being processed or null if idle
     */
    public record Info(
            String id,
            @Nullable Url url,
            Instant updateTime) {
    }

    public Info info() {
        return info;
    }
}
