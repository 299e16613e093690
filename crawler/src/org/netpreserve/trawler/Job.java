package org.netpreserve.trawler;

import org.netpreserve.trawler.config.CrawlConfig;
import org.netpreserve.trawler.config.JobConfig;
import org.netpreserve.trawler.config.StorageConfig;
import org.netpreserve.trawler.fetch.Fetcher;
import org.netpreserve.trawler.fetch.HttpFetcher;
import org.netpreserve.trawler.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A crawl: the frontier, the queue feeding the workers and the workers themselves.
 * <p>
 * A job is started once. Stopping it waits for the workers, then releases the database and output file,
 * after which the job is CLOSED and a new one must be opened to continue crawling.
 */
public class Job implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Job.class);
    private static final int STATS_TOP_N = 10;
    private final Database db;
    private final Frontier frontier;
    private final WorkQueue queue = new WorkQueue();
    private final RetryScheduler retryScheduler;
    private final Fetcher fetcher;
    private final ContentSink sink;
    private final JobConfig config;
    private final AtomicBoolean shutdown = new AtomicBoolean();
    private final List<Worker> workers = new ArrayList<>();
    private final Lock startStopLock = new ReentrantLock();
    private final CountDownLatch closedLatch = new CountDownLatch(1);
    private volatile State state = State.STOPPED;

    public enum State {
        STOPPED, STARTING, RUNNING, STOPPING, CLOSED
    }

    /**
     * Result of pausing by prefix.
     *
     * @param paused   frontier rows moved from PENDING to PAUSED
     * @param dequeued entries removed from the in-memory queue
     */
    public record PrefixPause(int paused, int dequeued) {
    }

    Job(Database db, Fetcher fetcher, ContentSink sink, JobConfig config) {
        this.db = db;
        this.fetcher = fetcher;
        this.sink = sink;
        this.config = config;
        this.frontier = new Frontier(db, config.crawl().maxRetries());
        this.retryScheduler = new RetryScheduler(queue, config.crawl().retryBackoff());
    }

    /**
     * Opens the database and output file in the job directory, creating them if necessary.
     */
    public static Job open(Path jobDir, JobConfig config) throws IOException {
        Files.createDirectories(jobDir);
        StorageConfig storage = config.storage();
        CrawlConfig crawl = config.crawl();
        Database db = Database.open(jobDir.resolve(storage.database()), storage.readConnections());
        ContentSink sink;
        try {
            sink = ContentSink.open(jobDir.resolve(storage.output()));
        } catch (IOException | RuntimeException e) {
            db.close();
            throw e;
        }
        return new Job(db, new HttpFetcher(crawl.userAgent(), crawl.timeout()), sink, config);
    }

    public static int recommendedWorkers() {
        int cpus = Runtime.getRuntime().availableProcessors();
        return Math.max(2, Math.min(32, cpus * 4));
    }

    public void start() throws BadStateException {
        start(config.crawl().workers());
    }

    /**
     * Recovers interrupted URLs, queues everything PENDING and starts the workers.
     *
     * @param workerCount number of workers, 0 or less to use {@link #recommendedWorkers()}
     */
    public void start(int workerCount) throws BadStateException {
        if (!startStopLock.tryLock()) throw new BadStateException("Crawl busy " + state);
        try {
            if (state != State.STOPPED) throw new BadStateException("Can only start a STOPPED crawl");
            state = State.STARTING;
            shutdown.set(false);
            frontier.recoverInterrupted();
            addConfiguredSeeds();
            int loaded = loadPendingIntoQueue();
            int count = workerCount > 0 ? workerCount : recommendedWorkers();
            log.atInfo().addKeyValue("workers", count).addKeyValue("queued", loaded).log("Starting crawl");
            for (int i = 0; i < count; i++) {
                workers.add(new Worker(String.valueOf(i), frontier, queue, fetcher, sink, retryScheduler,
                        config.crawl(), config.storage().excerptLength(), shutdown));
            }
            for (Worker worker : workers) {
                worker.start();
            }
            state = State.RUNNING;
        } catch (RuntimeException e) {
            state = State.STOPPED;
            stopWorkers();
            throw e;
        } finally {
            startStopLock.unlock();
        }
    }

    private void addConfiguredSeeds() {
        for (String seed : config.seeds()) {
            Url url = Url.normalize(seed);
            if (url == null) {
                log.warn("Ignoring invalid seed URL: {}", seed);
                continue;
            }
            frontier.addUrl(url, url.looksLikeSitemap());
        }
    }

    /**
     * Replaces the queue contents with every PENDING URL in the frontier.
     *
     * @return the number of URLs queued
     */
    int loadPendingIntoQueue() {
        queue.clear();
        var pending = frontier.listByStatus(FrontierUrl.State.PENDING);
        for (FrontierUrl row : pending) {
            queue.offer(row.url());
        }
        return pending.size();
    }

    /**
     * Stops the workers and releases the database and output file. Workers busy with a fetch finish it
     * first, or are interrupted if that takes longer than the fetch timeout.
     */
    public void stop() throws BadStateException {
        if (!startStopLock.tryLock()) throw new BadStateException("Crawl busy " + state);
        try {
            if (state != State.RUNNING) throw new BadStateException("Can only stop a RUNNING crawl");
            shutdownAndRelease();
        } finally {
            startStopLock.unlock();
        }
    }

    @Override
    public void close() {
        startStopLock.lock();
        try {
            if (state == State.CLOSED) return;
            shutdownAndRelease();
        } finally {
            startStopLock.unlock();
        }
    }

    private void shutdownAndRelease() {
        state = State.STOPPING;
        log.info("Stopping crawl");
        stopWorkers();
        retryScheduler.close();
        try {
            sink.close();
        } catch (IOException e) {
            log.error("Failed to close content sink", e);
        }
        try {
            db.close();
        } catch (Exception e) {
            log.error("Failed to close database", e);
        }
        state = State.CLOSED;
        closedLatch.countDown();
        log.info("Crawl stopped, state saved");
    }

    private void stopWorkers() {
        shutdown.set(true);
        CrawlConfig crawl = config.crawl();
        Duration joinTimeout = crawl.timeout().plus(crawl.delay()).plus(crawl.pollInterval()).plusSeconds(1);
        for (Worker worker : workers) {
            worker.join(joinTimeout);
        }
        workers.clear();
    }

    /**
     * Blocks until the job has been closed.
     */
    public void awaitClosed() throws InterruptedException {
        closedLatch.await();
    }

    /**
     * Adds a URL to the frontier and, if it is new, to the queue.
     *
     * @return true if the URL was not already known
     */
    public boolean seed(Url url) {
        boolean added = frontier.addUrl(url, url.looksLikeSitemap());
        if (added) {
            queue.offer(url);
            log.atInfo().addKeyValue("url", url).log("Seeded URL");
        }
        return added;
    }

    public Frontier.Transition pause(Url url) {
        var result = frontier.pause(url);
        if (result == Frontier.Transition.CHANGED) {
            queue.removeMatching(url::equals);
            log.atInfo().addKeyValue("url", url).log("Paused URL");
        }
        return result;
    }

    public Frontier.Transition resume(Url url) {
        var result = frontier.resume(url);
        if (result == Frontier.Transition.CHANGED) {
            queue.offer(url);
            log.atInfo().addKeyValue("url", url).log("Resumed URL");
        }
        return result;
    }

    /**
     * Pauses every PENDING URL with the literal prefix and drops them from the queue.
     */
    public PrefixPause pauseByPrefix(String prefix) {
        int paused = frontier.pauseByPrefix(prefix);
        int dequeued = queue.removePrefix(prefix);
        log.atInfo().addKeyValue("prefix", prefix).addKeyValue("paused", paused)
                .addKeyValue("dequeued", dequeued).log("Paused prefix");
        return new PrefixPause(paused, dequeued);
    }

    /**
     * @return the number of URLs resumed
     */
    public int resumeByPrefix(String prefix) {
        List<Url> resumed = frontier.resumeByPrefix(prefix);
        queue.addAll(resumed);
        log.atInfo().addKeyValue("prefix", prefix).addKeyValue("resumed", resumed.size()).log("Resumed prefix");
        return resumed.size();
    }

    public int resumeByDomain(String domain) {
        List<Url> resumed = frontier.resumeByDomain(domain);
        queue.addAll(resumed);
        log.atInfo().addKeyValue("domain", domain).addKeyValue("resumed", resumed.size()).log("Resumed domain");
        return resumed.size();
    }

    public int resumeAll() {
        List<Url> resumed = frontier.resumeAllPaused();
        queue.addAll(resumed);
        log.atInfo().addKeyValue("resumed", resumed.size()).log("Resumed all paused URLs");
        return resumed.size();
    }

    public List<FrontierUrl> listPending(String prefix) {
        return frontier.listByPrefix(prefix, FrontierUrl.State.PENDING);
    }

    public List<FrontierUrl> listPaused() {
        return frontier.listByStatus(FrontierUrl.State.PAUSED);
    }

    public CrawlStats stats() {
        return frontier.stats(STATS_TOP_N);
    }

    public Map<FrontierUrl.State, Long> statusCounts() {
        return frontier.countsByStatus();
    }

    public Frontier frontier() {
        return frontier;
    }

    WorkQueue queue() {
        return queue;
    }

    public int queueSize() {
        return queue.size();
    }

    public int retriesScheduled() {
        return retryScheduler.pending();
    }

    public JobConfig config() {
        return config;
    }

    public State state() {
        return state;
    }

    public List<Worker.Info> workerInfo() {
        List<Worker> workers;
        startStopLock.lock();
        try {
            workers = new ArrayList<>(this.workers);
        } finally {
            startStopLock.unlock();
        }
        List<Worker.Info> infoList = new ArrayList<>(workers.size());
        for (var worker : workers) {
            infoList.add(worker.info());
        }
        return infoList;
    }

    public static class BadStateException extends Exception {
        public BadStateException(String message) {
            super(message);
        }
    }
}
