package org.netpreserve.trawler;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.trawler.FrontierDAO.NameCount;
import org.netpreserve.trawler.FrontierUrl.State;
import org.netpreserve.trawler.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;

/**
 * The durable record of every URL the crawl has discovered and what has happened to it.
 * <p>
 * All writes go through the synchronized methods of this class so there is a single logical writer.
 * Reads go straight to the database and may run concurrently with each other.
 */
public class Frontier {
    private static final Logger log = LoggerFactory.getLogger(Frontier.class);
    private final Database db;
    private final int maxRetries;

    public Frontier(Database db, int maxRetries) {
        this.db = db;
        this.maxRetries = maxRetries;
    }

    public enum Transition {
        CHANGED, NOT_FOUND, INVALID
    }

    /**
     * Records a newly discovered URL as PENDING.
     *
     * @return true if the URL was not already known
     */
    public synchronized boolean addUrl(Url url, boolean sitemap) {
        String host = Objects.requireNonNullElse(url.host(), "");
        String domain = Objects.requireNonNullElse(url.domain(), host);
        return db.frontier().addUrl(url, host, domain, sitemap, Instant.now()) > 0;
    }

    /**
     * Records a batch of discovered URLs in one transaction.
     *
     * @return the URLs that were not already known, in input order
     */
    public synchronized List<Url> addUrls(Collection<Url> urls, boolean sitemap) {
        if (urls.isEmpty()) return List.of();
        Instant now = Instant.now();
        List<Url> added = db.inTransaction(dao -> {
            var novel = new ArrayList<Url>();
            for (Url url : urls) {
                String host = Objects.requireNonNullElse(url.host(), "");
                String domain = Objects.requireNonNullElse(url.domain(), host);
                if (dao.addUrl(url, host, domain, sitemap, now) > 0) novel.add(url);
            }
            return novel;
        });
        log.debug("Added {} new URLs out of {}", added.size(), urls.size());
        return added;
    }

    /**
     * Takes the lease on a URL for processing by moving it from PENDING to IN_PROGRESS.
     *
     * @return the claimed row or null if the URL is unknown or not PENDING
     */
    public synchronized @Nullable FrontierUrl claim(Url url) {
        return db.inTransaction(dao -> {
            if (dao.compareAndSetStatus(url, State.PENDING, State.IN_PROGRESS, Instant.now()) == 0) return null;
            return dao.findByUrl(url);
        });
    }

    /**
     * Gives back a lease without recording an outcome.
     */
    public synchronized boolean release(Url url) {
        return db.frontier().compareAndSetStatus(url, State.IN_PROGRESS, State.PENDING, Instant.now()) > 0;
    }

    public synchronized boolean markVisited(Url url, boolean sitemap) {
        return db.frontier().markVisited(url, sitemap, Instant.now()) > 0;
    }

    /**
     * Records a failed attempt. The URL goes back to PENDING until its retry count exceeds the maximum,
     * then it becomes ERROR. URLs that are not PENDING or IN_PROGRESS are left alone.
     *
     * @return the resulting state
     * @throws IllegalArgumentException if the URL is not in the frontier
     */
    public synchronized State markRetryOrError(Url url, String error) {
        return db.inTransaction(dao -> {
            FrontierUrl row = dao.findByUrl(url);
            if (row == null) throw new IllegalArgumentException("Not in frontier: " + url);
            if (row.status() != State.PENDING && row.status() != State.IN_PROGRESS) return row.status();
            int retryCount = row.retryCount() + 1;
            State status = retryCount > maxRetries ? State.ERROR : State.PENDING;
            dao.recordFailure(url, status, retryCount, error, Instant.now());
            return status;
        });
    }

    /**
     * Moves a URL to the given state if the state machine allows it.
     */
    public synchronized Transition setStatus(Url url, State status) {
        return db.inTransaction(dao -> {
            FrontierUrl row = dao.findByUrl(url);
            if (row == null) return Transition.NOT_FOUND;
            if (!row.status().canTransitionTo(status)) return Transition.INVALID;
            if (dao.compareAndSetStatus(url, row.status(), status, Instant.now()) == 0) return Transition.INVALID;
            return Transition.CHANGED;
        });
    }

    public Transition pause(Url url) {
        return setStatus(url, State.PAUSED);
    }

    /**
     * Returns a PAUSED or ERROR URL to PENDING. Resuming an ERROR URL keeps its retry count.
     */
    public synchronized Transition resume(Url url) {
        return db.inTransaction(dao -> {
            FrontierUrl row = dao.findByUrl(url);
            if (row == null) return Transition.NOT_FOUND;
            if (row.status() != State.PAUSED && row.status() != State.ERROR) return Transition.INVALID;
            dao.compareAndSetStatus(url, row.status(), State.PENDING, Instant.now());
            return Transition.CHANGED;
        });
    }

    /**
     * Pauses every PENDING URL starting with the literal prefix.
     *
     * @return the number of URLs paused
     */
    public synchronized int pauseByPrefix(String prefix) {
        return db.frontier().updateStatusByPrefix(prefix, State.PENDING, State.PAUSED, Instant.now());
    }

    /**
     * Resumes every PAUSED URL starting with the literal prefix.
     *
     * @return the resumed URLs
     */
    public synchronized List<Url> resumeByPrefix(String prefix) {
        return db.inTransaction(dao -> {
            List<Url> urls = dao.findUrlsByPrefix(prefix, State.PAUSED);
            dao.updateStatusByPrefix(prefix, State.PAUSED, State.PENDING, Instant.now());
            return urls;
        });
    }

    /**
     * Resumes every PAUSED URL whose host is the domain or one of its subdomains.
     *
     * @return the resumed URLs
     */
    public synchronized List<Url> resumeByDomain(String domain) {
        return db.inTransaction(dao -> {
            var resumed = new ArrayList<Url>();
            Instant now = Instant.now();
            for (FrontierUrl row : dao.listByStatus(State.PAUSED)) {
                if (row.url().isOnDomain(domain) && dao.compareAndSetStatus(row.url(), State.PAUSED, State.PENDING, now) > 0) {
                    resumed.add(row.url());
                }
            }
            return resumed;
        });
    }

    public List<Url> resumeAllPaused() {
        return resumeByPrefix("");
    }

    /**
     * Returns URLs left IN_PROGRESS by an unclean shutdown to PENDING.
     */
    public synchronized int recoverInterrupted() {
        int count = db.frontier().releaseAllInProgress(Instant.now());
        if (count > 0) log.info("Recovered {} interrupted URLs", count);
        return count;
    }

    public @Nullable FrontierUrl find(Url url) {
        return db.frontier().findByUrl(url);
    }

    public List<FrontierUrl> listByStatus(State status) {
        return db.frontier().listByStatus(status);
    }

    public List<FrontierUrl> listByPrefix(String prefix, @Nullable State status) {
        return db.frontier().listByPrefix(prefix, status);
    }

    /**
     * Counts of URLs in each state. Every state is present.
     */
    public Map<State, Long> countsByStatus() {
        var counts = new EnumMap<State, Long>(State.class);
        for (State state : State.values()) counts.put(state, 0L);
        for (var row : db.frontier().countByStatus()) counts.put(row.status(), row.count());
        return counts;
    }

    public List<NameCount> countsByDomain(int limit) {
        return db.frontier().countByDomain(null, limit);
    }

    public @Nullable Url earliestUrl() {
        return db.frontier().earliestUrl();
    }

    public CrawlStats stats(int topN) {
        var counts = countsByStatus();
        long total = counts.values().stream().mapToLong(Long::longValue).sum();

        var prefixCounts = new HashMap<String, Long>();
        for (FrontierUrl paused : listByStatus(State.PAUSED)) {
            String prefix = paused.url().hostAndFirstSegment();
            if (prefix != null) prefixCounts.merge(prefix, 1L, Long::sum);
        }
        List<NameCount> topPrefixes = prefixCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
                .limit(topN)
                .map(e -> new NameCount(e.getKey(), e.getValue()))
                .toList();

        return new CrawlStats(counts, total, earliestUrl(),
                db.frontier().countByDomain(State.PAUSED, topN),
                topPrefixes,
                countsByDomain(topN));
    }
}
