package org.netpreserve.trawler;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.trawler.util.Url;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * In-memory FIFO of URLs waiting for a worker. The frontier is the authority on what may be fetched so
 * duplicates and stale entries here are harmless: a worker drops anything it cannot claim.
 */
public class WorkQueue {
    private final BlockingQueue<Url> queue = new LinkedBlockingQueue<>();

    public void offer(Url url) {
        queue.offer(url);
    }

    public void addAll(Collection<Url> urls) {
        queue.addAll(urls);
    }

    /**
     * Waits up to the given time for a URL.
     *
     * @return the next URL or null if none arrived in time
     */
    public @Nullable Url poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Removes queued URLs matching the predicate. Workers may still take matching URLs concurrently.
     *
     * @return the number of entries removed
     */
    public int removeMatching(Predicate<Url> predicate) {
        int removed = 0;
        for (var iterator = queue.iterator(); iterator.hasNext(); ) {
            if (predicate.test(iterator.next())) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    public int removePrefix(String prefix) {
        return removeMatching(url -> url.startsWith(prefix));
    }

    public int size() {
        return queue.size();
    }

    public void clear() {
        queue.clear();
    }

    public List<Url> snapshot() {
        return List.copyOf(queue);
    }
}
