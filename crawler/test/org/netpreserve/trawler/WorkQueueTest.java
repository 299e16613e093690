package org.netpreserve.trawler;

import org.junit.jupiter.api.Test;
import org.netpreserve.trawler.util.Url;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkQueueTest {
    private final WorkQueue queue = new WorkQueue();

    @Test
    void testFifo() throws InterruptedException {
        queue.offer(new Url("https://example.com/1"));
        queue.addAll(List.of(new Url("https://example.com/2"), new Url("https://example.com/3")));

        assertEquals(3, queue.size());
        assertEquals(new Url("https://example.com/1"), queue.poll(Duration.ofMillis(10)));
        assertEquals(new Url("https://example.com/2"), queue.poll(Duration.ofMillis(10)));
        assertEquals(List.of(new Url("https://example.com/3")), queue.snapshot());
    }

    @Test
    void testPollTimesOutWhenEmpty() throws InterruptedException {
        long start = System.nanoTime();
        assertNull(queue.poll(Duration.ofMillis(50)));
        assertTrue(System.nanoTime() - start >= Duration.ofMillis(40).toNanos());
    }

    @Test
    void testRemovePrefix() {
        queue.addAll(List.of(
                new Url("https://example.com/blog/1"),
                new Url("https://example.com/shop/1"),
                new Url("https://example.com/blog/2"),
                new Url("https://example.com/blogger/1")));

        assertEquals(2, queue.removePrefix("https://example.com/blog/"));
        assertEquals(List.of(new Url("https://example.com/shop/1"), new Url("https://example.com/blogger/1")),
                queue.snapshot());
        assertEquals(0, queue.removePrefix("https://other.example/"));
    }

    @Test
    void testClear() {
        queue.offer(new Url("https://example.com/"));
        queue.clear();
        assertEquals(0, queue.size());
    }
}
