package org.netpreserve.trawler.fetch;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.netpreserve.trawler.util.Url;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpFetcherTest {
    private HttpServer httpServer;
    private final AtomicReference<String> userAgent = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        httpServer.createContext("/", exchange -> {
            userAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
            switch (exchange.getRequestURI().getPath()) {
                case "/page" -> {
                    byte[] body = "<title>café</title>".getBytes(StandardCharsets.ISO_8859_1);
                    exchange.getResponseHeaders().add("Content-Type", "text/html; charset=ISO-8859-1");
                    exchange.sendResponseHeaders(200, body.length);
                    exchange.getResponseBody().write(body);
                }
                case "/moved" -> {
                    exchange.getResponseHeaders().add("Location", "/page");
                    exchange.sendResponseHeaders(301, -1);
                }
                case "/slow" -> {
                    try {
                        Thread.sleep(2000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    exchange.sendResponseHeaders(200, -1);
                }
                default -> exchange.sendResponseHeaders(404, -1);
            }
            exchange.close();
        });
        httpServer.start();
    }

    @AfterEach
    void tearDown() {
        httpServer.stop(0);
    }

    private Url url(String path) {
        return new Url("http://127.0.0.1:" + httpServer.getAddress().getPort() + path);
    }

    @Test
    public void testSuccess() throws Exception {
        var fetcher = new HttpFetcher("TestBot/1.0", Duration.ofSeconds(5));
        FetchResult result = fetcher.fetch(url("/page"));
        assertEquals(200, result.status());
        assertEquals("text/html", result.mediaType());
        assertEquals(StandardCharsets.ISO_8859_1, result.charset());
        assertEquals("<title>café</title>", result.text());
        assertEquals("TestBot/1.0", userAgent.get());
    }

    @Test
    public void testFollowsRedirects() throws Exception {
        var fetcher = new HttpFetcher("TestBot/1.0", Duration.ofSeconds(5));
        FetchResult result = fetcher.fetch(url("/moved"));
        assertEquals(200, result.status());
        assertEquals(url("/moved"), result.url());
    }

    @Test
    public void testNotFoundIsFetchFailure() {
        var fetcher = new HttpFetcher("TestBot/1.0", Duration.ofSeconds(5));
        var e = assertThrows(FetchException.class, () -> fetcher.fetch(url("/missing")));
        assertEquals(404, e.status());
        assertEquals(url("/missing"), e.url());
    }

    @Test
    public void testTimeoutIsFetchFailure() {
        var fetcher = new HttpFetcher("TestBot/1.0", Duration.ofMillis(200));
        var e = assertThrows(FetchException.class, () -> fetcher.fetch(url("/slow")));
        assertEquals(-1, e.status());
    }

    @Test
    public void testConnectionRefusedIsFetchFailure() throws IOException {
        int port;
        try (var socket = new java.net.ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        var fetcher = new HttpFetcher("TestBot/1.0", Duration.ofSeconds(2));
        assertThrows(FetchException.class, () -> fetcher.fetch(new Url("http://127.0.0.1:" + port + "/")));
    }
}
