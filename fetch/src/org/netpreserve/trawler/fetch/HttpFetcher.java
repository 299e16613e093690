package org.netpreserve.trawler.fetch;

import org.netpreserve.trawler.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;

/**
 * Fetches URLs with the JDK HTTP client using a fixed User-Agent and request timeout.
 */
public class HttpFetcher implements Fetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpFetcher.class);
    private final HttpClient httpClient;
    private final String userAgent;
    private final Duration timeout;

    public HttpFetcher(String userAgent, Duration timeout) {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(timeout)
                .build(), userAgent, timeout);
    }

    public HttpFetcher(HttpClient httpClient, String userAgent, Duration timeout) {
        this.httpClient = httpClient;
        this.userAgent = userAgent;
        this.timeout = timeout;
    }

    @Override
    public FetchResult fetch(Url url) throws FetchException, InterruptedException {
        URI uri;
        try {
            uri = url.toURI();
        } catch (URISyntaxException e) {
            throw new FetchException(url, "Invalid URL: " + e.getMessage(), e);
        }

        HttpResponse<byte[]> response;
        long fetchStart = System.currentTimeMillis();
        try {
            response = httpClient.send(HttpRequest.newBuilder(uri)
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .GET()
                    .build(), BodyHandlers.ofByteArray());
        } catch (IOException | IllegalArgumentException e) {
            throw new FetchException(url, e.toString(), e);
        }
        long fetchTimeMs = System.currentTimeMillis() - fetchStart;

        int status = response.statusCode();
        log.debug("GET {} -> {} in {}ms", url, status, fetchTimeMs);
        if (status < 200 || status >= 300) {
            throw new FetchException(url, status);
        }
        String contentType = response.headers().firstValue("Content-Type").orElse(null);
        return new FetchResult(url, status, contentType, response.body());
    }
}
