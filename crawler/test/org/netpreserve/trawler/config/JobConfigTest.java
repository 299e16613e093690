package org.netpreserve.trawler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JobConfigTest {
    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory()).findAndRegisterModules();

    @Test
    public void test() throws IOException {
        var jobConfig = mapper.readValue(getClass().getResource("example.yaml"), JobConfig.class);
        assertEquals(List.of("https://example.com/", "https://example.com/sitemap.xml"), jobConfig.seeds());

        CrawlConfig crawl = jobConfig.crawl();
        assertEquals("ExampleBot/2.0", crawl.userAgent());
        assertEquals(4, crawl.workers());
        assertEquals(Duration.ofMillis(250), crawl.delay());
        assertEquals(Duration.ofSeconds(10), crawl.timeout());
        assertEquals(5, crawl.maxRetries());
        assertEquals(Duration.ofMinutes(2), crawl.retryBackoff());
        assertEquals(Duration.ofMillis(500), crawl.pollInterval());

        assertEquals(new StorageConfig("state.db", "pages.jsonl", 200, 2), jobConfig.storage());
    }

    @Test
    public void testIsoDurationsAndMissingSeeds() throws IOException {
        var jobConfig = mapper.readValue("""
                crawl:
                  delay: PT0.5S
                  timeout: 1h
                """, JobConfig.class);
        assertEquals(List.of(), jobConfig.seeds());
        assertEquals(Duration.ofMillis(500), jobConfig.crawl().delay());
        assertEquals(Duration.ofHours(1), jobConfig.crawl().timeout());
    }

    @Test
    public void testInvalidDuration() {
        assertThrows(InvalidFormatException.class, () -> mapper.readValue("""
                crawl:
                  delay: soon
                """, JobConfig.class));
    }
}
