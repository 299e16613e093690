package org.netpreserve.trawler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.trawler.config.JobConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrawlerTest {
    @TempDir
    Path jobDir;

    @Test
    void testOptionValues() {
        String[] args = {"--workers", "4", "--delay"};
        assertEquals("4", Trawler.optionValue(args, 0));
        var missing = assertThrows(IllegalArgumentException.class, () -> Trawler.optionValue(args, 2));
        assertEquals("Missing value for option --delay", missing.getMessage());

        assertEquals(4, Trawler.intValue("--workers", "4"));
        var notNumber = assertThrows(IllegalArgumentException.class, () -> Trawler.intValue("-w", "many"));
        assertEquals("Option -w expects a number but got 'many'", notNumber.getMessage());
    }

    @Test
    void testDefaults() throws IOException {
        var mapper = Trawler.newMapper();
        JobConfig config = Trawler.loadConfig(mapper, jobDir, mapper.createObjectNode());

        assertEquals(List.of(), config.seeds());
        assertEquals(0, config.crawl().workers());
        assertEquals(Duration.ofSeconds(1), config.crawl().delay());
        assertEquals(Duration.ofSeconds(15), config.crawl().timeout());
        assertEquals(3, config.crawl().maxRetries());
        assertEquals(Duration.ofSeconds(30), config.crawl().retryBackoff());
        assertEquals("crawler_state.db", config.storage().database());
        assertEquals("scraped_data.jsonl", config.storage().output());
        assertEquals(500, config.storage().excerptLength());
    }

    @Test
    void testConfigFileAndOverridesMergeOverDefaults() throws IOException {
        Files.writeString(jobDir.resolve("config.yaml"), """
                seeds: [https://example.com/]
                crawl:
                  workers: 8
                  delay: 2s
                storage:
                  output: pages.jsonl
                """);
        var mapper = Trawler.newMapper();
        ObjectNode overrides = mapper.createObjectNode();
        overrides.putObject("crawl").put("delay", "250ms");

        JobConfig config = Trawler.loadConfig(mapper, jobDir, overrides);

        assertEquals(List.of("https://example.com/"), config.seeds());
        assertEquals(8, config.crawl().workers());
        assertEquals(Duration.ofMillis(250), config.crawl().delay());
        assertEquals(Duration.ofSeconds(15), config.crawl().timeout());
        assertEquals("pages.jsonl", config.storage().output());
        assertEquals("crawler_state.db", config.storage().database());
    }

    @Test
    void testDumpedConfigReadsBack() throws IOException {
        var mapper = Trawler.newMapper();
        JobConfig config = Trawler.loadConfig(mapper, jobDir, mapper.createObjectNode());
        String yaml = mapper.writeValueAsString(config);
        assertEquals(config, mapper.readValue(yaml, JobConfig.class));
    }
}
