package org.netpreserve.trawler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.netpreserve.trawler.util.Url;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandShellTest {
    private Job job;
    private ByteArrayOutputStream buffer;
    private CommandShell shell;

    @BeforeEach
    void setUp() {
        job = new Job(Database.newDatabaseInMemory(), new FakeFetcher(), new ContentSink(new StringWriter()),
                JobTest.config(List.of()));
        buffer = new ByteArrayOutputStream();
        shell = new CommandShell(job, new BufferedReader(new StringReader("")),
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        job.close();
    }

    private String run(String line) {
        buffer.reset();
        assertTrue(shell.execute(line));
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testSeed() {
        assertEquals("Seeded URL: https://example.com/\n", run("seed https://Example.com"));
        assertEquals("URL already known (skipped): https://example.com/\n", run("seed https://example.com/#top"));
        assertEquals("Invalid URL: ftp://example.com/\n", run("seed ftp://example.com/"));
        assertEquals("Usage: seed <url>\n", run("seed"));
    }

    @Test
    void testPauseAndResume() {
        run("seed https://example.com/a");
        assertEquals("URL not found in DB: https://example.com/missing\n", run("pause https://example.com/missing"));
        assertEquals("Paused URL: https://example.com/a\n", run("pause https://example.com/a"));
        assertEquals("URL is not pending: https://example.com/a\n", run("pause https://example.com/a"));
        assertEquals("Resumed URL: https://example.com/a\n", run("RESUME https://example.com/a"));
        assertEquals("URL is not paused: https://example.com/a\n", run("resume https://example.com/a"));
    }

    @Test
    void testPrefixCommands() {
        run("seed https://example.com/blog/1");
        run("seed https://example.com/blog/2");
        run("seed https://example.com/shop/1");

        assertEquals("Paused 2 URL(s) with prefix: https://example.com/blog/ (removed 2 from in-memory queue)\n",
                run("pause-prefix https://example.com/blog/"));
        assertEquals("Resumed 1 URL(s) with prefix: https://example.com/blog/1\n",
                run("resume-prefix https://example.com/blog/1"));
        assertEquals("Resumed 1 paused URL(s).\n", run("resume-all"));
        assertEquals("Usage: pause-prefix <prefix>\n", run("pause-prefix"));
    }

    @Test
    void testResumeDomainAndListPaused() {
        run("seed https://example.com/a");
        run("seed https://news.example.com/b");
        run("seed https://example.org/c");
        run("pause-prefix https://");

        assertEquals("Found 3 paused URL(s):\n  https://example.com/a\n  https://news.example.com/b\n"
                     + "  https://example.org/c\n", run("list-paused"));

        assertEquals("Resumed 2 paused URL(s) for domain example.com\n", run("resume-domain example.com"));
        assertEquals("Resumed 0 paused URL(s) for domain example.com\n", run("resume-domain example.com"));
        assertEquals("Found 1 paused URL(s):\n  https://example.org/c\n", run("list-paused"));
        assertEquals("Usage: resume-domain <domain>\n", run("resume-domain"));
        assertEquals(2, job.queueSize());
    }

    @Test
    void testListTruncatesAtTwentyUrls() {
        for (int i = 0; i < 25; i++) {
            job.seed(new Url("https://example.com/item/" + i));
        }

        String[] lines = run("list https://example.com/item/").split("\n");

        assertEquals("Found 25 pending URL(s) with prefix 'https://example.com/item/':", lines[0]);
        assertEquals("  https://example.com/item/0", lines[1]);
        assertEquals(CommandShell.LIST_LIMIT + 2, lines.length);
        assertEquals("  ... (truncated)", lines[lines.length - 1]);
    }

    @Test
    void testStatsAndStatus() {
        run("seed https://www.example.com/");
        run("seed https://blog.example.com/posts/1");
        run("pause https://blog.example.com/posts/1");

        String stats = run("stats");
        assertTrue(stats.contains("Total URLs: 2"), stats);
        assertTrue(stats.contains("Earliest seed: https://www.example.com/"), stats);
        assertTrue(stats.contains("Top paused prefixes (host[/first_segment]):\n  blog.example.com/posts: 1"), stats);
        assertTrue(stats.contains("Top domains overall:\n  example.com: 2"), stats);

        String status = run("status");
        assertTrue(status.startsWith("Workers: 0 | Queued: 1 | Retrying: 0 | Pending: 1 |"), status);
        assertTrue(status.contains("Paused: 1"), status);
    }

    @Test
    void testHelpAndUnknownCommands() {
        assertTrue(run("help").contains("pause-prefix <prefix>"));
        assertEquals("Unknown command: 'dance'. Type 'help' for list of commands.\n", run("dance"));
        assertEquals("", run("   "));
    }

    @Test
    void testStopCommandsEndTheShell() {
        assertFalse(shell.execute("stop"));
        assertFalse(shell.execute("quit"));
        assertFalse(shell.execute("exit"));
    }

    @Test
    void testRunEndsAtEndOfInput() throws IOException {
        var input = new BufferedReader(new StringReader("seed https://example.com/\nstatus\n"));
        var shell = new CommandShell(job, input, new PrintStream(buffer, true, StandardCharsets.UTF_8));
        assertFalse(shell.run());
        assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("Seeded URL: https://example.com/"));

        input = new BufferedReader(new StringReader("stop\nseed https://example.com/never\n"));
        shell = new CommandShell(job, input, new PrintStream(buffer, true, StandardCharsets.UTF_8));
        assertTrue(shell.run());
        assertNull(job.frontier().find(new Url("https://example.com/never")));
    }
}
