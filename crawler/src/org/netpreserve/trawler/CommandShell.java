package org.netpreserve.trawler;

import org.netpreserve.trawler.FrontierDAO.NameCount;
import org.netpreserve.trawler.FrontierUrl.State;
import org.netpreserve.trawler.util.Url;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Line-oriented operator console for a running crawl.
 */
public class CommandShell {
    static final int LIST_LIMIT = 20;
    private static final String HELP = """
            Commands:
              seed <url>             - add a new seed URL (page or sitemap)
              pause <url>            - pause a single URL
              pause-prefix <prefix>  - pause all pending URLs with given prefix
              resume <url>           - resume a paused or failed URL
              resume-prefix <prefix> - resume paused URLs with prefix
              resume-domain <domain> - resume paused URLs on a domain and its subdomains
              resume-all             - resume every paused URL
              list <prefix>          - list pending URLs with prefix
              list-paused            - list paused URLs
              stats                  - show crawler statistics and top paused domains
              status                 - show worker & URL counts
              stop / quit / exit     - save state and exit
              help                   - show this help""";

    private final Job job;
    private final BufferedReader in;
    private final PrintStream out;

    public CommandShell(Job job, BufferedReader in, PrintStream out) {
        this.job = job;
        this.in = in;
        this.out = out;
    }

    /**
     * Reads and executes commands until a stop command or the end of input.
     *
     * @return true if the operator asked to stop, false if input ended
     */
    public boolean run() throws IOException {
        out.println("Crawler started. Type 'help' for commands.");
        while (true) {
            out.print("> ");
            out.flush();
            String line = in.readLine();
            if (line == null) return false;
            if (!execute(line)) return true;
        }
    }

    /**
     * Executes a single command line.
     *
     * @return false if the command asks the shell to exit
     */
    public boolean execute(String line) {
        line = line.strip();
        if (line.isEmpty()) return true;
        String[] parts = line.split("\\s+", 2);
        String command = parts[0].toLowerCase(Locale.ROOT);
        String arg = parts.length > 1 ? parts[1].strip() : "";

        switch (command) {
            case "stop", "quit", "exit" -> {
                out.println("Stopping crawler... (workers will finish current tasks)");
                return false;
            }
            case "help" -> out.println(HELP);
            case "seed" -> withUrl(command, arg, this::seed);
            case "pause" -> withUrl(command, arg, url -> report(job.pause(url), url, "Paused URL: ", "URL is not pending: "));
            case "resume" -> withUrl(command, arg, url -> report(job.resume(url), url, "Resumed URL: ", "URL is not paused: "));
            case "pause-prefix" -> withArg(command, "<prefix>", arg, prefix -> {
                var result = job.pauseByPrefix(prefix);
                out.println("Paused " + result.paused() + " URL(s) with prefix: " + prefix
                            + " (removed " + result.dequeued() + " from in-memory queue)");
            });
            case "resume-prefix" -> withArg(command, "<prefix>", arg, prefix ->
                    out.println("Resumed " + job.resumeByPrefix(prefix) + " URL(s) with prefix: " + prefix));
            case "resume-domain" -> withArg(command, "<domain>", arg, domain ->
                    out.println("Resumed " + job.resumeByDomain(domain) + " paused URL(s) for domain " + domain));
            case "resume-all" -> out.println("Resumed " + job.resumeAll() + " paused URL(s).");
            case "list" -> withArg(command, "<prefix>", arg, this::listPending);
            case "list-paused" -> listPaused();
            case "stats" -> printStats(job.stats());
            case "status" -> printStatus();
            default -> out.println("Unknown command: '" + command + "'. Type 'help' for list of commands.");
        }
        return true;
    }

    private void seed(Url url) {
        if (job.seed(url)) {
            out.println("Seeded URL: " + url);
        } else {
            out.println("URL already known (skipped): " + url);
        }
    }

    private void report(Frontier.Transition transition, Url url, String changed, String invalid) {
        switch (transition) {
            case CHANGED -> out.println(changed + url);
            case NOT_FOUND -> out.println("URL not found in DB: " + url);
            case INVALID -> out.println(invalid + url);
        }
    }

    private void listPending(String prefix) {
        List<FrontierUrl> pending = job.listPending(prefix);
        out.println("Found " + pending.size() + " pending URL(s) with prefix '" + prefix + "':");
        for (FrontierUrl row : pending.subList(0, Math.min(LIST_LIMIT, pending.size()))) {
            out.println("  " + row.url());
        }
        if (pending.size() > LIST_LIMIT) out.println("  ... (truncated)");
    }

    private void listPaused() {
        List<FrontierUrl> paused = job.listPaused();
        out.println("Found " + paused.size() + " paused URL(s):");
        for (FrontierUrl row : paused.subList(0, Math.min(LIST_LIMIT, paused.size()))) {
            out.println("  " + row.url());
        }
        if (paused.size() > LIST_LIMIT) out.println("  ... (truncated)");
    }

    private void printStatus() {
        Map<State, Long> counts = job.statusCounts();
        out.println("Workers: " + job.workerInfo().size()
                    + " | Queued: " + job.queueSize()
                    + " | Retrying: " + job.retriesScheduled()
                    + " | Pending: " + counts.get(State.PENDING)
                    + " | In progress: " + counts.get(State.IN_PROGRESS)
                    + " | Visited: " + counts.get(State.VISITED)
                    + " | Paused: " + counts.get(State.PAUSED)
                    + " | Error: " + counts.get(State.ERROR));
    }

    void printStats(CrawlStats stats) {
        out.println();
        out.println("=== Crawler Stats ===");
        out.println("Total URLs: " + stats.total());
        out.println("  Pending: " + stats.count(State.PENDING)
                    + "  In progress: " + stats.count(State.IN_PROGRESS)
                    + "  Visited: " + stats.count(State.VISITED)
                    + "  Paused: " + stats.count(State.PAUSED)
                    + "  Error: " + stats.count(State.ERROR));
        out.println("Earliest seed: " + (stats.earliestUrl() == null ? "none" : stats.earliestUrl()));
        printCounts("Top paused domains:", stats.topPausedDomains());
        printCounts("Top paused prefixes (host[/first_segment]):", stats.topPausedPrefixes());
        printCounts("Top domains overall:", stats.domains());
        out.println();
    }

    private void printCounts(String heading, List<NameCount> counts) {
        out.println();
        out.println(heading);
        if (counts.isEmpty()) out.println("  (none)");
        for (NameCount count : counts) {
            out.println("  " + count.name() + ": " + count.count());
        }
    }

    private void withArg(String command, String usage, String arg, Consumer<String> action) {
        if (arg.isEmpty()) {
            out.println("Usage: " + command + " " + usage);
            return;
        }
        action.accept(arg);
    }

    private void withUrl(String command, String arg, Consumer<Url> action) {
        withArg(command, "<url>", arg, raw -> {
            Url url = Url.normalize(raw);
            if (url == null) {
                out.println("Invalid URL: " + raw);
                return;
            }
            action.accept(url);
        });
    }
}
