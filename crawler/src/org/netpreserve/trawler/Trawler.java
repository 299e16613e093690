package org.netpreserve.trawler;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.rolling.FixedWindowRollingPolicy;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.SizeBasedTriggeringPolicy;
import ch.qos.logback.core.util.FileSize;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.netpreserve.trawler.config.JobConfig;
import org.netpreserve.trawler.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Objects;

public class Trawler {
    private static final Logger log = LoggerFactory.getLogger(Trawler.class);

    public static void main(String[] args) throws Exception {
        Path jobDir = Path.of(".");
        Integer workers = null;
        String delay = null;
        var seeds = new ArrayList<String>();
        boolean dumpConfig = false;

        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--dump-config" -> dumpConfig = true;
                    case "--job-dir", "-j" -> jobDir = Path.of(optionValue(args, i++));
                    case "--workers", "-w" -> workers = intValue(args[i], optionValue(args, i++));
                    case "--delay", "-d" -> delay = optionValue(args, i++);
                    case "--help", "-h" -> {
                        System.out.println("Usage: trawler [options] [URL...]");
                        System.out.println("Options:");
                        System.out.println("  -h, --help");
                        System.out.println("  -j, --job-dir DIR        Directory for crawl state and output (default: .)");
                        System.out.println("  -w, --workers N          Number of worker threads (0 = auto)");
                        System.out.println("  -d, --delay DURATION     Delay before each request, e.g. 1s or 500ms");
                        System.out.println("      --dump-config        Print the effective configuration and exit");
                        System.exit(0);
                    }
                    default -> {
                        if (args[i].startsWith("-")) {
                            System.err.println("Unknown option: " + args[i]);
                            System.exit(1);
                        }
                        seeds.add(args[i]);
                    }
                }
            }
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("Try --help for usage.");
            System.exit(1);
        }

        var mapper = newMapper();
        ObjectNode overrides = mapper.createObjectNode();
        ObjectNode crawlOverrides = overrides.putObject("crawl");
        if (workers != null) {
            if (workers < 0) {
                System.err.println("--workers must not be negative");
                System.exit(1);
            }
            crawlOverrides.put("workers", workers);
        }
        if (delay != null) crawlOverrides.put("delay", delay);

        JobConfig config = loadConfig(mapper, jobDir, overrides);
        if (dumpConfig) {
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config));
            System.exit(0);
        }

        Files.createDirectories(jobDir);
        startLogFile(jobDir.resolve("crawler.log"));

        Job job = Job.open(jobDir, config);
        for (String seed : seeds) {
            Url url = Url.normalize(seed);
            if (url == null) {
                System.err.println("Invalid URL: " + seed);
                continue;
            }
            job.frontier().addUrl(url, url.looksLikeSitemap());
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                job.close();
            } catch (Exception e) {
                System.err.println("Error shutting down crawl: " + e.getMessage());
                e.printStackTrace(System.err);
            }
        }, "shutdown-hook"));

        var counts = job.statusCounts();
        System.out.println("Current DB state -> Pending: " + counts.get(FrontierUrl.State.PENDING)
                           + ", Visited: " + counts.get(FrontierUrl.State.VISITED)
                           + ", Paused: " + counts.get(FrontierUrl.State.PAUSED)
                           + ", Error: " + counts.get(FrontierUrl.State.ERROR));
        job.start();

        var shell = new CommandShell(job, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                System.out);
        if (shell.run()) {
            job.close();
            System.out.println("State saved. Exiting.");
        } else {
            log.info("Standard input closed, crawling until interrupted");
            job.awaitClosed();
        }
    }

    static String optionValue(String[] args, int i) {
        if (i + 1 >= args.length) throw new IllegalArgumentException("Missing value for option " + args[i]);
        return args[i + 1];
    }

    static int intValue(String option, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Option " + option + " expects a number but got '" + value + "'");
        }
    }

    static ObjectMapper newMapper() {
        return new ObjectMapper(new YAMLFactory())
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Reads the built-in defaults, then config.yaml from the job directory if present, then the given
     * overrides, each merged over the previous.
     */
    static JobConfig loadConfig(ObjectMapper mapper, Path jobDir, JsonNode overrides) throws IOException {
        JsonNode configTree;
        try (var stream = Objects.requireNonNull(Trawler.class.getResourceAsStream("config/defaults.yaml"),
                "missing config/defaults.yaml")) {
            configTree = mapper.readTree(stream);
        }
        Path configFile = jobDir.resolve("config.yaml");
        if (Files.exists(configFile)) {
            configTree = deepMerge(configTree, mapper.readTree(configFile.toFile()));
        }
        configTree = deepMerge(configTree, overrides);
        return mapper.treeToValue(configTree, JobConfig.class);
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            // for simple values or arrays, always take override
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode overrideValue = entry.getValue();
            if (merged.has(key)) {
                JsonNode baseValue = merged.get(key);
                merged.set(key, deepMerge(baseValue, overrideValue));
            } else {
                merged.set(key, overrideValue);
            }
        });
        return merged;
    }

    /**
     * Adds a size-rotated log file to the root logger: crawler.log plus up to four older files of 5 MB.
     */
    private static void startLogFile(Path file) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss} [%thread] %-5level %logger{36} %msg %kvp%n");
        encoder.start();

        var appender = new RollingFileAppender<ILoggingEvent>();
        appender.setContext(context);
        appender.setName("crawler-log-file");
        appender.setFile(file.toString());
        appender.setEncoder(encoder);

        var rollingPolicy = new FixedWindowRollingPolicy();
        rollingPolicy.setContext(context);
        rollingPolicy.setParent(appender);
        rollingPolicy.setFileNamePattern(file + ".%i");
        rollingPolicy.setMinIndex(1);
        rollingPolicy.setMaxIndex(4);
        rollingPolicy.start();

        var triggeringPolicy = new SizeBasedTriggeringPolicy<ILoggingEvent>();
        triggeringPolicy.setContext(context);
        triggeringPolicy.setMaxFileSize(FileSize.valueOf("5MB"));
        triggeringPolicy.start();

        appender.setRollingPolicy(rollingPolicy);
        appender.setTriggeringPolicy(triggeringPolicy);
        appender.start();

        context.getLogger(ch.qos.logback.classic.Logger.ROOT_LOGGER_NAME).addAppender(appender);
    }
}
