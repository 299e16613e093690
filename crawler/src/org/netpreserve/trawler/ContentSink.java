package org.netpreserve.trawler;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends one JSON object per line for every processed page.
 */
public class ContentSink implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(ContentSink.class);
    private final ObjectMapper mapper = new ObjectMapper()
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    private final Writer writer;
    private boolean closed;

    public ContentSink(Writer writer) {
        this.writer = writer;
    }

    public static ContentSink open(Path path) throws IOException {
        log.info("Writing page records to {}", path);
        return new ContentSink(Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE));
    }

    /**
     * Writes and flushes a record.
     */
    public synchronized void append(PageRecord record) throws IOException {
        if (closed) throw new IOException("Content sink is closed");
        writer.write(mapper.writeValueAsString(record));
        writer.write('\n');
        writer.flush();
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) return;
        closed = true;
        writer.close();
    }
}
