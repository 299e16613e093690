package org.netpreserve.trawler;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.jdbi.v3.core.HandleConsumer;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.argument.ArgumentFactory;
import org.jdbi.v3.core.argument.NullArgument;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.ParsedSql;
import org.jdbi.v3.core.statement.SqlLogger;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.netpreserve.trawler.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.sql.Types;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import static org.jdbi.v3.core.generic.GenericTypes.getErasedType;

/**
 * SQLite database holding the crawl frontier.
 * <p>
 * File databases run in WAL mode so readers are never blocked by the writer. An in-memory database only
 * exists for the lifetime of its single connection.
 */
public class Database implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Database.class);
    private final HikariDataSource dataSource;
    private final Jdbi jdbi;
    private final FrontierDAO frontier;
    private volatile boolean closed;

    private Database(HikariDataSource dataSource) {
        this.dataSource = dataSource;
        this.jdbi = Jdbi.create(dataSource);
        jdbi.installPlugin(new SqlObjectPlugin());
        jdbi.registerColumnMapper(Url.class, stringColumnMapper(Url::new));
        jdbi.registerArgument(stringArgument(Url.class, Url::toString));
        jdbi.setSqlLogger(new SqlLogger() {
            @Override
            public void logAfterExecution(StatementContext context) {
                if (context.getExecutionMoment() == null || context.getCompletionMoment() == null) return;
                var duration = Duration.between(context.getExecutionMoment(), context.getCompletionMoment());
                var durationMillis = duration.toMillis();
                if (durationMillis > 100) {
                    ParsedSql parsedSql = context.getParsedSql();
                    String sql = parsedSql != null ? parsedSql.getSql() : "<sql unavailable>";
                    log.warn("[Slow SQL] {}ms {}", durationMillis, sql);
                }
            }
        });
        this.frontier = jdbi.onDemand(FrontierDAO.class);
    }

    public static Database newDatabaseInMemory() {
        return open("jdbc:sqlite::memory:", 1);
    }

    /**
     * Opens (creating if necessary) a database file.
     *
     * @param connections size of the connection pool, at least 1
     */
    public static Database open(Path path, int connections) {
        return open("jdbc:sqlite:" + path, Math.max(1, connections));
    }

    static Database open(String jdbcUrl, int connections) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setPoolName("frontier-db");
        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("synchronous", "NORMAL");
        config.addDataSourceProperty("busy_timeout", "60000");
        config.setMaximumPoolSize(connections);
        // the in-memory database disappears with its connection
        config.setMaxLifetime(0);
        config.setIdleTimeout(0);
        Database db = new Database(new HikariDataSource(config));
        db.init();
        return db;
    }

    private static <T> ColumnMapper<T> stringColumnMapper(Function<String,T> constructor) {
        return (r, col, ctx) -> {
            String value = r.getString(col);
            return value == null ? null : constructor.apply(value);
        };
    }

    @SuppressWarnings("unchecked")
    private static <T> ArgumentFactory.Preparable stringArgument(Class<T> clazz, Function<T, String> getter) {
        return (type, config) -> {
            if (!clazz.isAssignableFrom(getErasedType(type))) return Optional.empty();
            return Optional.of(value -> {
                if (value == null) return new NullArgument(Types.VARCHAR);
                return (pos, stmt, ctx) -> stmt.setString(pos, getter.apply((T) value));
            });
        };
    }

    private void init() {
        // we can't use @SqlScript because we need to use executeAsSeparateStatements() on sqlite
        try (var stream = Objects.requireNonNull(Database.class.getResourceAsStream("schema.sql"), "missing schema.sql")) {
            var schema = new String(stream.readAllBytes());
            jdbi.useHandle(handle -> handle.createScript(schema).executeAsSeparateStatements());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public FrontierDAO frontier() {
        return frontier;
    }

    /**
     * Runs the callback in a single transaction with a DAO bound to it.
     */
    public <R> R inTransaction(Function<FrontierDAO, R> callback) {
        return jdbi.inTransaction(handle -> callback.apply(handle.attach(FrontierDAO.class)));
    }

    public <X extends Exception> void useHandle(HandleConsumer<X> callback) throws X {
        jdbi.useHandle(callback);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        dataSource.close();
        log.info("Closed frontier database");
    }
}
