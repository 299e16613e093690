package org.netpreserve.trawler;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.netpreserve.trawler.FrontierUrl.State;
import org.netpreserve.trawler.util.MustUpdate;
import org.netpreserve.trawler.util.Url;

import java.time.Instant;
import java.util.List;

@RegisterConstructorMapper(FrontierUrl.class)
@RegisterConstructorMapper(FrontierDAO.StatusCount.class)
@RegisterConstructorMapper(FrontierDAO.NameCount.class)
public interface FrontierDAO {
    // literal prefix match, LIKE would treat % and _ as wildcards and ignore case
    String PREFIX_MATCH = "substr(url, 1, length(:prefix)) = :prefix";

    @SqlUpdate("""
            INSERT INTO frontier (url, host, domain, status, retry_count, sitemap, time_added, last_updated)
            VALUES (:url, :host, :domain, 'PENDING', 0, :sitemap, :now, :now)
            ON CONFLICT(url) DO NOTHING""")
    int addUrl(Url url, String host, String domain, boolean sitemap, Instant now);

    @SqlQuery("SELECT * FROM frontier WHERE url = ?")
    FrontierUrl findByUrl(Url url);

    @SqlUpdate("UPDATE frontier SET status = :status, last_updated = :now WHERE url = :url AND status = :expected")
    int compareAndSetStatus(Url url, State expected, State status, Instant now);

    @SqlUpdate("""
            UPDATE frontier
            SET status = 'VISITED', sitemap = :sitemap, last_updated = :now
            WHERE url = :url AND status IN ('PENDING', 'IN_PROGRESS')""")
    int markVisited(Url url, boolean sitemap, Instant now);

    @SqlUpdate("""
            UPDATE frontier
            SET status = :status, retry_count = :retryCount, last_error = :error, last_updated = :now
            WHERE url = :url""")
    @MustUpdate
    void recordFailure(Url url, State status, int retryCount, String error, Instant now);

    @SqlQuery("SELECT * FROM frontier WHERE status = ? ORDER BY id")
    List<FrontierUrl> listByStatus(State status);

    @SqlQuery("SELECT * FROM frontier WHERE (:status IS NULL OR status = :status) AND " + PREFIX_MATCH + " ORDER BY id")
    List<FrontierUrl> listByPrefix(String prefix, State status);

    @SqlQuery("SELECT url FROM frontier WHERE status = :status AND " + PREFIX_MATCH + " ORDER BY id")
    List<Url> findUrlsByPrefix(String prefix, State status);

    @SqlUpdate("UPDATE frontier SET status = :status, last_updated = :now WHERE status = :expected AND " + PREFIX_MATCH)
    int updateStatusByPrefix(String prefix, State expected, State status, Instant now);

    @SqlUpdate("UPDATE frontier SET status = 'PENDING', last_updated = :now WHERE status = 'IN_PROGRESS'")
    int releaseAllInProgress(Instant now);

    @SqlQuery("SELECT status, COUNT(*) AS count FROM frontier GROUP BY status")
    List<StatusCount> countByStatus();

    @SqlQuery("""
            SELECT domain AS name, COUNT(*) AS count FROM frontier
            WHERE (:status IS NULL OR status = :status)
            GROUP BY domain ORDER BY count DESC, domain LIMIT :limit""")
    List<NameCount> countByDomain(State status, int limit);

    @SqlQuery("SELECT COUNT(*) FROM frontier")
    long count();

    @SqlQuery("SELECT url FROM frontier ORDER BY id LIMIT 1")
    Url earliestUrl();

    record StatusCount(State status, long count) {
    }

    record NameCount(String name, long count) {
    }
}
