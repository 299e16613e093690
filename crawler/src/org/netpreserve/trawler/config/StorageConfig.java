package org.netpreserve.trawler.config;

/**
 * Storage configuration. Relative paths are resolved against the job directory.
 *
 * @param database        SQLite file holding the frontier
 * @param output          JSON Lines file page records are appended to
 * @param excerptLength   maximum number of characters of page text in a record
 * @param readConnections size of the database connection pool
 */
public record StorageConfig(
        String database,
        String output,
        int excerptLength,
        int readConnections
) {
}
