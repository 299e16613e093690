package org.netpreserve.trawler.fetch;

import org.netpreserve.trawler.util.Url;

/**
 * Retrieves the raw content of a URL.
 */
public interface Fetcher {
    /**
     * @throws FetchException on any transient failure: connection errors, timeouts and non-2xx responses
     */
    FetchResult fetch(Url url) throws FetchException, InterruptedException;
}
