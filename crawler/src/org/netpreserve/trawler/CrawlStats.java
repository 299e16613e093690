package org.netpreserve.trawler;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.trawler.FrontierDAO.NameCount;
import org.netpreserve.trawler.FrontierUrl.State;
import org.netpreserve.trawler.util.Url;

import java.util.List;
import java.util.Map;

/**
 * Summary of the frontier for display to the operator.
 *
 * @param counts             number of URLs in each state
 * @param total              number of URLs discovered
 * @param earliestUrl        the first URL ever added, usually the first seed
 * @param topPausedDomains   registrable domains with the most PAUSED URLs
 * @param topPausedPrefixes  host and first path segment with the most PAUSED URLs
 * @param domains            registrable domains with the most URLs overall
 */
public record CrawlStats(
        Map<State, Long> counts,
        long total,
        @Nullable Url earliestUrl,
        List<NameCount> topPausedDomains,
        List<NameCount> topPausedPrefixes,
        List<NameCount> domains) {

    public long count(State state) {
        return counts.getOrDefault(state, 0L);
    }
}
