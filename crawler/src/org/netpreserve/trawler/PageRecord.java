package org.netpreserve.trawler;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.netpreserve.trawler.util.Url;

/**
 * Summary of a fetched page as written to the output file.
 *
 * @param content leading visible text of the page, bounded in length
 */
public record PageRecord(
        Url url,
        String title,
        @JsonProperty("status_code") int statusCode,
        String content) {
}
