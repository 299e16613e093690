package org.netpreserve.trawler.fetch;

import org.netpreserve.trawler.util.Url;

import java.util.List;

/**
 * Summary of an HTML page.
 *
 * @param title page title, empty if none
 * @param text  visible text with whitespace collapsed
 * @param links normalized outbound http(s) links in document order, without duplicates
 */
public record ExtractedPage(String title, String text, List<Url> links) {
    public String excerpt(int maxLength) {
        if (text.length() <= maxLength) return text;
        return text.substring(0, maxLength);
    }
}
