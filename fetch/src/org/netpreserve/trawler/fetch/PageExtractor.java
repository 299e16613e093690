package org.netpreserve.trawler.fetch;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.netpreserve.trawler.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Extracts the title, visible text and outbound links of an HTML document using Jsoup.
 */
public class PageExtractor {
    private static final Logger log = LoggerFactory.getLogger(PageExtractor.class);

    public ExtractedPage extract(Url url, String html) {
        Document document = Jsoup.parse(html, url.toString());
        String title = document.title().strip();
        Element body = document.body();
        String text = body == null ? "" : body.text();

        Set<Url> links = new LinkedHashSet<>();
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.absUrl("href");
            if (href.isEmpty()) continue;
            Url link = Url.normalize(href);
            if (link == null) {
                log.trace("Ignoring link {} on {}", href, url);
                continue;
            }
            links.add(link);
        }
        return new ExtractedPage(title, text, new ArrayList<>(links));
    }
}
