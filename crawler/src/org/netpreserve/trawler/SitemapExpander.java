package org.netpreserve.trawler;

import crawlercommons.sitemaps.AbstractSiteMap;
import crawlercommons.sitemaps.SiteMap;
import crawlercommons.sitemaps.SiteMapIndex;
import crawlercommons.sitemaps.SiteMapParser;
import crawlercommons.sitemaps.SiteMapURL;
import crawlercommons.sitemaps.UnknownFormatException;
import org.netpreserve.trawler.fetch.FetchResult;
import org.netpreserve.trawler.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;

/**
 * Turns sitemap and sitemap index documents into frontier entries.
 */
public class SitemapExpander {
    private static final Logger log = LoggerFactory.getLogger(SitemapExpander.class);

    /**
     * A URL found in a sitemap.
     *
     * @param sitemap true if the URL was listed by a sitemap index and so is itself a sitemap
     */
    public record SitemapEntry(Url url, boolean sitemap) {
    }

    /**
     * Guesses whether a fetched body is a sitemap. HTML content types are always pages. XML content types and
     * gzip bodies are sitemaps. Otherwise the discovery flag or the URL's .xml suffix decides.
     */
    public static boolean isSitemap(FetchResult result, boolean flagged) {
        String mediaType = result.mediaType();
        if (mediaType.equals("text/html") || mediaType.equals("application/xhtml+xml")) return false;
        if (isGzip(result.body())) return true;
        if (mediaType.endsWith("/xml") || mediaType.endsWith("+xml")) return true;
        return flagged || result.url().looksLikeSitemap();
    }

    static boolean isGzip(byte[] body) {
        return body.length >= 2 && (body[0] & 0xff) == 0x1f && (body[1] & 0xff) == 0x8b;
    }

    /**
     * Parses a sitemap body, decompressing it first if it is gzipped.
     *
     * @return the listed URLs, children of an index flagged as sitemaps
     * @throws SitemapException if the body is not a readable sitemap or sitemap index
     */
    public List<SitemapEntry> expand(Url sitemapUrl, byte[] body) throws SitemapException {
        byte[] xml = isGzip(body) ? gunzip(sitemapUrl, body) : body;
        AbstractSiteMap parsed;
        try {
            parsed = new SiteMapParser(false).parseSiteMap("application/xml", xml, sitemapUrl.toURI().toURL());
        } catch (UnknownFormatException | IOException | URISyntaxException | IllegalArgumentException e) {
            throw new SitemapException("Failed to parse sitemap " + sitemapUrl + ": " + e.getMessage(), e);
        }
        if (parsed == null) throw new SitemapException("Unrecognised sitemap " + sitemapUrl);

        var entries = new ArrayList<SitemapEntry>();
        if (parsed instanceof SiteMapIndex index) {
            for (AbstractSiteMap child : index.getSitemaps()) {
                add(entries, child.getUrl().toString(), true);
            }
            log.atInfo().addKeyValue("url", sitemapUrl).addKeyValue("sitemaps", entries.size())
                    .log("Parsed sitemap index");
        } else if (parsed instanceof SiteMap siteMap) {
            for (SiteMapURL siteMapUrl : siteMap.getSiteMapUrls()) {
                add(entries, siteMapUrl.getUrl().toString(), false);
            }
            log.atInfo().addKeyValue("url", sitemapUrl).addKeyValue("urls", entries.size())
                    .log("Parsed sitemap");
        } else {
            throw new SitemapException("Unrecognised sitemap type " + parsed.getClass().getSimpleName()
                                       + " for " + sitemapUrl);
        }
        return entries;
    }

    private static void add(List<SitemapEntry> entries, String location, boolean sitemap) {
        Url url = Url.normalize(location);
        if (url == null) {
            log.debug("Ignoring invalid sitemap location {}", location);
            return;
        }
        entries.add(new SitemapEntry(url, sitemap));
    }

    private static byte[] gunzip(Url url, byte[] body) throws SitemapException {
        try (InputStream stream = new GZIPInputStream(new ByteArrayInputStream(body))) {
            return stream.readAllBytes();
        } catch (IOException e) {
            throw new SitemapException("Failed to decompress sitemap " + url + ": " + e.getMessage(), e);
        }
    }
}
