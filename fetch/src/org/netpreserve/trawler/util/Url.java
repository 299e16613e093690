package org.netpreserve.trawler.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import de.malkusch.whoisServerList.publicSuffixList.PublicSuffixList;
import de.malkusch.whoisServerList.publicSuffixList.PublicSuffixListFactory;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.urlcanon.Canonicalizer;
import org.netpreserve.urlcanon.ParsedUrl;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * URL type which caches parsing.
 * <p>
 * Instances created through {@link #normalize(String)} are in the canonical form used as the frontier key:
 * http(s) only, WHATWG canonicalized (lowercase scheme and host, no default port, dot segments resolved,
 * non-empty path) and without a fragment.
 */
public class Url {
    private static final PublicSuffixList publicSuffixList = new PublicSuffixListFactory().build();
    private final String url;
    private URI uri;
    private ParsedUrl parsedUrl;

    @JsonCreator
    public Url(String url) {
        this.url = url;
    }

    /**
     * Parses and canonicalizes an absolute http or https URL.
     *
     * @return the normalized URL or null if the string isn't a usable http(s) URL
     */
    public static @Nullable Url normalize(String url) {
        if (url == null) return null;
        url = url.strip();
        if (url.isEmpty()) return null;

        ParsedUrl parsed = ParsedUrl.parseUrl(url);
        String scheme = parsed.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) return null;
        try {
            Canonicalizer.WHATWG.canonicalize(parsed);
        } catch (IllegalArgumentException e) {
            return null;
        }
        if (parsed.getHost().isEmpty()) return null;
        return new Url(parsed.toString()).withoutFragment();
    }

    private ParsedUrl parse() {
        if (parsedUrl == null) {
            parsedUrl = ParsedUrl.parseUrl(url);
        }
        return parsedUrl;
    }

    public synchronized URI toURI() throws URISyntaxException {
        if (uri == null) {
            uri = new URI(url);
        }
        return uri;
    }

    public @Nullable String host() {
        String host = parse().getHost();
        return host.isEmpty() ? null : host.toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the registrable domain (e.g. "example.co.uk" for "www.example.co.uk"), falling back to the
     * host for IP addresses and hosts without a known public suffix.
     */
    public @Nullable String domain() {
        String host = host();
        if (host == null || host.startsWith("[") || Character.isDigit(host.charAt(host.length() - 1))) {
            return host;
        }
        String domain = publicSuffixList.getRegistrableDomain(host);
        if (domain == null) return host;
        return domain;
    }

    /**
     * True if this URL's host is the given domain or one of its subdomains.
     */
    public boolean isOnDomain(String domain) {
        String host = host();
        if (host == null) return false;
        domain = domain.toLowerCase(Locale.ROOT);
        return host.equals(domain) || host.endsWith("." + domain);
    }

    /**
     * Host without a leading "www." followed by the first path segment, if any. Used to group URLs in stats.
     */
    public @Nullable String hostAndFirstSegment() {
        String host = host();
        if (host == null) return null;
        if (host.startsWith("www.")) host = host.substring(4);
        for (String segment : path().split("/")) {
            if (!segment.isEmpty()) return host + "/" + segment;
        }
        return host;
    }

    public String path() {
        return parse().getPath();
    }

    @JsonValue
    public String toString() {
        return url;
    }

    public Url withoutFragment() {
        int i = url.indexOf('#');
        if (i == -1) {
            return this;
        }
        return new Url(url.substring(0, i));
    }

    /**
     * Literal string prefix test, no case folding or wildcards.
     */
    public boolean startsWith(String prefix) {
        return url.startsWith(prefix);
    }

    /**
     * True if the path ends in .xml or .xml.gz.
     */
    public boolean looksLikeSitemap() {
        String path = path().toLowerCase(Locale.ROOT);
        return path.endsWith(".xml") || path.endsWith(".xml.gz");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Url url1 = (Url) o;
        return url.equals(url1.url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }
}
