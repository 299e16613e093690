package org.netpreserve.trawler.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UrlTest {
    @Test
    public void testNormalize() {
        assertEquals("https://example.com/", Url.normalize("HTTPS://Example.COM").toString());
        assertEquals("http://example.com/a/b?x=1", Url.normalize("  http://example.com/a/b?x=1#section ").toString());
        assertEquals("http://example.com/", Url.normalize("http://example.com:80/").toString());
        assertEquals("https://example.com:8443/", Url.normalize("https://example.com:8443/").toString());
        assertEquals("https://example.com/Path/Case", Url.normalize("https://EXAMPLE.com/Path/Case").toString());
    }

    @Test
    public void testNormalizeRejects() {
        assertNull(Url.normalize(null));
        assertNull(Url.normalize(""));
        assertNull(Url.normalize("   "));
        assertNull(Url.normalize("/relative/path"));
        assertNull(Url.normalize("mailto:someone@example.com"));
        assertNull(Url.normalize("ftp://example.com/file"));
        assertNull(Url.normalize("http://"));
    }

    @Test
    public void testNormalizeResolvesDotSegments() {
        assertEquals("http://example.com/b", Url.normalize("http://example.com/a/../b").toString());
        assertEquals("http://example.com/b", Url.normalize("http://example.com/./b").toString());
        assertEquals(Url.normalize("http://example.com/b"), Url.normalize("HTTP://example.com:80/x/./../b#frag"));
    }

    @Test
    public void testNormalizedUrlsAreEqual() {
        assertEquals(Url.normalize("http://EXAMPLE.com/page#top"), Url.normalize("http://example.com/page"));
        assertNotEquals(Url.normalize("http://example.com/page"), Url.normalize("http://example.com/Page"));
    }

    @Test
    public void testHostAndDomain() {
        Url url = new Url("https://www.example.co.uk/news/today");
        assertEquals("www.example.co.uk", url.host());
        assertEquals("example.co.uk", url.domain());
        assertEquals("example.co.uk/news", url.hostAndFirstSegment());
        assertEquals("blog.example.com", new Url("https://blog.example.com/").hostAndFirstSegment());
        assertEquals("127.0.0.1", new Url("http://127.0.0.1:8080/x").domain());
    }

    @Test
    public void testIsOnDomain() {
        assertTrue(new Url("https://example.com/").isOnDomain("example.com"));
        assertTrue(new Url("https://blog.Example.com/x").isOnDomain("EXAMPLE.com"));
        assertFalse(new Url("https://notexample.com/").isOnDomain("example.com"));
        assertFalse(new Url("https://example.com.evil.org/").isOnDomain("example.com"));
    }

    @Test
    public void testLooksLikeSitemap() {
        assertTrue(new Url("https://example.com/sitemap.xml").looksLikeSitemap());
        assertTrue(new Url("https://example.com/sitemaps/pages.XML.gz").looksLikeSitemap());
        assertTrue(new Url("https://example.com/sitemap.xml?page=2").looksLikeSitemap());
        assertFalse(new Url("https://example.com/index.html").looksLikeSitemap());
        assertFalse(new Url("https://example.com/xml").looksLikeSitemap());
    }

    @Test
    public void testStartsWithIsLiteral() {
        Url url = new Url("https://a.com/blogger/post");
        assertTrue(url.startsWith("https://a.com/blog"));
        assertFalse(url.startsWith("https://a.com/Blog"));
        assertFalse(url.startsWith("https://a.com/b_og"));
    }

    @Test
    public void testWithoutFragment() {
        assertEquals(new Url("http://example.com/a"), new Url("http://example.com/a#b").withoutFragment());
    }
}
