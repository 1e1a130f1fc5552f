package com.delta.urlscout.crawl.extract;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LinkExtractorTest {
    private final LinkExtractor extractor = new LinkExtractor();

    @Test
    void readsAnchorsFramesFormsAndMetaRefresh() {
        String html = """
            <html><head>
              <meta http-equiv="refresh" content="5; url=/moved">
            </head><body>
              <a href="/about">About</a>
              <a href="news/latest.html">News</a>
              <a href="#top">Top</a>
              <a href="mailto:info@example.com">Mail</a>
              <a href="javascript:void(0)">Nothing</a>
              <iframe src="https://example.com/embed"></iframe>
              <form action="/search"><input name="q"></form>
            </body></html>
            """;

        ExtractedLinks links = extractor.extractLinks(html, "text/html", "https://example.com/section/", ExtractionMode.STANDARD);

        assertThat(links.urls()).containsExactlyInAnyOrder(
            "https://example.com/about",
            "https://example.com/section/news/latest.html",
            "https://example.com/embed",
            "https://example.com/search",
            "https://example.com/moved"
        );
        assertThat(links.parseErrors()).isZero();
    }

    @Test
    void findsUrlsInScriptsAndInlineStyles() {
        String html = """
            <html><body>
              <div style="background: url('/img/hero.jpg')"></div>
              <script>
                window.location.href = "/redirected";
                fetchPage('/archive/page-2.html');
              </script>
            </body></html>
            """;

        assertThat(extractor.extract(html, "text/html", "https://example.com/"))
            .contains("https://example.com/img/hero.jpg", "https://example.com/redirected", "https://example.com/archive/page-2.html");
    }

    @Test
    void aggressiveModeAddsLinkTagsSourcesAndDataAttributes() {
        String html = """
            <html><head><link rel="alternate" href="/feed"></head><body>
              <img src="/images/logo.png">
              <map><area href="/region"></map>
              <div data-url="/hidden/section" data-count="12"></div>
            </body></html>
            """;

        ExtractedLinks standard = extractor.extractLinks(html, "text/html", "https://example.com/", ExtractionMode.STANDARD);
        ExtractedLinks aggressive = extractor.extractLinks(html, "text/html", "https://example.com/", ExtractionMode.AGGRESSIVE);

        assertThat(standard.urls()).isEmpty();
        assertThat(aggressive.urls()).containsExactlyInAnyOrder(
            "https://example.com/feed",
            "https://example.com/images/logo.png",
            "https://example.com/region",
            "https://example.com/hidden/section"
        );
    }

    @Test
    void readsLocElementsFromXmlDocuments() {
        String xml = """
            <?xml version="1.0" encoding="UTF-8"?>
            <urlset xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
              <url><loc>https://example.com/one</loc></url>
              <url><loc>https://example.com/two</loc></url>
            </urlset>
            """;

        assertThat(extractor.extract(xml, "application/xml", "https://example.com/sitemap.xml"))
            .containsExactly("https://example.com/one", "https://example.com/two");
    }

    @Test
    void malformedMarkupYieldsWhatCanBeRead() {
        String html = "<html><body><a href=\"/ok\">ok<a href='/also-ok'><div><<<<";

        assertThat(extractor.extract(html, null, "https://example.com/"))
            .contains("https://example.com/ok", "https://example.com/also-ok");
        assertThat(extractor.extract(null, "text/html", "https://example.com/")).isEmpty();
    }

    @Test
    void keepsHrefsWithCharactersBrowsersTolerate() {
        String html = """
            <html><body>
              <a href="/search?q=a|b">Search</a>
              <a href="/files/50%off.html">Sale</a>
              <a href="/list?tags[]=x">Tags</a>
              <a href="/plain">Plain</a>
            </body></html>
            """;

        assertThat(extractor.extract(html, "text/html", "https://example.com/"))
            .containsExactlyInAnyOrder(
                "https://example.com/search?q=a%7Cb",
                "https://example.com/files/50%25off.html",
                "https://example.com/list?tags[]=x",
                "https://example.com/plain"
            );
    }

    @Test
    void resolvesAgainstDeclaredBaseHref() {
        String html = """
            <html><head><base href="https://cdn.example.com/docs/"></head><body>
              <a href="guide.html">Guide</a>
              <script>var next = "chapter-2.html";</script>
            </body></html>
            """;

        assertThat(extractor.extract(html, "text/html", "https://example.com/index.html"))
            .containsExactlyInAnyOrder(
                "https://cdn.example.com/docs/guide.html",
                "https://cdn.example.com/docs/chapter-2.html"
            );
    }
}
