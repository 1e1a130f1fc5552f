package com.delta.urlscout.crawl.frontier;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UrlNormalizerTest {

    @Test
    void collapsesTrailingSlashVariants() {
        assertThat(UrlNormalizer.normalize("https://example.com/a"))
            .isEqualTo(UrlNormalizer.normalize("https://example.com/a/"))
            .isEqualTo("https://example.com/a");
    }

    @Test
    void lowercasesSchemeAndHostAndDropsDefaultPortAndFragment() {
        assertThat(UrlNormalizer.normalize("HTTPS://Example.COM:443/Docs/Page.html#section"))
            .isEqualTo("https://example.com/Docs/Page.html");
        assertThat(UrlNormalizer.normalize("http://example.com:8080/x")).isEqualTo("http://example.com:8080/x");
    }

    @Test
    void sortsQueryAndRemovesTrackingParameters() {
        assertThat(UrlNormalizer.normalize("https://example.com/search?b=2&utm_source=mail&a=1&gclid=xyz"))
            .isEqualTo("https://example.com/search?a=1&b=2");
        assertThat(UrlNormalizer.normalize("https://example.com/?utm_campaign=x")).isEqualTo("https://example.com/");
    }

    @Test
    void resolvesRelativeReferencesAgainstTheBase() {
        assertThat(UrlNormalizer.normalize("../about/", "https://example.com/news/2024/item.html"))
            .isEqualTo("https://example.com/news/about");
        assertThat(UrlNormalizer.normalize("contact", "https://example.com"))
            .isEqualTo("https://example.com/contact");
        assertThat(UrlNormalizer.normalize("//cdn.example.com/lib", "https://example.com/"))
            .isEqualTo("https://cdn.example.com/lib");
    }

    @Test
    void rejectsNonHttpAndUnresolvableInput() {
        assertThat(UrlNormalizer.normalize("mailto:someone@example.com")).isNull();
        assertThat(UrlNormalizer.normalize("ftp://example.com/file")).isNull();
        assertThat(UrlNormalizer.normalize("/relative/only")).isNull();
        assertThat(UrlNormalizer.normalize("   ")).isNull();
    }

    @Test
    void normalizationIsIdempotent() {
        List<String> inputs = List.of(
            "HTTP://WWW.Example.com//a//b/./c/../d/?z=1&y=%2f&utm_medium=x#frag",
            "https://example.com/path with space/",
            "https://example.com:443",
            "https://example.com/%7euser/index.html?b&a"
        );
        for (String input : inputs) {
            String once = UrlNormalizer.normalize(input);
            assertThat(once).as(input).isNotNull();
            assertThat(UrlNormalizer.normalize(once)).as(input).isEqualTo(once);
        }
    }
}
