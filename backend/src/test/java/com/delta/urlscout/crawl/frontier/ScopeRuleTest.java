package com.delta.urlscout.crawl.frontier;

import com.delta.urlscout.config.CrawlerProperties;
import com.delta.urlscout.crawl.service.DiscoveryConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScopeRuleTest {

    @Test
    void usesRegistrableDomainAndAcceptsSubdomains() {
        ScopeRule scope = ScopeRule.forBaseUrl("https://www.example.co.uk/", new CrawlerProperties.Scope());

        assertThat(scope.registrableDomain()).isEqualTo("example.co.uk");
        assertThat(scope.isInScope("https://blog.example.co.uk/post")).isTrue();
        assertThat(scope.isInScope("https://example.co.uk/")).isTrue();
        assertThat(scope.isInScope("https://other.co.uk/")).isFalse();
        assertThat(scope.isInScope("https://notexample.co.uk/")).isFalse();
    }

    @Test
    void exactHostWhenSubdomainsAreExcluded() {
        CrawlerProperties.Scope settings = new CrawlerProperties.Scope();
        settings.setIncludeSubdomains(false);
        ScopeRule scope = ScopeRule.forBaseUrl("https://www.example.com", settings);

        assertThat(scope.isInScope("https://www.example.com/a")).isTrue();
        assertThat(scope.isInScope("https://example.com/a")).isTrue();
        assertThat(scope.isInScope("https://blog.example.com/a")).isFalse();
    }

    @Test
    void addsSchemeWhenMissingAndRejectsGarbage() {
        ScopeRule scope = ScopeRule.forBaseUrl("example.com", new CrawlerProperties.Scope());
        assertThat(scope.rootUrl()).isEqualTo("https://example.com/");

        assertThatThrownBy(() -> ScopeRule.forBaseUrl("ftp://example.com", new CrawlerProperties.Scope()))
            .isInstanceOf(DiscoveryConfigurationException.class);
        assertThatThrownBy(() -> ScopeRule.forBaseUrl("   ", new CrawlerProperties.Scope()))
            .isInstanceOf(DiscoveryConfigurationException.class);
    }

    @Test
    void pathPrefixMatchesWholeSegments() {
        CrawlerProperties.Scope settings = new CrawlerProperties.Scope();
        settings.setPathPrefix("/docs");
        ScopeRule scope = ScopeRule.forBaseUrl("https://example.com", settings);

        assertThat(scope.rootUrl()).isEqualTo("https://example.com/docs");
        assertThat(scope.isInScope("https://example.com/docs")).isTrue();
        assertThat(scope.isInScope("https://example.com/docs/guide")).isTrue();
        assertThat(scope.isInScope("https://example.com/docsearch")).isFalse();
        assertThat(scope.isInScope("https://example.com/")).isFalse();
    }

    @Test
    void prefixWithoutLeadingSlashIsAConfigurationError() {
        CrawlerProperties.Scope settings = new CrawlerProperties.Scope();
        settings.setPathPrefix("docs");

        assertThatThrownBy(() -> ScopeRule.forBaseUrl("https://example.com", settings))
            .isInstanceOf(DiscoveryConfigurationException.class)
            .hasMessageContaining("docs");
    }

    @Test
    void documentsAreInScopeButNotExpandable() {
        ScopeRule scope = ScopeRule.forBaseUrl("https://example.com", new CrawlerProperties.Scope());

        assertThat(scope.isInScope("https://example.com/report.pdf")).isTrue();
        assertThat(scope.isExpandable("https://example.com/report.pdf")).isFalse();
        assertThat(scope.isExpandable("https://example.com/about")).isTrue();
        assertThat(scope.isExpandable("https://example.com/index.php")).isTrue();
        assertThat(scope.isInScope("https://example.com/logo.png")).isFalse();
        assertThat(scope.isInScope("https://example.com/app.js")).isFalse();
        assertThat(scope.isInScope("https://example.com/report.docx")).isFalse();
    }

    @Test
    void extensionPolicyIsConfigurable() {
        CrawlerProperties.Scope settings = new CrawlerProperties.Scope();
        settings.setIncludePdfs(false);
        settings.setIncludeOfficeDocuments(true);
        settings.setExtraAllowedExtensions(List.of(".json"));
        settings.setDeniedExtensions(List.of("php"));
        ScopeRule scope = ScopeRule.forBaseUrl("https://example.com", settings);

        assertThat(scope.isInScope("https://example.com/report.pdf")).isFalse();
        assertThat(scope.isInScope("https://example.com/report.docx")).isTrue();
        assertThat(scope.isInScope("https://example.com/data.json")).isTrue();
        assertThat(scope.isInScope("https://example.com/index.php")).isFalse();
    }

    @Test
    void numericSuffixesAreNotExtensions() {
        assertThat(ScopeRule.extensionOf("/release/v1.2")).isEmpty();
        assertThat(ScopeRule.extensionOf("/files/Report.PDF")).isEqualTo("pdf");
        assertThat(ScopeRule.extensionOf("/dir/")).isEmpty();
    }
}
