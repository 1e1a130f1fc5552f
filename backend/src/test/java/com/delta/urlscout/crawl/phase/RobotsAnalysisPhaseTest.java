package com.delta.urlscout.crawl.phase;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RobotsAnalysisPhaseTest {

    @Test
    void expandsSitemapHintsAndConfirmsSuggestedPaths() throws Exception {
        try (PhaseTestSupport site = new PhaseTestSupport()) {
            site.text("/robots.txt", "User-agent: *\nDisallow: /private/\nSitemap: " + site.url("/hinted.xml") + "\n");
            site.xml("/hinted.xml", SitemapDiscoveryPhaseTest.urlset(site.origin(), "/from-hint"));
            site.html("/support/faq.html", PhaseTestSupport.page("FAQ"));
            DiscoverySession session = site.session(100);

            PhaseStats stats = new RobotsAnalysisPhase().run(new PhaseContext(session, PhaseNames.ROBOTS));

            assertThat(PhaseTestSupport.paths(session)).containsExactly("/from-hint", "/support/faq.html");
            assertThat(session.frontier().get(site.url("/support/faq.html")).getSourceUrl())
                .isEqualTo(site.origin() + "/robots.txt");
            assertThat(site.requests).noneMatch(request -> request.contains("/private"));
            assertThat(stats.status()).isEqualTo(PhaseStatus.COMPLETED);
        }
    }

    @Test
    void robotsWithoutHintsAsksForNothing() throws Exception {
        try (PhaseTestSupport site = new PhaseTestSupport()) {
            site.text("/robots.txt", "User-agent: *\n");
            DiscoverySession session = site.session(100);

            PhaseStats stats = new RobotsAnalysisPhase().run(new PhaseContext(session, PhaseNames.ROBOTS));

            assertThat(session.frontier().inScopeCount()).isZero();
            assertThat(stats.suggestionsUsed()).isZero();
            assertThat(site.requests).containsExactly("GET /robots.txt");
        }
    }
}
