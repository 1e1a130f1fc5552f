package com.delta.urlscout.crawl.phase;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RecursiveCrawlPhaseTest {
    private PhaseTestSupport site;

    @BeforeEach
    void setUp() throws Exception {
        site = new PhaseTestSupport();
        site.html("/", PhaseTestSupport.page("Home", "/a", "/b", "https://elsewhere.example.org/x"));
        site.html("/a", PhaseTestSupport.page("A", "/a/deep", "/"));
        site.html("/b", PhaseTestSupport.page("B", "/a"));
        site.html("/a/deep", PhaseTestSupport.page("Deep", "/a/deeper"));
    }

    @AfterEach
    void tearDown() throws Exception {
        site.close();
    }

    @Test
    void followsLinksDownToTheDepthLimit() {
        site.properties.getRecursive().setMaxDepth(1);
        DiscoverySession session = site.session(100);

        PhaseStats stats = new RecursiveCrawlPhase().run(new PhaseContext(session, PhaseNames.RECURSIVE));

        assertThat(PhaseTestSupport.paths(session)).containsExactly("/", "/a", "/b");
        assertThat(site.requestsFor("GET /a")).isZero();
        assertThat(session.frontier().pendingCount()).isEqualTo(2);
        assertThat(session.frontier().outOfScopeCount()).isEqualTo(1);
        assertThat(stats.status()).isEqualTo(PhaseStatus.COMPLETED);
        assertThat(stats.newUrls()).isEqualTo(3);
    }

    @Test
    void deeperLimitReachesNestedPagesAndFetchesEachPageOnce() {
        site.properties.getRecursive().setMaxDepth(3);
        DiscoverySession session = site.session(100);

        new RecursiveCrawlPhase().run(new PhaseContext(session, PhaseNames.RECURSIVE));

        assertThat(PhaseTestSupport.paths(session)).containsExactly("/", "/a", "/a/deep", "/a/deeper", "/b");
        assertThat(site.requestsFor("GET /a")).isEqualTo(1);
        assertThat(session.frontier().get(site.url("/a/deep")).getDepth()).isEqualTo(2);
    }

    @Test
    void stopsAdmittingAtMaxPages() {
        site.properties.getRecursive().setMaxDepth(3);
        DiscoverySession session = site.session(2);

        new RecursiveCrawlPhase().run(new PhaseContext(session, PhaseNames.RECURSIVE));

        assertThat(session.frontier().inScopeCount()).isEqualTo(2);
        assertThat(session.budget().stopReason()).isEqualTo(DiscoveryBudget.MAX_PAGES_REACHED);
    }
}
