package com.delta.urlscout.crawl.phase;

import com.delta.urlscout.crawl.frontier.UrlRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SitemapDiscoveryPhaseTest {
    private PhaseTestSupport site;

    @BeforeEach
    void setUp() throws Exception {
        site = new PhaseTestSupport();
    }

    @AfterEach
    void tearDown() throws Exception {
        site.close();
    }

    @Test
    void admitsEverySitemapUrlTaggedWithThePhase() {
        site.xml("/sitemap.xml", urlset(site.origin(), "/a", "/b", "/c"));
        DiscoverySession session = site.session(100);

        PhaseStats stats = new SitemapDiscoveryPhase().run(new PhaseContext(session, PhaseNames.SITEMAP));

        List<UrlRecord> records = session.frontier().inScopeRecords();
        assertThat(records).hasSize(3);
        assertThat(records).allSatisfy(record -> {
            assertThat(record.getPhases()).containsExactly(PhaseNames.SITEMAP);
            assertThat(record.getDepth()).isZero();
        });
        assertThat(PhaseTestSupport.paths(session)).containsExactly("/a", "/b", "/c");
        assertThat(stats.status()).isEqualTo(PhaseStatus.COMPLETED);
        assertThat(stats.newUrls()).isEqualTo(3);
        assertThat(stats.transientErrors()).isZero();
        assertThat(stats.permanentErrors()).isZero();
        assertThat(session.processedSitemaps()).contains(site.url("/sitemap.xml"));
    }

    @Test
    void followsSitemapIndexAndRobotsHints() {
        site.text("/robots.txt", "User-agent: *\nDisallow:\nSitemap: " + site.url("/custom-map.xml") + "\n");
        site.xml("/sitemap_index.xml", "<?xml version=\"1.0\"?><sitemapindex>"
            + "<sitemap><loc>" + site.url("/child.xml") + "</loc></sitemap></sitemapindex>");
        site.xml("/child.xml", urlset(site.origin(), "/from-child"));
        site.xml("/custom-map.xml", urlset(site.origin(), "/from-robots"));
        DiscoverySession session = site.session(100);

        new SitemapDiscoveryPhase().run(new PhaseContext(session, PhaseNames.SITEMAP));

        assertThat(PhaseTestSupport.paths(session)).containsExactly("/from-child", "/from-robots");
        assertThat(site.requestsFor("GET /child.xml")).isEqualTo(1);
    }

    @Test
    void htmlSitemapPageContributesItsLinks() {
        site.html("/sitemap.html", PhaseTestSupport.page("Site map", "/about", "/contact"));
        DiscoverySession session = site.session(100);

        new SitemapDiscoveryPhase().run(new PhaseContext(session, PhaseNames.SITEMAP));

        assertThat(PhaseTestSupport.paths(session)).containsExactly("/about", "/contact", "/sitemap.html");
        assertThat(session.frontier().get(site.url("/about")).getDepth()).isEqualTo(1);
    }

    @Test
    void missingSitemapsAreNotErrors() {
        DiscoverySession session = site.session(100);

        PhaseStats stats = new SitemapDiscoveryPhase().run(new PhaseContext(session, PhaseNames.SITEMAP));

        assertThat(session.frontier().inScopeCount()).isZero();
        assertThat(stats.status()).isEqualTo(PhaseStatus.COMPLETED);
        assertThat(stats.permanentErrors()).isZero();
    }

    static String urlset(String origin, String... paths) {
        StringBuilder xml = new StringBuilder("<?xml version=\"1.0\" encoding=\"UTF-8\"?>")
            .append("<urlset xmlns=\"http://www.sitemaps.org/schemas/sitemap/0.9\">");
        for (String path : paths) {
            xml.append("<url><loc>").append(origin).append(path).append("</loc></url>");
        }
        return xml.append("</urlset>").toString();
    }
}
