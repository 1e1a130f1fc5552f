package com.delta.urlscout.crawl.phase;

import com.delta.urlscout.config.CrawlerProperties;
import com.delta.urlscout.crawl.frontier.Frontier;
import com.delta.urlscout.crawl.frontier.ScopeRule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PatternGenerationPhaseTest {
    private PhaseTestSupport site;

    @BeforeEach
    void setUp() throws Exception {
        site = new PhaseTestSupport();
        site.properties.getPattern().setMinSamples(3);
        site.properties.getPattern().setMaxConsecutiveFailures(3);
        site.properties.getPattern().setMaxVariantsPerTemplate(50);
        site.properties.getPattern().setMaxGeneratedUrls(100);
    }

    @AfterEach
    void tearDown() throws Exception {
        site.close();
    }

    @Test
    void inferTemplatesNeedsEnoughSamplesAndIgnoresQueriesAndAssets() {
        Frontier frontier = new Frontier(
            ScopeRule.forBaseUrl("https://example.com/", new CrawlerProperties.Scope()), 100, true, Clock.systemUTC()
        );
        for (String path : List.of("/news/1", "/news/2", "/news/3", "/blog/7", "/blog/8",
            "/images/1.png", "/images/2.png", "/images/3.png", "/list?page=1", "/list?page=2", "/list?page=3")) {
            frontier.admit("https://example.com" + path, null, PhaseNames.SITEMAP);
        }

        List<PatternTemplate> templates = PatternGenerationPhase.inferTemplates(frontier.inScopeRecords(), 3);

        assertThat(templates).hasSize(1);
        assertThat(templates.get(0).key()).isEqualTo("/news/{number}");
        assertThat(templates.get(0).origin()).isEqualTo("https://example.com");
        assertThat(templates.get(0).samples()).containsExactly(1, 2, 3);
    }

    @Test
    void walkStopsAfterConsecutiveMisses() {
        site.html("/news/3", PhaseTestSupport.page("Story 3"));
        site.html("/news/5", PhaseTestSupport.page("Story 5"));
        DiscoverySession session = site.session(100);
        for (String path : List.of("/news/1", "/news/2", "/news/4")) {
            session.frontier().admit(site.url(path), null, PhaseNames.SITEMAP);
        }

        PhaseStats stats = new PatternGenerationPhase().run(new PhaseContext(session, PhaseNames.PATTERN));

        assertThat(PhaseTestSupport.paths(session))
            .containsExactly("/news/1", "/news/2", "/news/3", "/news/4", "/news/5");
        assertThat(site.requestsFor("HEAD /news/8")).isEqualTo(1);
        assertThat(site.requestsFor("HEAD /news/9")).isZero();
        assertThat(session.frontier().get(site.url("/news/5")).getPhases()).containsExactly(PhaseNames.PATTERN);
        assertThat(stats.newUrls()).isEqualTo(2);
    }

    @Test
    void generatedUrlCapBoundsProbes() {
        site.properties.getPattern().setMaxGeneratedUrls(2);
        site.properties.getPattern().setMaxConsecutiveFailures(10);
        DiscoverySession session = site.session(100);
        for (String path : List.of("/item/10", "/item/20", "/item/30")) {
            session.frontier().admit(site.url(path), null, PhaseNames.SITEMAP);
        }

        new PatternGenerationPhase().run(new PhaseContext(session, PhaseNames.PATTERN));

        long probes = site.requests.stream().filter(request -> request.startsWith("HEAD /item/")).count();
        assertThat(probes).isEqualTo(2);
    }

    @Test
    void noTemplateMeansNoRequests() {
        DiscoverySession session = site.session(100);
        session.frontier().admit(site.url("/about"), null, PhaseNames.SITEMAP);

        PhaseStats stats = new PatternGenerationPhase().run(new PhaseContext(session, PhaseNames.PATTERN));

        assertThat(stats.fetches()).isZero();
        assertThat(site.requests).noneMatch(request -> request.startsWith("HEAD"));
    }
}
