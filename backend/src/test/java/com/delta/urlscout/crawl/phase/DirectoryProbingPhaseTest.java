package com.delta.urlscout.crawl.phase;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DirectoryProbingPhaseTest {

    @Test
    void admitsDirectoriesThatExistAndSkipsKnownOnes() throws Exception {
        try (PhaseTestSupport site = new PhaseTestSupport()) {
            site.properties.getDirectoryProbe().setUseSuggestions(false);
            site.properties.getDirectoryProbe().setExtraDirectories(List.of("internal"));
            site.html("/about/", PhaseTestSupport.page("About"));
            site.html("/internal/", PhaseTestSupport.page("Internal"));
            site.html("/team/", PhaseTestSupport.page("Team"));
            DiscoverySession session = site.session(500);
            session.frontier().admit(site.url("/team"), null, PhaseNames.SITEMAP);

            PhaseStats stats = new DirectoryProbingPhase().run(new PhaseContext(session, PhaseNames.DIRECTORY));

            assertThat(PhaseTestSupport.paths(session)).containsExactly("/about", "/internal", "/team");
            assertThat(site.requestsFor("HEAD /about/")).isEqualTo(1);
            assertThat(site.requestsFor("HEAD /team/")).isZero();
            assertThat(session.frontier().get(site.url("/about")).getDepth()).isEqualTo(1);
            assertThat(stats.newUrls()).isEqualTo(2);
        }
    }

    @Test
    void candidateCapLimitsProbes() throws Exception {
        try (PhaseTestSupport site = new PhaseTestSupport()) {
            site.properties.getDirectoryProbe().setUseSuggestions(false);
            site.properties.getDirectoryProbe().setMaxCandidates(5);
            DiscoverySession session = site.session(500);

            new DirectoryProbingPhase().run(new PhaseContext(session, PhaseNames.DIRECTORY));

            long probes = site.requests.stream().filter(request -> request.startsWith("HEAD ")).count();
            assertThat(probes).isEqualTo(5);
            assertThat(session.frontier().inScopeCount()).isZero();
        }
    }
}
