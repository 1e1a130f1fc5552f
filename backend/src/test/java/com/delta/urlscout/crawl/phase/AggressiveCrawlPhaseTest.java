package com.delta.urlscout.crawl.phase;

import com.delta.urlscout.crawl.frontier.ExpansionKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AggressiveCrawlPhaseTest {

    @Test
    void rescansExpandedPagesWithWiderExtractionOnce() throws Exception {
        try (PhaseTestSupport site = new PhaseTestSupport()) {
            site.html("/", "<html><head><link rel=\"alternate\" href=\"/feed\"></head><body>"
                + "<a href=\"/plain\">plain</a><map><area href=\"/region\"></map>"
                + "<div data-url=\"/hidden/section\"></div></body></html>");
            DiscoverySession session = site.session(100);
            session.frontier().admit(site.url("/"), null, PhaseNames.RECURSIVE);
            session.frontier().claim(ExpansionKind.LINKS, site.url("/"));

            PhaseStats first = new AggressiveCrawlPhase().run(new PhaseContext(session, PhaseNames.AGGRESSIVE));
            PhaseStats second = new AggressiveCrawlPhase().run(new PhaseContext(session, PhaseNames.AGGRESSIVE));

            assertThat(PhaseTestSupport.paths(session))
                .containsExactly("/", "/feed", "/hidden/section", "/plain", "/region");
            assertThat(session.frontier().get(site.url("/region")).getDepth()).isEqualTo(1);
            assertThat(first.newUrls()).isEqualTo(4);
            assertThat(second.newUrls()).isZero();
            assertThat(site.requestsFor("GET /")).isEqualTo(1);
        }
    }
}
