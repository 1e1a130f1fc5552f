package com.delta.urlscout.crawl.phase;

import com.delta.urlscout.crawl.extract.ExtractionMode;
import com.delta.urlscout.crawl.model.HttpFetchResult;
import com.delta.urlscout.crawl.suggest.FallbackSuggestions;
import com.delta.urlscout.crawl.suggest.PromptKind;
import com.delta.urlscout.crawl.suggest.Suggestion;
import com.delta.urlscout.crawl.suggest.SuggestionPrompt;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Submits search queries through the site's own search and filter forms, plus a few common
 * search endpoints, and admits the links found in the result pages.
 */
@Component
public class FormSearchProbingPhase implements DiscoveryPhase {
    private static final Logger log = LoggerFactory.getLogger(FormSearchProbingPhase.class);
    private static final List<String> SEARCH_PARAMS = List.of("q", "query", "search", "keyword", "term", "s", "find");
    private static final List<String> COMMON_ENDPOINTS = List.of("/search?q=", "/?s=", "/search?query=");

    enum FormKind {
        SEARCH,
        FILTER,
        LOGIN,
        CONTACT,
        NEWSLETTER,
        OTHER;

        boolean isProbeable() {
            return this == SEARCH || this == FILTER;
        }
    }

    record DetectedForm(FormKind kind, String action, String method, String queryParam) {
        String submissionUrl(String query) {
            String encoded = URLEncoder.encode(query, StandardCharsets.UTF_8);
            String separator = action.contains("?") ? "&" : "?";
            return action + separator + queryParam + "=" + encoded;
        }

        String formBody(String query) {
            return queryParam + "=" + URLEncoder.encode(query, StandardCharsets.UTF_8);
        }

        boolean isPost() {
            return "post".equals(method);
        }
    }

    private record Submission(String url, String formBody) {
    }

    @Override
    public String name() {
        return PhaseNames.FORM_SEARCH;
    }

    @Override
    public PhaseStats run(PhaseContext context) {
        HttpFetchResult basePage = context.get(context.rootUrl());
        List<DetectedForm> forms = basePage.isSuccessful() && basePage.body() != null
            ? detectForms(basePage.body(), basePage.finalUrlOrRequested())
            : List.of();
        List<String> queries = queries(context);

        List<Submission> submissions = new ArrayList<>();
        Set<Submission> seen = new LinkedHashSet<>();
        for (String query : queries) {
            for (DetectedForm form : forms) {
                if (!form.kind().isProbeable() || !context.scope().isHostInScope(hostOf(form.action()))) {
                    continue;
                }
                Submission submission = form.isPost()
                    ? new Submission(form.action(), form.formBody(query))
                    : new Submission(form.submissionUrl(query), null);
                if (seen.add(submission)) {
                    submissions.add(submission);
                }
            }
            for (String endpoint : COMMON_ENDPOINTS) {
                String url = context.origin() + endpoint + URLEncoder.encode(query, StandardCharsets.UTF_8);
                Submission submission = new Submission(url, null);
                if (seen.add(submission)) {
                    submissions.add(submission);
                }
            }
        }

        List<HttpFetchResult> responses = PageBatchFetcher.runAll(context, submissions, submission ->
            submission.formBody() == null
                ? context.get(submission.url())
                : context.postForm(submission.url(), submission.formBody())
        );
        int answered = 0;
        for (HttpFetchResult response : responses) {
            if (!response.isSuccessful()) {
                continue;
            }
            answered++;
            String source = response.finalUrlOrRequested();
            for (String link : context.extractLinks(response, ExtractionMode.STANDARD)) {
                context.admit(link, source);
            }
        }
        log.info(
            "form search probing forms={} queries={} submissions={} answered={} new={}",
            forms.size(),
            queries.size(),
            submissions.size(),
            answered,
            context.stats().newUrls()
        );
        return context.stats().snapshot(PhaseStatus.COMPLETED);
    }

    static List<DetectedForm> detectForms(String html, String baseUrl) {
        Document document = Jsoup.parse(html, baseUrl);
        List<DetectedForm> forms = new ArrayList<>();
        for (Element form : document.select("form")) {
            String action = form.hasAttr("action") && !form.attr("action").isBlank()
                ? form.absUrl("action")
                : baseUrl;
            if (action == null || action.isBlank()) {
                continue;
            }
            String method = form.attr("method").toLowerCase(Locale.ROOT);
            forms.add(new DetectedForm(classify(form), action, method.isBlank() ? "get" : method, queryParam(form)));
        }
        return forms;
    }

    static FormKind classify(Element form) {
        if (!form.select("input[type=password]").isEmpty()) {
            return FormKind.LOGIN;
        }
        String signature = (form.attr("id") + " " + form.attr("class") + " " + form.attr("action") + " "
            + form.attr("role")).toLowerCase(Locale.ROOT);
        if (!form.select("input[type=search]").isEmpty() || signature.contains("search")) {
            return FormKind.SEARCH;
        }
        if (!form.select("textarea").isEmpty() || signature.contains("contact")) {
            return FormKind.CONTACT;
        }
        if (signature.contains("newsletter") || signature.contains("subscribe")) {
            return FormKind.NEWSLETTER;
        }
        if (!form.select("select").isEmpty() || signature.contains("filter")) {
            return FormKind.FILTER;
        }
        for (Element input : form.select("input[name]")) {
            if (SEARCH_PARAMS.contains(input.attr("name").toLowerCase(Locale.ROOT))) {
                return FormKind.SEARCH;
            }
        }
        return FormKind.OTHER;
    }

    static String queryParam(Element form) {
        List<String> names = new ArrayList<>();
        for (Element input : form.select("input[name]")) {
            String type = input.attr("type").toLowerCase(Locale.ROOT);
            if (type.isEmpty() || "text".equals(type) || "search".equals(type)) {
                names.add(input.attr("name"));
            }
        }
        for (String preferred : SEARCH_PARAMS) {
            for (String name : names) {
                if (preferred.equalsIgnoreCase(name)) {
                    return name;
                }
            }
        }
        return names.isEmpty() ? "q" : names.get(0);
    }

    private List<String> queries(PhaseContext context) {
        int maxQueries = context.properties().getFormProbe().getMaxQueries();
        Set<String> queries = new LinkedHashSet<>(context.properties().getFormProbe().getExtraQueries());
        Suggestion suggestion = context.suggest(SuggestionPrompt.of(
            PromptKind.SEARCH_QUERIES,
            context.domain(),
            RobotsAnalysisPhase.sampleUrls(context),
            List.of()
        ));
        queries.addAll(suggestion.values());
        if (queries.size() < maxQueries) {
            queries.addAll(FallbackSuggestions.forPrompt(
                SuggestionPrompt.of(PromptKind.SEARCH_QUERIES, context.domain(), List.of(), List.of()),
                context.clock()
            ));
        }
        List<String> limited = new ArrayList<>();
        for (String query : queries) {
            if (query != null && !query.isBlank()) {
                limited.add(query.strip());
            }
            if (limited.size() >= maxQueries) {
                break;
            }
        }
        return limited;
    }

    private static String hostOf(String url) {
        try {
            return URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
