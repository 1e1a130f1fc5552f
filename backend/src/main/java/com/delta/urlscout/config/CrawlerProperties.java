package com.delta.urlscout.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT = "url-scout/0.1 (+contact)";

    private String userAgent;
    private int perHostDelayMs = 1000;
    private int perHostConcurrency = 2;
    private int globalConcurrency = 5;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 2;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 5000;
    private int rateLimitCooldownMs = 30000;
    private int maxBodyBytes = 5_000_000;
    private Discovery discovery = new Discovery();
    private Scope scope = new Scope();
    private Sitemap sitemap = new Sitemap();
    private Robots robots = new Robots();
    private Archive archive = new Archive();
    private Recursive recursive = new Recursive();
    private Hierarchical hierarchical = new Hierarchical();
    private DirectoryProbe directoryProbe = new DirectoryProbe();
    private PathExploration pathExploration = new PathExploration();
    private Pattern pattern = new Pattern();
    private Aggressive aggressive = new Aggressive();
    private FormProbe formProbe = new FormProbe();
    private Validation validation = new Validation();
    private Suggestion suggestion = new Suggestion();
    private Output output = new Output();
    private Api api = new Api();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getPerHostConcurrency() {
        return Math.max(1, perHostConcurrency);
    }

    public void setPerHostConcurrency(int perHostConcurrency) {
        this.perHostConcurrency = Math.max(1, perHostConcurrency);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return requestRetryBaseDelayMs;
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
    }

    public int getRequestRetryMaxDelayMs() {
        return requestRetryMaxDelayMs;
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
    }

    public int getRateLimitCooldownMs() {
        return Math.max(0, rateLimitCooldownMs);
    }

    public void setRateLimitCooldownMs(int rateLimitCooldownMs) {
        this.rateLimitCooldownMs = Math.max(0, rateLimitCooldownMs);
    }

    public int getMaxBodyBytes() {
        return Math.max(1024, maxBodyBytes);
    }

    public void setMaxBodyBytes(int maxBodyBytes) {
        this.maxBodyBytes = maxBodyBytes;
    }

    public Discovery getDiscovery() {
        return discovery;
    }

    public void setDiscovery(Discovery discovery) {
        this.discovery = discovery;
    }

    public Scope getScope() {
        return scope;
    }

    public void setScope(Scope scope) {
        this.scope = scope;
    }

    public Sitemap getSitemap() {
        return sitemap;
    }

    public void setSitemap(Sitemap sitemap) {
        this.sitemap = sitemap;
    }

    public Robots getRobots() {
        return robots;
    }

    public void setRobots(Robots robots) {
        this.robots = robots;
    }

    public Archive getArchive() {
        return archive;
    }

    public void setArchive(Archive archive) {
        this.archive = archive;
    }

    public Recursive getRecursive() {
        return recursive;
    }

    public void setRecursive(Recursive recursive) {
        this.recursive = recursive;
    }

    public Hierarchical getHierarchical() {
        return hierarchical;
    }

    public void setHierarchical(Hierarchical hierarchical) {
        this.hierarchical = hierarchical;
    }

    public DirectoryProbe getDirectoryProbe() {
        return directoryProbe;
    }

    public void setDirectoryProbe(DirectoryProbe directoryProbe) {
        this.directoryProbe = directoryProbe;
    }

    public PathExploration getPathExploration() {
        return pathExploration;
    }

    public void setPathExploration(PathExploration pathExploration) {
        this.pathExploration = pathExploration;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public void setPattern(Pattern pattern) {
        this.pattern = pattern;
    }

    public Aggressive getAggressive() {
        return aggressive;
    }

    public void setAggressive(Aggressive aggressive) {
        this.aggressive = aggressive;
    }

    public FormProbe getFormProbe() {
        return formProbe;
    }

    public void setFormProbe(FormProbe formProbe) {
        this.formProbe = formProbe;
    }

    public Validation getValidation() {
        return validation;
    }

    public void setValidation(Validation validation) {
        this.validation = validation;
    }

    public Suggestion getSuggestion() {
        return suggestion;
    }

    public void setSuggestion(Suggestion suggestion) {
        this.suggestion = suggestion;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public enum ChildMatch {
        SEGMENT,
        PREFIX,
        ANY
    }

    public static class Discovery {
        private String baseUrl;
        private int maxPages = 5000;
        private int maxDurationSeconds = 3600;
        private List<String> phases = new ArrayList<>();

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }

        public int getMaxDurationSeconds() {
            return maxDurationSeconds;
        }

        public void setMaxDurationSeconds(int maxDurationSeconds) {
            this.maxDurationSeconds = maxDurationSeconds;
        }

        public List<String> getPhases() {
            return phases;
        }

        public void setPhases(List<String> phases) {
            this.phases = phases == null ? new ArrayList<>() : phases;
        }
    }

    public static class Scope {
        private boolean includeSubdomains = true;
        private String pathPrefix = "";
        private boolean includePdfs = true;
        private boolean includeOfficeDocuments = false;
        private List<String> extraAllowedExtensions = new ArrayList<>();
        private List<String> deniedExtensions = new ArrayList<>();
        private boolean unifyScheme = true;

        public boolean isIncludeSubdomains() {
            return includeSubdomains;
        }

        public void setIncludeSubdomains(boolean includeSubdomains) {
            this.includeSubdomains = includeSubdomains;
        }

        public String getPathPrefix() {
            return pathPrefix;
        }

        public void setPathPrefix(String pathPrefix) {
            this.pathPrefix = pathPrefix == null ? "" : pathPrefix.trim();
        }

        public boolean isIncludePdfs() {
            return includePdfs;
        }

        public void setIncludePdfs(boolean includePdfs) {
            this.includePdfs = includePdfs;
        }

        public boolean isIncludeOfficeDocuments() {
            return includeOfficeDocuments;
        }

        public void setIncludeOfficeDocuments(boolean includeOfficeDocuments) {
            this.includeOfficeDocuments = includeOfficeDocuments;
        }

        public List<String> getExtraAllowedExtensions() {
            return extraAllowedExtensions;
        }

        public void setExtraAllowedExtensions(List<String> extraAllowedExtensions) {
            this.extraAllowedExtensions = extraAllowedExtensions == null ? new ArrayList<>() : extraAllowedExtensions;
        }

        public List<String> getDeniedExtensions() {
            return deniedExtensions;
        }

        public void setDeniedExtensions(List<String> deniedExtensions) {
            this.deniedExtensions = deniedExtensions == null ? new ArrayList<>() : deniedExtensions;
        }

        public boolean isUnifyScheme() {
            return unifyScheme;
        }

        public void setUnifyScheme(boolean unifyScheme) {
            this.unifyScheme = unifyScheme;
        }
    }

    public static class Sitemap {
        private int maxDepth = 3;
        private int maxSitemaps = 50;
        private int maxUrls = 50000;
        private boolean probeHtmlSitemaps = true;

        public int getMaxDepth() {
            return Math.max(0, maxDepth);
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
        }

        public int getMaxSitemaps() {
            return Math.max(1, maxSitemaps);
        }

        public void setMaxSitemaps(int maxSitemaps) {
            this.maxSitemaps = maxSitemaps;
        }

        public int getMaxUrls() {
            return Math.max(1, maxUrls);
        }

        public void setMaxUrls(int maxUrls) {
            this.maxUrls = maxUrls;
        }

        public boolean isProbeHtmlSitemaps() {
            return probeHtmlSitemaps;
        }

        public void setProbeHtmlSitemaps(boolean probeHtmlSitemaps) {
            this.probeHtmlSitemaps = probeHtmlSitemaps;
        }
    }

    public static class Robots {
        private boolean respect = true;
        private boolean failOpen = true;
        private boolean fetchAiTxt = true;

        public boolean isRespect() {
            return respect;
        }

        public void setRespect(boolean respect) {
            this.respect = respect;
        }

        public boolean isFailOpen() {
            return failOpen;
        }

        public void setFailOpen(boolean failOpen) {
            this.failOpen = failOpen;
        }

        public boolean isFetchAiTxt() {
            return fetchAiTxt;
        }

        public void setFetchAiTxt(boolean fetchAiTxt) {
            this.fetchAiTxt = fetchAiTxt;
        }
    }

    public static class Archive {
        private int maxUrls = 5000;
        private int pageSize = 1000;
        private int maxApiPages = 5;
        private boolean waybackEnabled = true;
        private String waybackEndpoint = "https://web.archive.org/cdx/search/cdx";
        private boolean commonCrawlEnabled = true;
        private String commonCrawlCollectionsUrl = "https://index.commoncrawl.org/collinfo.json";

        public int getMaxUrls() {
            return Math.max(1, maxUrls);
        }

        public void setMaxUrls(int maxUrls) {
            this.maxUrls = maxUrls;
        }

        public int getPageSize() {
            return Math.max(1, pageSize);
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }

        public int getMaxApiPages() {
            return Math.max(1, maxApiPages);
        }

        public void setMaxApiPages(int maxApiPages) {
            this.maxApiPages = maxApiPages;
        }

        public boolean isWaybackEnabled() {
            return waybackEnabled;
        }

        public void setWaybackEnabled(boolean waybackEnabled) {
            this.waybackEnabled = waybackEnabled;
        }

        public String getWaybackEndpoint() {
            return waybackEndpoint;
        }

        public void setWaybackEndpoint(String waybackEndpoint) {
            this.waybackEndpoint = waybackEndpoint;
        }

        public boolean isCommonCrawlEnabled() {
            return commonCrawlEnabled;
        }

        public void setCommonCrawlEnabled(boolean commonCrawlEnabled) {
            this.commonCrawlEnabled = commonCrawlEnabled;
        }

        public String getCommonCrawlCollectionsUrl() {
            return commonCrawlCollectionsUrl;
        }

        public void setCommonCrawlCollectionsUrl(String commonCrawlCollectionsUrl) {
            this.commonCrawlCollectionsUrl = commonCrawlCollectionsUrl;
        }
    }

    public static class Recursive {
        private int maxDepth = 3;

        public int getMaxDepth() {
            return Math.max(0, maxDepth);
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
        }
    }

    public static class Hierarchical {
        private int maxParentLevels = 8;
        private ChildMatch childMatch = ChildMatch.SEGMENT;
        private boolean useSuggestions = true;

        public int getMaxParentLevels() {
            return Math.max(1, maxParentLevels);
        }

        public void setMaxParentLevels(int maxParentLevels) {
            this.maxParentLevels = maxParentLevels;
        }

        public ChildMatch getChildMatch() {
            return childMatch == null ? ChildMatch.SEGMENT : childMatch;
        }

        public void setChildMatch(ChildMatch childMatch) {
            this.childMatch = childMatch;
        }

        public boolean isUseSuggestions() {
            return useSuggestions;
        }

        public void setUseSuggestions(boolean useSuggestions) {
            this.useSuggestions = useSuggestions;
        }
    }

    public static class DirectoryProbe {
        private boolean useSuggestions = true;
        private int maxCandidates = 250;
        private List<String> extraDirectories = new ArrayList<>();

        public boolean isUseSuggestions() {
            return useSuggestions;
        }

        public void setUseSuggestions(boolean useSuggestions) {
            this.useSuggestions = useSuggestions;
        }

        public int getMaxCandidates() {
            return Math.max(1, maxCandidates);
        }

        public void setMaxCandidates(int maxCandidates) {
            this.maxCandidates = maxCandidates;
        }

        public List<String> getExtraDirectories() {
            return extraDirectories;
        }

        public void setExtraDirectories(List<String> extraDirectories) {
            this.extraDirectories = extraDirectories == null ? new ArrayList<>() : extraDirectories;
        }
    }

    public static class PathExploration {
        private int minSegmentFrequency = 2;
        private int maxGeneratedUrls = 200;

        public int getMinSegmentFrequency() {
            return Math.max(1, minSegmentFrequency);
        }

        public void setMinSegmentFrequency(int minSegmentFrequency) {
            this.minSegmentFrequency = minSegmentFrequency;
        }

        public int getMaxGeneratedUrls() {
            return Math.max(0, maxGeneratedUrls);
        }

        public void setMaxGeneratedUrls(int maxGeneratedUrls) {
            this.maxGeneratedUrls = maxGeneratedUrls;
        }
    }

    public static class Pattern {
        private int minSamples = 2;
        private int maxConsecutiveFailures = 5;
        private int maxVariantsPerTemplate = 50;
        private int maxGeneratedUrls = 500;

        public int getMinSamples() {
            return Math.max(1, minSamples);
        }

        public void setMinSamples(int minSamples) {
            this.minSamples = minSamples;
        }

        public int getMaxConsecutiveFailures() {
            return Math.max(1, maxConsecutiveFailures);
        }

        public void setMaxConsecutiveFailures(int maxConsecutiveFailures) {
            this.maxConsecutiveFailures = maxConsecutiveFailures;
        }

        public int getMaxVariantsPerTemplate() {
            return Math.max(1, maxVariantsPerTemplate);
        }

        public void setMaxVariantsPerTemplate(int maxVariantsPerTemplate) {
            this.maxVariantsPerTemplate = maxVariantsPerTemplate;
        }

        public int getMaxGeneratedUrls() {
            return Math.max(0, maxGeneratedUrls);
        }

        public void setMaxGeneratedUrls(int maxGeneratedUrls) {
            this.maxGeneratedUrls = maxGeneratedUrls;
        }
    }

    public static class Aggressive {
        private int maxPagesToScan = 200;

        public int getMaxPagesToScan() {
            return Math.max(0, maxPagesToScan);
        }

        public void setMaxPagesToScan(int maxPagesToScan) {
            this.maxPagesToScan = maxPagesToScan;
        }
    }

    public static class FormProbe {
        private int maxQueries = 10;
        private List<String> extraQueries = new ArrayList<>();

        public int getMaxQueries() {
            return Math.max(1, maxQueries);
        }

        public void setMaxQueries(int maxQueries) {
            this.maxQueries = maxQueries;
        }

        public List<String> getExtraQueries() {
            return extraQueries;
        }

        public void setExtraQueries(List<String> extraQueries) {
            this.extraQueries = extraQueries == null ? new ArrayList<>() : extraQueries;
        }
    }

    /**
     * Optional existence check of in-scope URLs that no phase fetched, run after the last phase.
     */
    public static class Validation {
        private boolean enabled = false;
        private int maxUrls = 1000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxUrls() {
            return Math.max(1, maxUrls);
        }

        public void setMaxUrls(int maxUrls) {
            this.maxUrls = maxUrls;
        }
    }

    public static class Suggestion {
        private boolean enabled = true;
        private int dailyLimit = 50;
        private long minSpacingMs = 1500;
        private String zoneId = "UTC";
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String model = "gpt-4o-mini";
        private int timeoutSeconds = 30;
        private int maxSuggestions = 15;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getDailyLimit() {
            return Math.max(0, dailyLimit);
        }

        public void setDailyLimit(int dailyLimit) {
            this.dailyLimit = Math.max(0, dailyLimit);
        }

        public long getMinSpacingMs() {
            return Math.max(0, minSpacingMs);
        }

        public void setMinSpacingMs(long minSpacingMs) {
            this.minSpacingMs = Math.max(0, minSpacingMs);
        }

        public String getZoneId() {
            return zoneId;
        }

        public void setZoneId(String zoneId) {
            this.zoneId = zoneId;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public int getMaxSuggestions() {
            return Math.max(1, maxSuggestions);
        }

        public void setMaxSuggestions(int maxSuggestions) {
            this.maxSuggestions = maxSuggestions;
        }
    }

    public static class Output {
        private boolean enabled = true;
        private String directory = "output";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }

    public static class Api {
        private int maxRetainedRuns = 20;

        public int getMaxRetainedRuns() {
            return Math.max(1, maxRetainedRuns);
        }

        public void setMaxRetainedRuns(int maxRetainedRuns) {
            this.maxRetainedRuns = maxRetainedRuns;
        }
    }

    public static class Cli {
        private boolean run;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
