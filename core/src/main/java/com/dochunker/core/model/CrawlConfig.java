package com.dochunker.core.model;

import com.dochunker.core.util.UrlUtils;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 크롤 설정 (crawl.yml / CLI 매핑 대상). 순수 설정 보관용.
 * 값 해석(YAML, CLI 플래그)은 YamlConfigLoader / app-cli 쪽에서 담당.
 */
public final class CrawlConfig {

    /** 기본 제외 패턴: MediaWiki 특수 페이지 + 확장 자산 디렉터리 */
    public static final List<String> DEFAULT_EXCLUDE_PATHS = List.of("contains:Special:", "/extensions/");

    /** 본문 폴백 컨테이너 우선순위 (위키 본문 → 위키 파서 출력 → main → body) */
    public static final List<String> DEFAULT_FALLBACK_SELECTORS =
            List.of("#mw-content-text", ".mw-parser-output", "main", "body");

    // ---------- 기본 필드 ----------
    private String baseUrl = "https://all.docs.genesys.com/GenesysCloud/"; // 크롤 범위 루트
    private Path output = Path.of("genesys_chunks.jsonl");
    private String source = "GenesysCloud";          // 메타데이터 source 라벨
    private Duration delay = Duration.ofSeconds(1);  // 요청 간 고정 대기
    private int maxPages = 5000;                     // 큐 소비 상한
    private String userAgent = "InternalDocsCrawler/1.0";
    private Path cookiesFile;                        // Netscape cookies.txt (옵션)
    private String cookieHeader;                     // raw Cookie 헤더 (옵션)
    private Duration timeout = Duration.ofSeconds(30);
    private boolean followRedirects = true;

    // ---------- 청크 크기 ----------
    private int minTokens = 250;
    private int maxTokens = 900;

    // ---------- 추출 임계값 (서로 독립) ----------
    /** 이보다 짧은 본문은 페이지 자체를 버린다 */
    private int minContentChars = 200;
    /** 휴리스틱 결과가 이보다 짧으면 구조 기반 폴백 시도 */
    private int fallbackThresholdChars = 200;

    private List<String> excludePaths = DEFAULT_EXCLUDE_PATHS;
    private List<String> fallbackSelectors = DEFAULT_FALLBACK_SELECTORS;

    // ---------- getters ----------
    public String getBaseUrl() { return baseUrl; }
    public Path getOutput() { return output; }
    public String getSource() { return source; }
    public Duration getDelay() { return delay; }
    public int getMaxPages() { return maxPages; }
    public String getUserAgent() { return userAgent; }
    public Path getCookiesFile() { return cookiesFile; }
    public String getCookieHeader() { return cookieHeader; }
    public Duration getTimeout() { return timeout; }
    public boolean isFollowRedirects() { return followRedirects; }
    public int getMinTokens() { return minTokens; }
    public int getMaxTokens() { return maxTokens; }
    public int getMinContentChars() { return minContentChars; }
    public int getFallbackThresholdChars() { return fallbackThresholdChars; }
    public List<String> getExcludePaths() { return excludePaths; }
    public List<String> getFallbackSelectors() { return fallbackSelectors; }

    // ---------- fluent setters ----------
    public CrawlConfig setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; return this; }
    public CrawlConfig setOutput(Path output) { this.output = output; return this; }
    public CrawlConfig setSource(String source) { this.source = source; return this; }
    public CrawlConfig setDelay(Duration delay) { this.delay = delay; return this; }
    public CrawlConfig setMaxPages(int maxPages) { this.maxPages = maxPages; return this; }
    public CrawlConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public CrawlConfig setCookiesFile(Path cookiesFile) { this.cookiesFile = cookiesFile; return this; }
    public CrawlConfig setCookieHeader(String cookieHeader) { this.cookieHeader = cookieHeader; return this; }
    public CrawlConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public CrawlConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public CrawlConfig setMinTokens(int minTokens) { this.minTokens = minTokens; return this; }
    public CrawlConfig setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; return this; }
    public CrawlConfig setMinContentChars(int v) { this.minContentChars = v; return this; }
    public CrawlConfig setFallbackThresholdChars(int v) { this.fallbackThresholdChars = v; return this; }

    public CrawlConfig setExcludePaths(List<String> patterns) {
        this.excludePaths = (patterns == null) ? List.of() : List.copyOf(patterns);
        return this;
    }
    public CrawlConfig setFallbackSelectors(List<String> selectors) {
        if (selectors != null && !selectors.isEmpty()) this.fallbackSelectors = List.copyOf(selectors);
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(baseUrl, "baseUrl");
        if (baseUrl.isBlank()) throw new IllegalArgumentException("baseUrl must not be blank");
        validateBaseUrl(baseUrl);
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(source, "source");
        if (delay == null || delay.isNegative())
            throw new IllegalArgumentException("delay must be >= 0");
        if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (minTokens < 1) throw new IllegalArgumentException("minTokens must be >= 1");
        if (maxTokens < minTokens)
            throw new IllegalArgumentException("maxTokens must be >= minTokens");
        if (minContentChars < 0) throw new IllegalArgumentException("minContentChars must be >= 0");
        if (fallbackThresholdChars < 0)
            throw new IllegalArgumentException("fallbackThresholdChars must be >= 0");
        Objects.requireNonNull(excludePaths, "excludePaths");
        Objects.requireNonNull(fallbackSelectors, "fallbackSelectors");
    }

    /** 절대 http(s) URL + host 필수 (스킴 없는 입력은 상대 URI가 된다) */
    private static void validateBaseUrl(String url) {
        URI u;
        try {
            u = URI.create(UrlUtils.normalize(url));
        } catch (IllegalArgumentException e) { // InvalidUrlException 포함
            throw new IllegalArgumentException("baseUrl is not a valid URL: " + url, e);
        }
        String scheme = (u.getScheme() == null) ? "" : u.getScheme().toLowerCase(Locale.ROOT);
        boolean http = scheme.equals("http") || scheme.equals("https");
        if (!u.isAbsolute() || !http || u.getHost() == null || u.getHost().isBlank())
            throw new IllegalArgumentException("baseUrl must be an absolute http(s) URL with a host: " + url);
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }

    public CrawlConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    /** CLI의 --delay(초, 소수 허용) 편의 세터 */
    public CrawlConfig setDelaySeconds(double seconds) {
        this.delay = Duration.ofMillis(Math.round(Math.max(0.0, seconds) * 1000.0));
        return this;
    }
}
