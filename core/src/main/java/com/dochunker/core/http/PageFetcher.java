package com.dochunker.core.http;

import com.dochunker.core.api.IPageFetcher;
import com.dochunker.core.model.CrawlConfig;
import com.dochunker.core.model.FetchedPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.CookieManager;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;

/**
 * java.net.http 기반 GET 전용 페처.
 * - 리다이렉트 추종(설정), User-Agent, raw Cookie 헤더, 쿠키 저장소 지원
 * - 재시도 없음: 연결 오류/타임아웃은 status -1 로 반환
 */
public class PageFetcher implements IPageFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(PageFetcher.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws Exception;
    }

    private final CrawlConfig config;
    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;   // 테스트 경로(있으면 이걸 사용)

    public PageFetcher(CrawlConfig config) {
        this(config, new CookieManager());
    }

    /** 쿠키 파일을 미리 적재한 CookieManager 주입용 */
    public PageFetcher(CrawlConfig config, CookieManager cookies) {
        this.config = Objects.requireNonNull(config, "config");
        this.client = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .cookieHandler(Objects.requireNonNull(cookies, "cookies"))
                .build();
        this.sender = null;
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public PageFetcher(CrawlConfig config, HttpSender testSender) {
        this.config = Objects.requireNonNull(config, "config");
        this.client = null;
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    @Override
    public FetchedPage fetch(URI url) {
        Objects.requireNonNull(url, "url");
        long start = System.nanoTime();
        try {
            HttpResponse<String> resp = (sender != null)
                    ? sender.send(buildRequest(url))
                    : client.send(buildRequest(url), HttpResponse.BodyHandlers.ofString());

            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            HttpHeaders hh = resp.headers();
            return FetchedPage.builder()
                    .url(url)
                    .statusCode(resp.statusCode())
                    .headers(hh.map())
                    .body(resp.body() == null ? "" : resp.body())
                    .contentType(hh.firstValue("Content-Type").orElse(null))
                    .responseTimeMs(elapsedMs)
                    .build();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return FetchedPage.failure(url, (System.nanoTime() - start) / 1_000_000);
        } catch (Exception e) {
            LOG.warn("Fetch failed: {} ({})", url, e.toString());
            return FetchedPage.failure(url, (System.nanoTime() - start) / 1_000_000);
        }
    }

    HttpRequest buildRequest(URI url) {
        HttpRequest.Builder b = HttpRequest.newBuilder(url)
                .timeout(config.getTimeout())
                .header("User-Agent", config.getUserAgent())
                .GET();
        String cookieHeader = config.getCookieHeader();
        if (cookieHeader != null && !cookieHeader.isBlank()) {
            b.header("Cookie", cookieHeader);
        }
        return b.build();
    }
}
