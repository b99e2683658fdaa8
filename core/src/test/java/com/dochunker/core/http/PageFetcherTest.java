package com.dochunker.core.http;

import com.dochunker.core.model.CrawlConfig;
import com.dochunker.core.model.FetchedPage;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PageFetcherTest {

    /** 테스트용 HttpResponse<String> */
    static class Resp implements HttpResponse<String> {
        final int code; final Map<String, List<String>> headers; final String body;
        Resp(int code, Map<String, List<String>> headers, String body) {
            this.code = code; this.headers = headers; this.body = body;
        }
        @Override public int statusCode() { return code; }
        @Override public HttpRequest request() { return null; }
        @Override public Optional<HttpResponse<String>> previousResponse() { return Optional.empty(); }
        @Override public HttpHeaders headers() { return HttpHeaders.of(headers, (a, b) -> true); }
        @Override public String body() { return body; }
        @Override public Optional<javax.net.ssl.SSLSession> sslSession() { return Optional.empty(); }
        @Override public URI uri() { return URI.create("https://docs.example.com/"); }
        @Override public HttpClient.Version version() { return HttpClient.Version.HTTP_1_1; }
    }

    @Test
    void sends_user_agent_and_cookie_header_and_captures_response() {
        CrawlConfig cfg = CrawlConfig.defaults()
                .setUserAgent("TestCrawler/2.0")
                .setCookieHeader("session=abc; theme=dark")
                .setTimeout(Duration.ofSeconds(5));
        List<HttpRequest> seen = new ArrayList<>();
        PageFetcher fetcher = new PageFetcher(cfg, req -> {
            seen.add(req);
            return new Resp(200, Map.of("Content-Type", List.of("text/html; charset=UTF-8")), "<html>ok</html>");
        });

        FetchedPage page = fetcher.fetch(URI.create("https://docs.example.com/GenesysCloud/"));

        assertThat(seen).hasSize(1);
        HttpRequest req = seen.get(0);
        assertThat(req.method()).isEqualTo("GET");
        assertThat(req.headers().firstValue("User-Agent")).contains("TestCrawler/2.0");
        assertThat(req.headers().firstValue("Cookie")).contains("session=abc; theme=dark");
        assertThat(req.timeout()).contains(Duration.ofSeconds(5));

        assertThat(page.getStatusCode()).isEqualTo(200);
        assertThat(page.isHtml()).isTrue();
        assertThat(page.getBody()).isEqualTo("<html>ok</html>");
        assertThat(page.header("content-type")).isEqualTo("text/html; charset=UTF-8");
    }

    @Test
    void no_cookie_header_when_not_configured() {
        HttpRequest req = new PageFetcher(CrawlConfig.defaults(), r -> null)
                .buildRequest(URI.create("https://docs.example.com/"));
        assertThat(req.headers().firstValue("Cookie")).isEmpty();
        assertThat(req.headers().firstValue("User-Agent")).contains("InternalDocsCrawler/1.0");
    }

    @Test
    void transport_error_becomes_status_minus_one() {
        PageFetcher fetcher = new PageFetcher(CrawlConfig.defaults(), req -> {
            throw new HttpConnectTimeoutException("connect timed out");
        });

        FetchedPage page = fetcher.fetch(URI.create("https://docs.example.com/slow"));

        assertThat(page.isTransportFailure()).isTrue();
        assertThat(page.getStatusCode()).isEqualTo(FetchedPage.TRANSPORT_FAILURE);
        assertThat(page.getBody()).isEmpty();
    }

    @Test
    void io_error_is_not_thrown_to_caller() {
        PageFetcher fetcher = new PageFetcher(CrawlConfig.defaults(), req -> {
            throw new IOException("connection reset");
        });
        assertThat(fetcher.fetch(URI.create("https://docs.example.com/")).isTransportFailure()).isTrue();
    }

    @Test
    void non_html_content_type_is_reported() {
        PageFetcher fetcher = new PageFetcher(CrawlConfig.defaults(),
                req -> new Resp(200, Map.of("Content-Type", List.of("application/json")), "{}"));
        FetchedPage page = fetcher.fetch(URI.create("https://docs.example.com/data.json"));
        assertThat(page.isOk()).isTrue();
        assertThat(page.isHtml()).isFalse();
    }
}
