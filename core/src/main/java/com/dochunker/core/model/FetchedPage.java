package com.dochunker.core.model;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** 단일 GET 결과 캡처. 전송 실패는 status -1 로 표현한다. */
public final class FetchedPage {
    public static final int TRANSPORT_FAILURE = -1;

    private final URI url;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;
    private final String contentType;
    private final long responseTimeMs;

    private FetchedPage(Builder b) {
        this.url = b.url;
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.body = (b.body == null) ? "" : b.body;
        this.contentType = b.contentType;
        this.responseTimeMs = b.responseTimeMs;
    }

    public URI getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public String getBody() { return body; }
    public String getContentType() { return contentType; }
    public long getResponseTimeMs() { return responseTimeMs; }

    public boolean isTransportFailure() { return statusCode == TRANSPORT_FAILURE; }

    public boolean isOk() { return statusCode == 200; }

    /** text/html 또는 application/xhtml+xml */
    public boolean isHtml() {
        String ct = lowerContentType();
        return ct.contains("text/html") || ct.contains("application/xhtml+xml");
    }

    /** sitemap 후보 판정용: content-type에 "xml" 포함 */
    public boolean isXml() {
        return lowerContentType().contains("xml");
    }

    private String lowerContentType() {
        return contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
    }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        if (name == null) return null;
        for (var e : headers.entrySet()) {
            final String k = e.getKey();
            if (k != null && k.equalsIgnoreCase(name)) {
                final List<String> vs = e.getValue();
                return (vs == null || vs.isEmpty()) ? null : vs.get(0);
            }
        }
        return null;
    }

    public static FetchedPage failure(URI url, long elapsedMs) {
        return builder().url(url).statusCode(TRANSPORT_FAILURE).responseTimeMs(elapsedMs).build();
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private int statusCode;
        private Map<String, List<String>> headers;
        private String body;
        private String contentType;
        private long responseTimeMs;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder responseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; return this; }

        public FetchedPage build() {
            Objects.requireNonNull(url, "url");
            return new FetchedPage(this);
        }
    }
}
