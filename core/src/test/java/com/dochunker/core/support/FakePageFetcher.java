package com.dochunker.core.support;

import com.dochunker.core.api.IPageFetcher;
import com.dochunker.core.model.FetchedPage;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/** URL → 고정 응답. 등록되지 않은 URL은 404 text/html. 호출 순서를 기록한다. */
public final class FakePageFetcher implements IPageFetcher {

    private final Map<String, FetchedPage> byUrl = new LinkedHashMap<>();
    private final List<String> calls = new ArrayList<>();
    private Consumer<String> onFetch = u -> {};

    public FakePageFetcher html(String url, String body) {
        return stub(url, 200, "text/html; charset=utf-8", body);
    }

    public FakePageFetcher xml(String url, String body) {
        return stub(url, 200, "application/xml", body);
    }

    public FakePageFetcher stub(String url, int status, String contentType, String body) {
        URI u = URI.create(url);
        byUrl.put(url, FetchedPage.builder().url(u).statusCode(status)
                .contentType(contentType).body(body).build());
        return this;
    }

    public FakePageFetcher fail(String url) {
        byUrl.put(url, FetchedPage.failure(URI.create(url), 0));
        return this;
    }

    /** fetch마다 호출되는 훅 (이벤트 순서 기록용) */
    public FakePageFetcher onFetch(Consumer<String> hook) {
        this.onFetch = hook;
        return this;
    }

    @Override
    public FetchedPage fetch(URI url) {
        String key = url.toString();
        calls.add(key);
        onFetch.accept(key);
        FetchedPage p = byUrl.get(key);
        if (p != null) return p;
        return FetchedPage.builder().url(url).statusCode(404).contentType("text/html").body("").build();
    }

    public List<String> calls() { return calls; }

    public long count(String url) {
        return calls.stream().filter(url::equals).count();
    }
}
