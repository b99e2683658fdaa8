package com.dochunker.core.service;

import com.dochunker.core.api.IPageFetcher;
import com.dochunker.core.chunk.Chunker;
import com.dochunker.core.chunk.SectionSplitter;
import com.dochunker.core.crawler.Frontier;
import com.dochunker.core.crawler.JsoupLinkExtractor;
import com.dochunker.core.crawler.LinkExtractor;
import com.dochunker.core.crawler.ScopeFilter;
import com.dochunker.core.crawler.sitemap.SitemapDiscovery;
import com.dochunker.core.extract.ContentExtractor;
import com.dochunker.core.http.PageFetcher;
import com.dochunker.core.model.CrawlConfig;
import com.dochunker.core.model.CrawlStats;
import com.dochunker.core.model.ExtractedDocument;
import com.dochunker.core.model.FetchedPage;
import com.dochunker.core.model.Passage;
import com.dochunker.core.model.Section;
import com.dochunker.core.output.JsonlPassageWriter;
import com.dochunker.core.output.PassageSink;
import com.dochunker.core.util.DefaultSleeper;
import com.dochunker.core.util.ProgressListener;
import com.dochunker.core.util.Sleeper;
import com.dochunker.core.util.StructuredLog;
import com.dochunker.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 크롤 오케스트레이터:
 *  - sitemap 탐색 → frontier 구성(닫힌 목록 / seed)
 *  - 페이지마다 fetch → 상태·타입 확인 → (seed면 링크 추가) → 본문 추출 → 섹션 → 청크 → sink
 *  - 요청마다 뒤에 고정 지연(건너뛴 페이지 포함). 첫 요청 전과 sitemap 탐색 중에는 지연 없음
 *  - 단일 스레드 순차 실행, 재시도 없음
 *
 * DI 생성자는 테스트용(가짜 fetcher, 기록형 sleeper, 메모리 sink).
 */
public final class CrawlService {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlService.class);
    private static final StructuredLog SLOG = StructuredLog.get(CrawlService.class);

    private final CrawlConfig config;
    private final IPageFetcher fetcher;
    private final Sleeper sleeper;
    private final LinkExtractor links;
    private final ContentExtractor extractor;
    private final SectionSplitter splitter = new SectionSplitter();
    private final Chunker chunker;
    private final ScopeFilter scope;
    private final URI base;

    /** 기본 구현: java.net.http fetcher + Thread.sleep */
    public CrawlService(CrawlConfig config) {
        this(config, new PageFetcher(config), new DefaultSleeper());
    }

    public CrawlService(CrawlConfig config, IPageFetcher fetcher) {
        this(config, fetcher, new DefaultSleeper());
    }

    /** DI/테스트용 */
    public CrawlService(CrawlConfig config, IPageFetcher fetcher, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.base = URI.create(UrlUtils.normalize(config.getBaseUrl()));
        this.scope = new ScopeFilter(base, config.getExcludePaths());
        this.links = new JsoupLinkExtractor();
        this.extractor = new ContentExtractor(config);
        this.chunker = new Chunker(config.getSource(), config.getMinTokens(), config.getMaxTokens());
    }

    /* =========================
       실행 API
       ========================= */

    public CrawlStats.Snapshot run() throws IOException {
        return run(ProgressListener.NONE, null);
    }

    public CrawlStats.Snapshot run(ProgressListener listener) throws IOException {
        return run(listener, null);
    }

    /** 설정의 출력 경로로 JSONL sink를 열어 실행. 파일은 실행 시작 시 비워진다. */
    public CrawlStats.Snapshot run(ProgressListener listener, AtomicBoolean cancelFlag) throws IOException {
        PassageSink sink = new JsonlPassageWriter(config.getOutput());
        return run(sink, listener, cancelFlag);
    }

    /** sink 주입 실행. sink는 어떤 경로로 끝나든 닫힌다. */
    public CrawlStats.Snapshot run(PassageSink sink, ProgressListener listener, AtomicBoolean cancelFlag) {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;

        LOG.info("Crawl start: base={}, maxPages={}, delay={}ms, tokens={}..{}",
                base, config.getMaxPages(), config.getDelay().toMillis(),
                config.getMinTokens(), config.getMaxTokens());
        SLOG.info("crawl-start",
                "base", base.toString(),
                "maxPages", config.getMaxPages(),
                "delayMs", config.getDelay().toMillis(),
                "minTokens", config.getMinTokens(),
                "maxTokens", config.getMaxTokens());

        pl.onProgress("discover", 0, -1);
        Frontier frontier;
        try {
            frontier = buildFrontier();
        } catch (RuntimeException e) {
            sink.close();
            throw e;
        }

        try (CrawlSession session = new CrawlSession(frontier, sink)) {
            crawl(session, pl, cancelFlag);
            CrawlStats.Snapshot snap = session.stats().snapshot();
            pl.onProgress("done", frontier.consumed(), frontier.consumed());
            LOG.info("Done. Wrote {} chunks to {}", snap.passagesWritten, config.getOutput());
            SLOG.info("crawl-done",
                    "pages", snap.pagesVisited,
                    "passages", snap.passagesWritten,
                    "transportFailures", snap.transportFailures,
                    "nonHtml", snap.nonHtmlSkipped,
                    "thin", snap.thinContentSkipped,
                    "chunkedPages", snap.pagesChunked);
            return snap;
        }
    }

    /* =========================
       내부 구현
       ========================= */

    /** sitemap이 있으면 범위·경로 필터를 한 번 거친 닫힌 목록, 없으면 base 하나로 시작 */
    Frontier buildFrontier() {
        List<String> fromSitemap = new SitemapDiscovery(fetcher).discover(base);
        if (!fromSitemap.isEmpty()) {
            List<String> kept = new ArrayList<>(fromSitemap.size());
            for (String u : fromSitemap) {
                String n = UrlUtils.normalizeOrNull(u);
                if (n != null && scope.accepts(n)) kept.add(n);
            }
            LOG.info("Using sitemap: {} urls ({} in scope)", fromSitemap.size(), kept.size());
            if (!kept.isEmpty()) return Frontier.fixed(kept, config.getMaxPages());
        }
        LOG.info("No usable sitemap; crawling from {}", base);
        return Frontier.seeded(base.toString(), config.getMaxPages());
    }

    private void crawl(CrawlSession session, ProgressListener pl, AtomicBoolean cancel) {
        Frontier frontier = session.frontier();
        CrawlStats stats = session.stats();
        while (!isCancelled(cancel)) {
            Optional<String> next = frontier.next();
            if (next.isEmpty()) break;

            processPage(next.get(), session);
            pl.onProgress("crawl", frontier.consumed(), frontier.knownTotal());

            if (!pause()) break; // 요청마다 뒤에 지연 (건너뛴 페이지 포함)
        }
        if (isCancelled(cancel)) LOG.info("Crawl cancelled after {} pages", stats.snapshot().pagesVisited);
    }

    private void processPage(String url, CrawlSession session) {
        Frontier frontier = session.frontier();
        CrawlStats stats = session.stats();
        URI uri = URI.create(url);

        stats.onVisited();
        FetchedPage page = fetcher.fetch(uri);
        if (page.isTransportFailure()) {
            stats.onTransportFailure();
            SLOG.warn("page-skipped", "url", url, "reason", "transport");
            return;
        }

        LOG.info("Fetched {} status={} ct={} len={}",
                url, page.getStatusCode(), page.getContentType(), page.getBody().length());
        SLOG.debug("page-fetched", "url", url, "status", page.getStatusCode(),
                "ms", page.getResponseTimeMs());

        if (!page.isOk() || !page.isHtml()) {
            stats.onNonHtml();
            SLOG.info("page-skipped", "url", url, "reason", "status-or-type",
                    "status", page.getStatusCode());
            return;
        }

        if (frontier.acceptsDiscoveries()) {
            for (String link : links.extract(page.getBody(), page.getUrl())) {
                if (scope.accepts(link)) frontier.offer(link);
            }
        }

        ExtractedDocument doc = extractor.extract(page.getBody());
        LOG.info("Extracted markdown chars={} title={}", doc.getBody().length(), doc.getTitle());
        if (!doc.isViable(config.getMinContentChars())) {
            stats.onThinContent();
            SLOG.info("page-skipped", "url", url, "reason", "thin", "chars", doc.getBody().length());
            return;
        }

        List<Section> sections = splitter.split(doc.getBody());
        List<Passage> passages = chunker.chunk(url, doc.getTitle(), sections);
        for (Passage p : passages) session.sink().write(p);
        stats.onChunked(passages.size());
    }

    /** 고정 지연. 인터럽트면 플래그 복원 후 false(크롤 종료) */
    private boolean pause() {
        try {
            sleeper.sleep(config.getDelay());
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.info("Interrupted during delay; stopping crawl");
            return false;
        }
    }

    private static boolean isCancelled(AtomicBoolean cancel) {
        return (cancel != null && cancel.get()) || Thread.currentThread().isInterrupted();
    }
}
