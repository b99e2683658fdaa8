package com.dochunker.core.crawler.sitemap;

import com.dochunker.core.api.IPageFetcher;
import com.dochunker.core.model.FetchedPage;
import com.dochunker.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * 잘 알려진 위치(/sitemap.xml → /sitemap_index.xml)에서 URL 목록을 구한다.
 * - 후보 응답은 status 200 + content-type에 "xml" 일 때만 사용
 * - sitemapindex면 자식 sitemap을 모두 받아 loc 합집합
 * - 결과는 중복 제거 + 정렬(결정적 순서), 못 찾으면 빈 목록 → seed 모드로
 */
public final class SitemapDiscovery {

    private static final Logger LOG = LoggerFactory.getLogger(SitemapDiscovery.class);
    private static final StructuredLog SLOG = StructuredLog.get(SitemapDiscovery.class);

    static final List<String> CANDIDATES = List.of("/sitemap.xml", "/sitemap_index.xml");

    private final IPageFetcher fetcher;

    public SitemapDiscovery(IPageFetcher fetcher) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    }

    public List<String> discover(URI base) {
        for (String path : CANDIDATES) {
            URI sm = base.resolve(path);
            FetchedPage r = fetcher.fetch(sm);
            if (!r.isOk() || !r.isXml()) {
                LOG.debug("Sitemap not usable at {} (status={}, ct={})", sm, r.getStatusCode(), r.getContentType());
                continue;
            }

            SitemapParser.Result doc = SitemapParser.parse(r.getBody());
            switch (doc.kind) {
                case INDEX: {
                    List<String> urls = new ArrayList<>();
                    for (String child : doc.locs) urls.addAll(fetchChild(child));
                    List<String> out = sortedUnique(urls);
                    LOG.info("Sitemap index {} → {} child sitemaps, {} urls", sm, doc.locs.size(), out.size());
                    SLOG.info("sitemap-found", "url", sm.toString(), "kind", "index", "urls", out.size());
                    return out;
                }
                case URLSET: {
                    List<String> out = sortedUnique(doc.locs);
                    LOG.info("Sitemap {} → {} urls", sm, out.size());
                    SLOG.info("sitemap-found", "url", sm.toString(), "kind", "urlset", "urls", out.size());
                    return out;
                }
                default:
                    // xml이지만 sitemap 마커 없음 → 다음 후보
                    LOG.debug("No sitemap marker in {}", sm);
            }
        }
        return List.of();
    }

    /** 자식 sitemap은 status 200이면 파싱 (content-type 검사 없음) */
    private List<String> fetchChild(String child) {
        URI u;
        try {
            u = URI.create(child);
        } catch (IllegalArgumentException e) {
            LOG.debug("Bad child sitemap url: {}", child);
            return List.of();
        }
        FetchedPage cr = fetcher.fetch(u);
        if (!cr.isOk()) {
            LOG.debug("Child sitemap {} skipped (status={})", u, cr.getStatusCode());
            return List.of();
        }
        return SitemapParser.parse(cr.getBody()).locs;
    }

    private static List<String> sortedUnique(List<String> urls) {
        return new ArrayList<>(new TreeSet<>(urls));
    }
}
