package com.dochunker.core.crawler;

import com.dochunker.core.util.StructuredLog;
import com.dochunker.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** 기본 JSoup 기반 링크 추출기: a[href] → abs:href 수집 (http/https만) */
public class JsoupLinkExtractor implements LinkExtractor {

    private static final StructuredLog SLOG = StructuredLog.get(JsoupLinkExtractor.class);

    @Override
    public List<String> extract(String html, URI pageUrl) {
        if (html == null || html.isEmpty() || pageUrl == null) return List.of();

        Document doc = Jsoup.parse(html, pageUrl.toString());
        Set<String> out = new LinkedHashSet<>();
        for (Element a : doc.select("a[href]")) {
            String abs = a.attr("abs:href");
            if (abs == null || abs.isBlank()) continue;
            String n = UrlUtils.normalizeOrNull(abs.trim());
            if (n == null) { // URI로 파싱되지 않는 href (공백, '|' 등)
                SLOG.debug("link-dropped", "page", pageUrl.toString(), "href", abs.trim());
                continue;
            }
            if (!isHttp(n)) continue;  // mailto:, javascript: 등
            out.add(n);
        }
        return new ArrayList<>(out);
    }

    private static boolean isHttp(String url) {
        String s = url.toLowerCase(Locale.ROOT);
        return s.startsWith("http://") || s.startsWith("https://");
    }
}
