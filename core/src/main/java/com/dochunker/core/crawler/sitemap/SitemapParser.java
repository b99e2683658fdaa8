package com.dochunker.core.crawler.sitemap;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

import java.util.ArrayList;
import java.util.List;

/** sitemap XML 파서 (jsoup XML 모드). 네트워크 없음. */
public final class SitemapParser {
    private SitemapParser() {}

    public enum Kind { INDEX, URLSET, UNKNOWN }

    /** 파싱 결과: 문서 종류 + loc 목록(문서 순서) */
    public static final class Result {
        public final Kind kind;
        public final List<String> locs;

        Result(Kind kind, List<String> locs) {
            this.kind = kind;
            this.locs = List.copyOf(locs);
        }
    }

    public static Result parse(String xml) {
        if (xml == null || xml.isBlank()) return new Result(Kind.UNKNOWN, List.of());
        Document doc = Jsoup.parse(xml, "", Parser.xmlParser());

        List<String> locs = new ArrayList<>();
        for (Element loc : doc.getElementsByTag("loc")) {
            String s = loc.text().trim();
            if (!s.isEmpty()) locs.add(s);
        }

        Kind kind;
        if (!doc.getElementsByTag("sitemapindex").isEmpty()) kind = Kind.INDEX;
        else if (!doc.getElementsByTag("urlset").isEmpty()) kind = Kind.URLSET;
        else kind = Kind.UNKNOWN;
        return new Result(kind, locs);
    }
}
