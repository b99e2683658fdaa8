package com.dochunker.core.extract;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;

/**
 * 2차 시도: 원본 전체 HTML에서 알려진 본문 컨테이너를 우선순위대로 고른다.
 * MediaWiki 포털/목차 페이지처럼 휴리스틱이 본문을 거의 못 뽑는 경우용.
 * 제목은 만들지 않는다.
 */
public final class ContainerFallbackStrategy implements BodyExtractionStrategy {

    private final List<String> selectors;
    private final HtmlMarkdownConverter converter;

    public ContainerFallbackStrategy(List<String> selectors) {
        this(selectors, new HtmlMarkdownConverter());
    }

    public ContainerFallbackStrategy(List<String> selectors, HtmlMarkdownConverter converter) {
        this.selectors = List.copyOf(selectors);
        this.converter = converter;
    }

    @Override public String name() { return "container-fallback"; }

    @Override
    public ExtractionAttempt attempt(String html) {
        Document full = Jsoup.parse(html == null ? "" : html);
        Element main = select(full);
        if (main == null) return ExtractionAttempt.bodyOnly("");
        main.select("script, style, noscript, svg").remove();
        return ExtractionAttempt.bodyOnly(converter.convert(main));
    }

    private Element select(Document full) {
        for (String sel : selectors) {
            Element e = "body".equals(sel) ? full.body() : full.selectFirst(sel);
            if (e != null) return e;
        }
        return null;
    }
}
