package com.dochunker.core.extract;

import org.jsoup.nodes.Element;

/** 1차 시도: readability 휴리스틱 본문 → script/style/noscript 제거 → 마크다운 */
public final class ReadabilityStrategy implements BodyExtractionStrategy {

    private final ReadabilityExtractor readability;
    private final HtmlMarkdownConverter converter;

    public ReadabilityStrategy() {
        this(new ReadabilityExtractor(), new HtmlMarkdownConverter());
    }

    public ReadabilityStrategy(ReadabilityExtractor readability, HtmlMarkdownConverter converter) {
        this.readability = readability;
        this.converter = converter;
    }

    @Override public String name() { return "readability"; }

    @Override
    public ExtractionAttempt attempt(String html) {
        ReadabilityExtractor.Result r = readability.extract(html);
        Element fragment = r.content;
        fragment.select("script, style, noscript").remove();
        return new ExtractionAttempt(r.title.trim(), converter.convert(fragment));
    }
}
