package com.dochunker.core.extract;

/**
 * 추출 시도 결과.
 * title이 null이면 이 시도는 제목을 만들지 않는다(구조 폴백 등).
 */
public final class ExtractionAttempt {
    private final String title;
    private final String markdown;

    public ExtractionAttempt(String title, String markdown) {
        this.title = title;
        this.markdown = (markdown == null) ? "" : markdown;
    }

    public static ExtractionAttempt bodyOnly(String markdown) {
        return new ExtractionAttempt(null, markdown);
    }

    public String getTitle() { return title; }
    public String getMarkdown() { return markdown; }
}
