package com.dochunker.core.model;

/** 페이지 본문 추출 결과: 제목(빈 문자열 가능) + 마크다운 본문 */
public final class ExtractedDocument {
    private final String title;
    private final String body;

    public ExtractedDocument(String title, String body) {
        this.title = (title == null) ? "" : title;
        this.body = (body == null) ? "" : body;
    }

    public String getTitle() { return title; }
    public String getBody() { return body; }

    /** 최소 길이(문자) 이상이면 쓸모 있는 본문으로 본다 */
    public boolean isViable(int minChars) {
        return !body.isEmpty() && body.length() >= minChars;
    }
}
