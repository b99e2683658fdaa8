package com.dochunker.core.model;

import java.util.Objects;

/**
 * 헤딩 하나가 여는 본문 구간.
 * heading은 서문(첫 헤딩 이전)일 때 빈 문자열, text는 헤딩 줄 자체를 포함한다.
 */
public record Section(String heading, String text) {
    public Section {
        heading = (heading == null) ? "" : heading;
        Objects.requireNonNull(text, "text");
    }
}
