package com.dochunker.core.extract;

/** 본문 추출 시도 하나. ContentExtractor가 순서대로 호출한다. */
public interface BodyExtractionStrategy {

    /** 이 시도의 이름(로그용) */
    String name();

    /** 원본 전체 HTML에서 본문을 뽑는다. 실패해도 예외 대신 빈 본문. */
    ExtractionAttempt attempt(String html);
}
