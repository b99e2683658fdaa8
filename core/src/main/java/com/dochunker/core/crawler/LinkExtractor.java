package com.dochunker.core.crawler;

import java.net.URI;
import java.util.List;

/** 이미 받아온 HTML에서 링크를 뽑는 전략 인터페이스. */
public interface LinkExtractor {
    /**
     * pageUrl 기준으로 해석한 절대 URL(정규화, fragment 제거)을 문서 순서대로 반환.
     * 같은 URL은 한 번만.
     */
    List<String> extract(String html, URI pageUrl);
}
