// IPageFetcher.java
package com.dochunker.core.api;

import com.dochunker.core.model.FetchedPage;

import java.net.URI;

/** 페이지 취득 최소 계약: 예외 대신 status -1 로 전송 실패를 알린다. */
public interface IPageFetcher {
    FetchedPage fetch(URI url);
}
