package com.dochunker.core.service;

import com.dochunker.core.crawler.Frontier;
import com.dochunker.core.model.CrawlStats;
import com.dochunker.core.output.PassageSink;

import java.util.Objects;

/**
 * 한 번의 크롤 실행이 독점 소유하는 상태: frontier(방문 집합 포함) + 출력 sink + 카운터.
 * try-with-resources로 닫아 어떤 종료 경로에서도 sink가 정리되게 한다.
 */
public final class CrawlSession implements AutoCloseable {

    private final Frontier frontier;
    private final PassageSink sink;
    private final CrawlStats stats = new CrawlStats();

    public CrawlSession(Frontier frontier, PassageSink sink) {
        this.frontier = Objects.requireNonNull(frontier, "frontier");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public Frontier frontier() { return frontier; }
    public PassageSink sink() { return sink; }
    public CrawlStats stats() { return stats; }

    @Override
    public void close() {
        sink.close();
    }
}
