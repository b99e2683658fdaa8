package com.dochunker.core.model;

/** 한 번의 크롤 실행 누적 카운터 (단일 스레드 전용). */
public final class CrawlStats {
    private int pagesVisited;       // frontier에서 꺼내 실제 요청한 수
    private int transportFailures;  // 연결 오류/타임아웃
    private int nonHtmlSkipped;     // status != 200 또는 HTML 아님
    private int thinContentSkipped; // 추출 본문이 너무 짧음
    private int pagesChunked;       // 패시지를 1개 이상 낸 페이지
    private long passagesWritten;

    public void onVisited() { pagesVisited++; }
    public void onTransportFailure() { transportFailures++; }
    public void onNonHtml() { nonHtmlSkipped++; }
    public void onThinContent() { thinContentSkipped++; }
    public void onChunked(int passages) {
        if (passages > 0) pagesChunked++;
        passagesWritten += passages;
    }

    public Snapshot snapshot() {
        return new Snapshot(pagesVisited, transportFailures, nonHtmlSkipped,
                thinContentSkipped, pagesChunked, passagesWritten);
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final int pagesVisited;
        public final int transportFailures;
        public final int nonHtmlSkipped;
        public final int thinContentSkipped;
        public final int pagesChunked;
        public final long passagesWritten;

        public Snapshot(int v, int tf, int nh, int thin, int chunked, long written) {
            this.pagesVisited = v;
            this.transportFailures = tf;
            this.nonHtmlSkipped = nh;
            this.thinContentSkipped = thin;
            this.pagesChunked = chunked;
            this.passagesWritten = written;
        }
    }
}
