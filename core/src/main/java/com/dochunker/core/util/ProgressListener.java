package com.dochunker.core.util;

@FunctionalInterface
public interface ProgressListener {
    /**
     * @param phase "discover" | "crawl" | "done"
     * @param done  처리한 frontier 항목 수
     * @param total 현재 알려진 전체 수 (seed 모드에서는 탐색하면서 늘어난다, 모르면 -1)
     */
    void onProgress(String phase, long done, long total);

    ProgressListener NONE = (phase, d, t) -> {};
}
