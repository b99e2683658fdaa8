package com.dochunker.core.output;

import com.dochunker.core.model.Passage;

/** 패시지 출력 대상. 추가 전용, 레코드마다 flush. */
public interface PassageSink extends AutoCloseable {

    /** @throws java.io.UncheckedIOException 쓰기 실패 (실행 중단 사유) */
    void write(Passage passage);

    /** 지금까지 쓴 레코드 수 */
    long written();

    @Override
    void close();
}
