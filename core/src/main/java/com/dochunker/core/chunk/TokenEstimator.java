package com.dochunker.core.chunk;

/** 토큰 수 근사: 코드포인트 4개 ≈ 1토큰, 최소 1 */
public final class TokenEstimator {
    private TokenEstimator() {}

    public static int estimate(String text) {
        if (text == null || text.isEmpty()) return 1;
        return Math.max(1, text.codePointCount(0, text.length()) / 4);
    }
}
