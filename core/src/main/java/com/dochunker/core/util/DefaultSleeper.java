package com.dochunker.core.util;

import java.time.Duration;

/** Thread.sleep 기반 실제 대기. null/0/음수는 대기 없음. */
public final class DefaultSleeper implements Sleeper {
    @Override public void sleep(Duration d) throws InterruptedException {
        if (d == null) return;
        long ms = d.toMillis();
        if (ms > 0) Thread.sleep(ms);
    }
}
