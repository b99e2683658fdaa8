package com.dochunker.app.app;

import com.dochunker.core.util.ProgressListener;

import java.io.PrintStream;
import java.util.Locale;

/** stderr 한 줄 진행 표시줄. seed 모드에서는 전체 수가 크롤하면서 늘어난다. */
final class ConsoleProgress implements ProgressListener {
    private static final int WIDTH = 30;

    private final PrintStream out;

    ConsoleProgress(PrintStream out) {
        this.out = out;
    }

    @Override
    public void onProgress(String phase, long done, long total) {
        out.print('\r');
        out.print(render(phase, done, total));
        if ("done".equals(phase)) out.println();
        out.flush();
    }

    static String render(String phase, long done, long total) {
        if (total <= 0) {
            return String.format(Locale.ROOT, "%-8s %d", phase, done);
        }
        long clamped = Math.min(done, total);
        int filled = (int) (WIDTH * clamped / total);
        return String.format(Locale.ROOT, "%-8s [%s%s] %d/%d",
                phase, "#".repeat(filled), ".".repeat(WIDTH - filled), done, total);
    }
}
