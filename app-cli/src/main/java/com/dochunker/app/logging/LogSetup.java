package com.dochunker.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 전역 설정 + 사이즈 롤링(기본 2MB x 5).
 * slf4j 로그는 slf4j-jdk14 바인딩으로 여기 핸들러를 탄다.
 *
 * System props:
 *  -Ddc.log.level=FINE|INFO|WARNING|SEVERE (기본 INFO)
 *  -Ddc.log.sizeMb=2
 *  -Ddc.log.files=5
 *  -Ddc.log.console=true|false (기본 true)
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    /** logDir/crawl-%g.log 로 저장 */
    public static synchronized void init(Path logDir) {
        if (initialized) return;
        initialized = true;

        try {
            Files.createDirectories(logDir);

            Level level = levelOf(System.getProperty("dc.log.level", "INFO"));
            int sizeMb  = parseInt(System.getProperty("dc.log.sizeMb"), 2);
            int fileCnt = parseInt(System.getProperty("dc.log.files"), 5);
            boolean toConsole = !"false".equalsIgnoreCase(System.getProperty("dc.log.console", "true"));

            LogManager.getLogManager().reset();
            Logger root = Logger.getLogger("");

            if (toConsole) {
                ConsoleHandler console = new ConsoleHandler(); // stderr
                console.setLevel(level);
                console.setFormatter(LINE_FORMATTER);
                root.addHandler(console);
            }

            String pattern = logDir.resolve("crawl-%g.log").toString();
            FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
            file.setLevel(level);
            file.setFormatter(LINE_FORMATTER);
            root.addHandler(file);

            root.setLevel(level);

            Logger.getLogger(LogSetup.class.getName()).log(Level.FINE,
                    () -> "Log initialized. dir=" + logDir.toAbsolutePath() + ", level=" + level.getName());

        } catch (IOException e) {
            // 파일 로그 없이 기본 콘솔 설정으로 진행
            Logger.getAnonymousLogger().log(Level.WARNING, "Log setup failed: " + e.getMessage(), e);
        }
    }

    /** 문자열을 Level로(실패 시 INFO) */
    public static Level levelOf(String s) {
        try { return Level.parse(String.valueOf(s).trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return Level.INFO; }
    }

    static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException e) { return def; }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    private static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    r.getLoggerName(), msg);

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }
    }
}
