package com.dochunker.app.app;

import com.dochunker.app.logging.LogSetup;
import com.dochunker.core.http.NetscapeCookieLoader;
import com.dochunker.core.http.PageFetcher;
import com.dochunker.core.model.CrawlConfig;
import com.dochunker.core.service.CrawlService;
import com.dochunker.core.util.YamlConfigLoader;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintStream;
import java.net.CookieManager;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * CLI 진입점.
 * 값 우선순위: 기본값 → --config YAML → 명령행 플래그.
 * 플래그는 박싱 타입으로 받아 "지정하지 않음(null)"과 기본값을 구분한다.
 */
@Command(name = "dochunker", mixinStandardHelpOptions = true, version = "1.0.0",
         description = "Crawl a documentation site and write heading-aware passages as JSON Lines")
public class App implements Callable<Integer> {
    private static final Logger LOG = Logger.getLogger(App.class.getName());

    @Option(names = "--config", description = "YAML config file (flags override its values)")
    Path config;

    @Option(names = "--base", description = "Base URL; crawl scope is its origin")
    String base;

    @Option(names = "--out", description = "Output JSONL file")
    Path out;

    @Option(names = "--delay", description = "Seconds to wait after each request")
    Double delaySeconds;

    @Option(names = "--max-pages", description = "Hard cap on frontier consumption")
    Integer maxPages;

    @Option(names = "--user-agent", description = "User-Agent header")
    String userAgent;

    @Option(names = "--cookies", description = "Netscape cookies.txt file")
    Path cookies;

    @Option(names = "--cookie-header", description = "Raw Cookie header value")
    String cookieHeader;

    @Option(names = "--min-tokens", description = "Flush a passage once it reaches this many tokens")
    Integer minTokens;

    @Option(names = "--max-tokens", description = "Never merge sections past this many tokens")
    Integer maxTokens;

    @Option(names = "--source", description = "Metadata source label")
    String source;

    @Option(names = "--timeout-ms", description = "Per-request timeout in milliseconds")
    Long timeoutMs;

    private final PrintStream err;

    public App() {
        this(System.err);
    }

    App(PrintStream err) {
        this.err = err;
    }

    public static void main(String[] args) {
        // 로그 초기화 (-Ddc.out.dir 없으면 "out")
        Path outRoot = Paths.get(System.getProperty("dc.out.dir", "out"));
        LogSetup.init(outRoot.resolve("logs"));

        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.log(Level.SEVERE, "\n==== Uncaught: " + t.getName() + " ====", e));

        int code = new CommandLine(new App()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        CrawlConfig cfg;
        CookieManager jar;
        try {
            cfg = resolveConfig();
            cfg.validate();
            jar = (cfg.getCookiesFile() != null)
                    ? NetscapeCookieLoader.load(cfg.getCookiesFile())
                    : new CookieManager();
        } catch (IllegalArgumentException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return CommandLine.ExitCode.USAGE;
        } catch (IOException e) {
            err.println("Cannot read input file: " + e.getMessage());
            return CommandLine.ExitCode.USAGE;
        }

        try {
            CrawlService svc = new CrawlService(cfg, new PageFetcher(cfg, jar));
            svc.run(new ConsoleProgress(err));
            return CommandLine.ExitCode.OK;
        } catch (IOException | RuntimeException e) {
            LOG.log(Level.SEVERE, "Crawl failed", e);
            err.println("Crawl failed: " + e.getMessage());
            return CommandLine.ExitCode.SOFTWARE;
        }
    }

    /** 기본값 → YAML → 플래그 순으로 덮어쓴 설정 (검증 전) */
    CrawlConfig resolveConfig() throws IOException {
        CrawlConfig cfg = CrawlConfig.defaults();
        if (config != null) YamlConfigLoader.load(config, cfg);

        if (base != null) cfg.setBaseUrl(base);
        if (out != null) cfg.setOutput(out);
        if (delaySeconds != null) {
            if (delaySeconds < 0) throw new IllegalArgumentException("--delay must be >= 0");
            cfg.setDelaySeconds(delaySeconds);
        }
        if (maxPages != null) cfg.setMaxPages(maxPages);
        if (userAgent != null) cfg.setUserAgent(userAgent);
        if (cookies != null) cfg.setCookiesFile(cookies);
        if (cookieHeader != null) cfg.setCookieHeader(cookieHeader);
        if (minTokens != null) cfg.setMinTokens(minTokens);
        if (maxTokens != null) cfg.setMaxTokens(maxTokens);
        if (source != null) cfg.setSource(source);
        if (timeoutMs != null) {
            if (timeoutMs <= 0) throw new IllegalArgumentException("--timeout-ms must be > 0");
            cfg.setTimeoutMs(timeoutMs);
        }
        return cfg;
    }
}
