package com.dochunker.core.util;

import com.dochunker.core.model.CrawlConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * crawl.yml을 읽어 CrawlConfig로 변환. 없는 키는 기본값 유지.
 *
 * 예상 YAML 키:
 * base: "https://docs.example.com/"
 * out: "chunks.jsonl"
 * source: "ExampleDocs"
 * delaySeconds: 1.0
 * maxPages: 5000
 * userAgent: "InternalDocsCrawler/1.0"
 * timeoutMs: 30000
 * followRedirects: true
 *
 * auth:
 *   cookies: "cookies.txt"
 *   cookieHeader: "session=abc"
 *
 * chunking:
 *   minTokens: 250
 *   maxTokens: 900
 *
 * extraction:
 *   minContentChars: 200
 *   fallbackThresholdChars: 200
 *   fallbackSelectors: ["#mw-content-text", ".mw-parser-output", "main", "body"]
 *
 * scope:
 *   excludePaths: ["contains:Special:", "/extensions/"]
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static CrawlConfig load(Path yamlPath) throws IOException {
        return load(yamlPath, CrawlConfig.defaults());
    }

    /** 기존 cfg 위에 YAML 값을 덮어쓴다(검증은 호출자 몫: CLI 값까지 반영 후 validate) */
    public static CrawlConfig load(Path yamlPath, CrawlConfig cfg) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        Objects.requireNonNull(cfg, "cfg");
        if (!Files.exists(yamlPath)) {
            throw new IOException("config not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Object root = yaml.load(in);

            if (!(root instanceof Map<?, ?> map)) {
                // 비어있거나 단순 스칼라면 그대로
                return cfg;
            }

            // 1) 평면 키
            setString(map, "base", cfg::setBaseUrl);
            setPath(map, "out", cfg::setOutput);
            setString(map, "source", cfg::setSource);
            setDouble(map, "delaySeconds", cfg::setDelaySeconds);
            setInt(map, "maxPages", cfg::setMaxPages);
            setString(map, "userAgent", cfg::setUserAgent);
            setLongAsDurationMs(map, "timeoutMs", cfg::setTimeout);
            setBoolean(map, "followRedirects", cfg::setFollowRedirects);

            // 2) auth.*
            Map<String, Object> auth = getMap(map, "auth");
            if (auth != null) {
                setPath(auth, "cookies", cfg::setCookiesFile);
                setString(auth, "cookieHeader", cfg::setCookieHeader);
            }

            // 3) chunking.*
            Map<String, Object> chunking = getMap(map, "chunking");
            if (chunking != null) {
                setInt(chunking, "minTokens", cfg::setMinTokens);
                setInt(chunking, "maxTokens", cfg::setMaxTokens);
            }

            // 4) extraction.*
            Map<String, Object> extraction = getMap(map, "extraction");
            if (extraction != null) {
                setInt(extraction, "minContentChars", cfg::setMinContentChars);
                setInt(extraction, "fallbackThresholdChars", cfg::setFallbackThresholdChars);
                setStringList(extraction, "fallbackSelectors", cfg::setFallbackSelectors);
            }

            // 5) scope.excludePaths (빈 리스트 허용 = 제외 없음)
            Map<String, Object> scope = getMap(map, "scope");
            if (scope != null && scope.containsKey("excludePaths")) {
                Object v = scope.get("excludePaths");
                cfg.setExcludePaths(v == null ? List.of() : toStringList(v));
            }
            return cfg;
        }
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = toStringList(v);
        if (!out.isEmpty()) setter.accept(out);
    }

    private static List<String> toStringList(Object v) {
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
            return List.copyOf(out);
        }
        // "a,b,c" 형태 지원
        String s = String.valueOf(v).trim();
        if (!s.isEmpty()) {
            for (String p : s.split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        return List.copyOf(out);
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setDouble(Map<?, ?> map, String key, Consumer<Double> setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.doubleValue());
        else if (v != null) setter.accept(Double.parseDouble(String.valueOf(v).trim()));
    }

    private static void setLongAsDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        if (ms > 0) setter.accept(Duration.ofMillis(ms));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }
}
