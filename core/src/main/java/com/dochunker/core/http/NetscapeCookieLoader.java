package com.dochunker.core.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.HttpCookie;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Netscape cookies.txt → CookieManager.
 *
 * 형식(탭 구분): domain, include_subdomains, path, secure, expires, name, value
 * - '#' 주석/빈 줄 무시 ("#HttpOnly_" 접두 도메인은 일반 쿠키로 취급)
 * - 필드 7개 미만, 잘못된 쿠키 이름 → 그 줄만 건너뜀
 * - expires는 무시(브라우저에서 막 내보낸 파일 기준, 만료 판단은 서버 몫)
 */
public final class NetscapeCookieLoader {
    private static final Logger LOG = LoggerFactory.getLogger(NetscapeCookieLoader.class);
    private static final String HTTP_ONLY_PREFIX = "#HttpOnly_";

    private NetscapeCookieLoader() {}

    public static CookieManager load(Path file) throws IOException {
        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return load(in);
        }
    }

    public static CookieManager load(Reader reader) throws IOException {
        CookieManager jar = new CookieManager(null, CookiePolicy.ACCEPT_ALL);
        BufferedReader in = (reader instanceof BufferedReader br) ? br : new BufferedReader(reader);
        int loaded = 0, skipped = 0;
        String raw;
        while ((raw = in.readLine()) != null) {
            String line = raw.strip();
            boolean httpOnly = line.startsWith(HTTP_ONLY_PREFIX);
            if (httpOnly) line = line.substring(HTTP_ONLY_PREFIX.length());
            else if (line.isEmpty() || line.startsWith("#")) continue;

            HttpCookie cookie = parseLine(line, httpOnly);
            if (cookie == null) { skipped++; continue; }
            jar.getCookieStore().add(hostOnlyUri(line.substring(0, line.indexOf('\t'))), cookie);
            loaded++;
        }
        LOG.info("Cookies loaded: {} (skipped {} malformed lines)", loaded, skipped);
        return jar;
    }

    /** 한 줄 파싱. 형식 오류면 null */
    static HttpCookie parseLine(String line, boolean httpOnly) {
        String[] parts = line.split("\t", -1);
        if (parts.length < 7) return null;
        String domain = parts[0];
        String path = parts[2];
        boolean secure = "TRUE".equalsIgnoreCase(parts[3]);
        String name = parts[5];
        String value = parts[6];
        try {
            HttpCookie c = new HttpCookie(name, value);
            c.setVersion(0); // netscape 도메인 매칭 규칙 사용
            if (!domain.isEmpty() && hostOnlyUri(domain) == null) c.setDomain(domain);
            c.setPath(path.isEmpty() ? "/" : path);
            c.setSecure(secure);
            c.setHttpOnly(httpOnly);
            return c;
        } catch (IllegalArgumentException e) {
            return null; // 잘못된 쿠키 이름 등
        }
    }

    /**
     * 점 없는 호스트(localhost 등)는 netscape 도메인 매칭에 걸리지 않는다.
     * 이런 쿠키는 도메인 없이 http://host/ 에 묶어 저장한다. 그 외 도메인이면 null.
     */
    static URI hostOnlyUri(String domain) {
        String host = domain.startsWith(".") ? domain.substring(1) : domain;
        if (host.isEmpty() || host.contains(".")) return null;
        try {
            return new URI("http", host, "/", null);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
