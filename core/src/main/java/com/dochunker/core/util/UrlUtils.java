package com.dochunker.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/** URL 정규화 + same-origin 판정 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * 정규화 규칙:
     * - fragment 제거(#... 제거)
     * - 쿼리는 손대지 않음 (문서 시스템이 쿼리로 페이지를 식별하는 경우가 있음)
     * - 그 외 scheme/host/path는 입력 그대로 유지
     *
     * @throws InvalidUrlException 파싱 불가 입력
     */
    public static String normalize(String url) {
        if (url == null) throw new InvalidUrlException("null url");
        String s = url.trim();
        URI u;
        try {
            u = new URI(s);
        } catch (URISyntaxException e) {
            throw new InvalidUrlException(s, e);
        }
        if (u.getRawFragment() == null) return u.toString();
        int hash = s.indexOf('#');
        return s.substring(0, hash);
    }

    /** 실패 시 null 반환 버전 (링크 수집처럼 조용히 건너뛰는 호출자용) */
    public static String normalizeOrNull(String url) {
        try {
            return normalize(url);
        } catch (InvalidUrlException e) {
            return null;
        }
    }

    /** scheme + authority(host[:port]) 일치 여부, 대소문자 무시 */
    public static boolean sameOrigin(URI a, URI b) {
        if (a == null || b == null) return false;
        return lower(a.getScheme()).equals(lower(b.getScheme()))
                && lower(a.getRawAuthority()).equals(lower(b.getRawAuthority()));
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}
