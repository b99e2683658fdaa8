package com.dochunker.core.crawler;

import com.dochunker.core.util.UrlExclusion;
import com.dochunker.core.util.UrlUtils;

import java.net.URI;
import java.util.List;
import java.util.Objects;

/**
 * 크롤 범위 판정: same-origin(base 기준) + 경로 제외 규칙.
 * 문자열 URL을 받는 경우 파싱 실패는 범위 밖으로 본다.
 */
public final class ScopeFilter {

    private final URI base;
    private final List<String> excludePaths;

    public ScopeFilter(URI base, List<String> excludePaths) {
        this.base = Objects.requireNonNull(base, "base");
        this.excludePaths = (excludePaths == null) ? List.of() : List.copyOf(excludePaths);
    }

    /** scheme + host 일치 */
    public static boolean inScope(URI url, URI base) {
        return UrlUtils.sameOrigin(url, base);
    }

    public static boolean inScope(String url, String base) {
        try {
            return inScope(URI.create(url), URI.create(base));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public boolean inScope(URI url) {
        return inScope(url, base);
    }

    /** 제외 패턴에 걸리지 않으면 true */
    public boolean isAllowedPath(URI url) {
        return !UrlExclusion.isExcluded(url, excludePaths);
    }

    /** 범위 안 + 허용 경로 */
    public boolean accepts(URI url) {
        return url != null && inScope(url) && isAllowedPath(url);
    }

    public boolean accepts(String url) {
        try {
            return accepts(URI.create(url));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
