package com.dochunker.core.crawler;

import com.dochunker.core.util.UrlUtils;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * FIFO 방문 큐 + visited 집합.
 * <ul>
 *   <li>sitemap 모드: 미리 계산된 목록으로 시작, {@link #offer}는 항상 거절(닫힌 frontier)</li>
 *   <li>seed 모드: base URL 하나로 시작, 페이지에서 찾은 링크를 {@link #offer}로 추가</li>
 * </ul>
 * 큐 소비(중복으로 건너뛴 항목 포함) 총량은 maxPages를 넘지 않는다.
 * 같은 정규화 URL은 한 실행에서 두 번 나오지 않는다.
 */
public final class Frontier {

    private final Deque<String> queue = new ArrayDeque<>();
    private final Set<String> visited = new HashSet<>();
    private final Set<String> enqueued = new HashSet<>(); // 한 번이라도 큐에 들어간 URL
    private final int maxPages;
    private final boolean discovering;
    private int consumed;

    private Frontier(int maxPages, boolean discovering) {
        if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
        this.maxPages = maxPages;
        this.discovering = discovering;
    }

    /** sitemap 결과로 만든 닫힌 frontier */
    public static Frontier fixed(Collection<String> urls, int maxPages) {
        Frontier f = new Frontier(maxPages, false);
        for (String u : urls) f.enqueue(u);
        return f;
    }

    /** base 하나로 시작해 링크 발견으로 자라는 frontier */
    public static Frontier seeded(String baseUrl, int maxPages) {
        Frontier f = new Frontier(maxPages, true);
        f.enqueue(baseUrl);
        return f;
    }

    /**
     * 다음 방문 URL. 정규화 후 이미 방문했으면 건너뛰고, 반환하는 URL은 방문 처리한다.
     * 상한에 닿았거나 큐가 비면 empty.
     */
    public Optional<String> next() {
        while (consumed < maxPages && !queue.isEmpty()) {
            String raw = queue.pollFirst();
            consumed++;
            String url = UrlUtils.normalizeOrNull(raw);
            if (url == null) continue;
            if (!visited.add(url)) continue;
            return Optional.of(url);
        }
        return Optional.empty();
    }

    /**
     * 발견 링크 추가. 닫힌 frontier, 정규화 실패, 방문/대기 중복, 상한 초과면 false.
     * 범위 판정은 호출자(ScopeFilter) 몫.
     */
    public boolean offer(String url) {
        if (!discovering) return false;
        if (consumed + queue.size() >= maxPages) return false; // 상한까지만 큐에 둔다
        String n = UrlUtils.normalizeOrNull(url);
        if (n == null || visited.contains(n)) return false;
        return enqueue(n);
    }

    public boolean acceptsDiscoveries() { return discovering; }

    public boolean isVisited(String url) {
        String n = UrlUtils.normalizeOrNull(url);
        return n != null && visited.contains(n);
    }

    /** 지금까지 꺼낸 큐 항목 수 */
    public int consumed() { return consumed; }

    /** 진행률 표시용 전체 추정치: min(소비 + 대기, 상한) */
    public int knownTotal() { return Math.min(consumed + queue.size(), maxPages); }

    private boolean enqueue(String url) {
        if (url == null || !enqueued.add(url)) return false;
        queue.addLast(url);
        return true;
    }
}
