package com.dochunker.core.extract;

import com.dochunker.core.model.CrawlConfig;
import com.dochunker.core.model.ExtractedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * 원본 HTML → (제목, 마크다운 본문).
 *
 * <p>시도 체인을 순서대로 돌며 본문 길이가 {@code fallbackThresholdChars} 이상인 첫 결과에서 멈춘다.
 * 아무 시도도 임계값에 못 미치면 마지막 시도의 본문을 쓴다.
 * 제목은 첫 시도(휴리스틱)에서만 정해지고 폴백이 다시 만들지 않는다.
 */
public final class ContentExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(ContentExtractor.class);

    private final List<BodyExtractionStrategy> chain;
    private final int fallbackThresholdChars;

    /** 기본 체인: readability → 컨테이너 폴백 */
    public ContentExtractor(CrawlConfig cfg) {
        this(List.of(new ReadabilityStrategy(), new ContainerFallbackStrategy(cfg.getFallbackSelectors())),
                cfg.getFallbackThresholdChars());
    }

    public ContentExtractor(List<BodyExtractionStrategy> chain, int fallbackThresholdChars) {
        Objects.requireNonNull(chain, "chain");
        if (chain.isEmpty()) throw new IllegalArgumentException("extraction chain must not be empty");
        this.chain = List.copyOf(chain);
        this.fallbackThresholdChars = Math.max(0, fallbackThresholdChars);
    }

    public ExtractedDocument extract(String html) {
        String title = null;
        String body = "";
        for (BodyExtractionStrategy s : chain) {
            ExtractionAttempt a;
            try {
                a = s.attempt(html);
            } catch (RuntimeException e) {
                // 파서 예외는 빈 본문으로 간주하고 다음 시도로
                LOG.debug("extraction attempt {} failed: {}", s.name(), e.toString());
                a = ExtractionAttempt.bodyOnly("");
            }
            if (title == null) title = (a.getTitle() == null) ? "" : a.getTitle();
            body = HtmlMarkdownConverter.collapseBlankLines(a.getMarkdown());
            if (body.length() >= fallbackThresholdChars) {
                LOG.debug("extraction settled on {} chars={}", s.name(), body.length());
                break;
            }
        }
        return new ExtractedDocument(title, body);
    }
}
