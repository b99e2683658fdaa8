package com.dochunker.core.chunk;

import com.dochunker.core.model.Passage;
import com.dochunker.core.model.Section;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 섹션 목록 → 토큰 범위 안의 패시지 (탐욕적 누적).
 *
 * <ol>
 *   <li>버퍼가 비어 있으면 섹션으로 채우고 다음 섹션으로</li>
 *   <li>버퍼 + 섹션이 maxTokens를 넘으면 버퍼를 내보내고 섹션으로 다시 채움</li>
 *   <li>아니면 빈 줄로 이어 붙임 (경로는 처음 비어 있지 않은 것 유지)</li>
 *   <li>2·3 뒤 버퍼가 minTokens 이상이면 내보내고 비움</li>
 * </ol>
 * 남은 버퍼는 마지막에 내보낸다. 섹션 내부는 절대 자르지 않으므로
 * 섹션 하나가 maxTokens보다 크면 그대로 한 패시지가 된다.
 */
public final class Chunker {

    static final String PATH_SEPARATOR = " > ";

    private final String source;
    private final int minTokens;
    private final int maxTokens;

    public Chunker(String source, int minTokens, int maxTokens) {
        if (minTokens < 1) throw new IllegalArgumentException("minTokens must be >= 1");
        if (maxTokens < minTokens) throw new IllegalArgumentException("maxTokens must be >= minTokens");
        this.source = Objects.requireNonNull(source, "source");
        this.minTokens = minTokens;
        this.maxTokens = maxTokens;
    }

    public List<Passage> chunk(String url, String title, List<Section> sections) {
        List<Passage> out = new ArrayList<>();
        String buf = "";
        String path = "";

        for (Section sec : sections) {
            String secPath = sectionPath(title, sec.heading());
            if (buf.isEmpty()) {
                buf = sec.text();
                path = secPath;
                continue;
            }
            if (TokenEstimator.estimate(buf) + TokenEstimator.estimate(sec.text()) > maxTokens) {
                emit(out, url, title, buf, path);
                buf = sec.text();
                path = secPath;
            } else {
                buf = (buf + "\n\n" + sec.text()).strip();
                if (path.isEmpty()) path = secPath;
            }
            if (TokenEstimator.estimate(buf) >= minTokens) {
                emit(out, url, title, buf, path);
                buf = "";
                path = "";
            }
        }
        emit(out, url, title, buf, path);
        return out;
    }

    /** [제목, 헤딩] 중 비어 있지 않은 것을 " > "로 연결 */
    static String sectionPath(String title, String heading) {
        List<String> parts = new ArrayList<>(2);
        if (title != null && !title.isEmpty()) parts.add(title);
        if (heading != null && !heading.isEmpty()) parts.add(heading);
        return String.join(PATH_SEPARATOR, parts);
    }

    private void emit(List<Passage> out, String url, String title, String text, String path) {
        String t = text.strip();
        if (t.isEmpty()) return;
        out.add(new Passage(PassageIds.of(url, t), t,
                new Passage.Metadata(source, url, title == null ? "" : title, path)));
    }
}
