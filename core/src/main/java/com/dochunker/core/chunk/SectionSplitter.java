package com.dochunker.core.chunk;

import com.dochunker.core.model.Section;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 마크다운 본문 → 헤딩 기준 섹션 목록.
 * ATX 헤딩 줄(#~######)이 새 섹션을 시작하고, 헤딩 줄 자체도 섹션 본문에 포함된다.
 * 첫 헤딩 이전 내용은 heading=""인 서문 섹션. 빈 섹션은 버린다.
 */
public final class SectionSplitter {

    static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.*)\\s*$");

    public List<Section> split(String markdown) {
        List<Section> out = new ArrayList<>();
        if (markdown == null || markdown.isEmpty()) return out;

        String heading = "";
        List<String> lines = new ArrayList<>();
        for (String line : markdown.split("\n", -1)) {
            Matcher m = HEADING.matcher(line);
            if (m.matches()) {
                emit(out, heading, lines);
                heading = m.group(2).strip();
                lines = new ArrayList<>();
            }
            lines.add(line);
        }
        emit(out, heading, lines);
        return out;
    }

    private static void emit(List<Section> out, String heading, List<String> lines) {
        if (lines.isEmpty()) return;
        String text = String.join("\n", lines).strip();
        if (!text.isEmpty()) out.add(new Section(heading, text));
    }
}
