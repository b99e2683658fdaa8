package com.dochunker.core.extract;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * HTML 조각 → 마크다운 텍스트.
 * <ul>
 *   <li>h1..h6 → ATX 헤딩("#" 개수 = 레벨), 각 헤딩은 한 줄</li>
 *   <li>p/div 등 블록 → 빈 줄로 구분, ul/ol → "* " / "1. ", pre → ``` 펜스</li>
 *   <li>a → [text](href), img → ![alt](src), strong/em/code → ** / * / `</li>
 *   <li>table → 파이프 행 + 헤더 구분선</li>
 * </ul>
 * 결과는 3줄 이상 연속 개행을 빈 줄 하나로 줄이고 앞뒤 공백을 자른다.
 */
public final class HtmlMarkdownConverter {

    private static final Pattern WS = Pattern.compile("[ \\t\\r\\n\\f\\u00A0]+");
    private static final Pattern BLANK_RUN = Pattern.compile("\\n{3,}");
    private static final Pattern TRAILING_WS = Pattern.compile("[ \\t]+\\n");

    private static final Set<String> SKIP = Set.of(
            "script", "style", "noscript", "svg", "template", "head", "title", "meta", "link", "iframe", "button");

    private static final Set<String> BLOCKS = Set.of(
            "p", "div", "section", "article", "main", "header", "footer", "aside", "nav",
            "figure", "figcaption", "body", "html", "dl", "dd", "dt", "center", "form",
            "fieldset", "details", "summary", "address", "caption");

    /** 3개 이상 연속 개행 → 빈 줄 하나, 앞뒤 trim */
    public static String collapseBlankLines(String s) {
        if (s == null) return "";
        return BLANK_RUN.matcher(s).replaceAll("\n\n").strip();
    }

    public String convert(Element root) {
        if (root == null) return "";
        String raw = render(root, 0);
        return collapseBlankLines(TRAILING_WS.matcher(raw).replaceAll("\n"));
    }

    private String children(Node n, int listDepth) {
        StringBuilder sb = new StringBuilder();
        for (Node c : n.childNodes()) sb.append(render(c, listDepth));
        return sb.toString();
    }

    private String render(Node n, int listDepth) {
        if (n instanceof TextNode t) {
            return WS.matcher(t.getWholeText()).replaceAll(" ");
        }
        if (!(n instanceof Element e)) return ""; // 주석, 선언 등

        String tag = e.normalName().toLowerCase(Locale.ROOT);
        if (SKIP.contains(tag)) return "";

        switch (tag) {
            case "h1": case "h2": case "h3": case "h4": case "h5": case "h6": {
                String text = oneLine(children(e, listDepth));
                if (text.isEmpty()) return "";
                int level = tag.charAt(1) - '0';
                return "\n\n" + "#".repeat(level) + " " + text + "\n\n";
            }
            case "br":
                return "\n";
            case "hr":
                return "\n\n---\n\n";
            case "strong": case "b":
                return wrapInline(children(e, listDepth), "**");
            case "em": case "i":
                return wrapInline(children(e, listDepth), "*");
            case "code":
                return wrapInline(e.wholeText(), "`");
            case "pre":
                return "\n\n```\n" + stripTrailingNewlines(e.wholeText()) + "\n```\n\n";
            case "a":
                return link(e, children(e, listDepth));
            case "img": {
                String src = e.attr("src");
                if (src.isBlank()) return "";
                return "![" + e.attr("alt").trim() + "](" + src + ")";
            }
            case "ul": case "ol":
                return "\n\n" + list(e, listDepth, tag.equals("ol")) + "\n\n";
            case "blockquote":
                return "\n\n" + quote(children(e, listDepth)) + "\n\n";
            case "table":
                return "\n\n" + table(e) + "\n\n";
            default:
                if (BLOCKS.contains(tag)) return "\n\n" + children(e, listDepth).strip() + "\n\n";
                return children(e, listDepth);
        }
    }

    private static String oneLine(String s) {
        return WS.matcher(s).replaceAll(" ").strip();
    }

    private static String wrapInline(String text, String mark) {
        String t = oneLine(text);
        return t.isEmpty() ? "" : mark + t + mark;
    }

    private static String stripTrailingNewlines(String s) {
        int end = s.length();
        while (end > 0 && (s.charAt(end - 1) == '\n' || s.charAt(end - 1) == '\r')) end--;
        return s.substring(0, end);
    }

    private static String link(Element a, String inner) {
        String text = oneLine(inner);
        String href = a.attr("href").trim();
        if (text.isEmpty()) return "";
        if (href.isEmpty() || href.startsWith("#") || href.toLowerCase(Locale.ROOT).startsWith("javascript:")) {
            return text;
        }
        if (href.equals(text)) return "<" + href + ">";
        return "[" + text + "](" + href + ")";
    }

    private String list(Element listEl, int depth, boolean ordered) {
        StringBuilder sb = new StringBuilder();
        String indent = "  ".repeat(depth);
        int i = 1;
        for (Element li : listEl.children()) {
            if (!li.normalName().equals("li")) continue;
            String body = collapseBlankLines(children(li, depth + 1));
            if (body.isEmpty()) continue;
            String bullet = ordered ? (i++) + ". " : "* ";
            String[] lines = body.split("\n", -1);
            if (sb.length() > 0) sb.append('\n');
            sb.append(indent).append(bullet).append(lines[0].strip());
            for (int k = 1; k < lines.length; k++) {
                String line = lines[k];
                if (line.isBlank()) continue; // 항목 안에서는 빈 줄 없이 이어 쓴다
                sb.append('\n').append(line.startsWith(indent + "  ") ? line : indent + "  " + line.strip());
            }
        }
        return sb.toString();
    }

    private static String quote(String inner) {
        String body = collapseBlankLines(inner);
        if (body.isEmpty()) return "";
        StringBuilder sb = new StringBuilder();
        for (String line : body.split("\n", -1)) {
            if (sb.length() > 0) sb.append('\n');
            sb.append(line.isBlank() ? ">" : "> " + line);
        }
        return sb.toString();
    }

    private String table(Element table) {
        StringBuilder sb = new StringBuilder();
        boolean headerDone = false;
        for (Element tr : table.select("tr")) {
            if (tr.closest("table") != table) continue; // 중첩 테이블 행 제외
            StringBuilder row = new StringBuilder("|");
            int cells = 0;
            for (Element cell : tr.children()) {
                String name = cell.normalName();
                if (!name.equals("td") && !name.equals("th")) continue;
                row.append(' ').append(oneLine(children(cell, 0)).replace("|", "\\|")).append(" |");
                cells++;
            }
            if (cells == 0) continue;
            if (sb.length() > 0) sb.append('\n');
            sb.append(row);
            if (!headerDone) {
                sb.append('\n').append("|").append(" --- |".repeat(cells));
                headerDone = true;
            }
        }
        return sb.toString();
    }
}
