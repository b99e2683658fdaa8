package com.dochunker.core.extract;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * readability 계열 본문 추정기.
 *
 * <p>문단(p/pre/td, 블록 자식이 없는 div)마다 길이와 쉼표 수로 점수를 매겨 부모(전체)와
 * 조부모(절반)에 누적하고, class/id 가중치와 링크 밀도로 보정한 최고점 컨테이너를 본문으로
 * 고른다. 최고점 후보의 형제 중 점수가 충분하거나 링크가 적은 긴 문단은 함께 포함한다.
 *
 * <p>제목은 {@code <title>} 안에 든 가장 긴 헤딩, 없으면 네 단어 이상인 쪽으로 구분자(" | ", " - " 등)에서
 * 자른 값. 결과가 15자 이하이거나 150자 이상이면 원래 제목을 그대로 쓴다.
 */
public final class ReadabilityExtractor {

    /** 추출 결과: 짧은 제목 + 본문 HTML 조각(원본과 분리된 사본) */
    public static final class Result {
        public final String title;
        public final Element content;

        Result(String title, Element content) {
            this.title = title;
            this.content = content;
        }
    }

    private static final Pattern UNLIKELY = Pattern.compile(
            "combx|comment|community|disqus|extra|foot|header|menu|remark|rss|shoutbox|sidebar|sponsor"
                    + "|ad-break|agegate|pagination|pager|popup|tweet|twitter|navbox|catlinks|printfooter",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern MAYBE = Pattern.compile(
            "and|article|body|column|main|shadow|content", Pattern.CASE_INSENSITIVE);
    private static final Pattern POSITIVE = Pattern.compile(
            "article|body|content|entry|hentry|main|page|pagination|post|text|blog|story",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern NEGATIVE = Pattern.compile(
            "combx|comment|com-|contact|foot|footer|footnote|masthead|media|meta|outbrain|promo|related"
                    + "|scroll|shoutbox|sidebar|sponsor|shopping|tags|tool|widget|nav",
            Pattern.CASE_INSENSITIVE);

    private static final Set<String> BLOCK_CHILDREN = Set.of(
            "a", "blockquote", "dl", "div", "img", "ol", "p", "pre", "table", "ul");

    private static final String[] TITLE_DELIMITERS = {" | ", " - ", " :: ", " / "};
    private static final String[] TITLE_SELECTORS = {
            "#title", "#head", "#heading", ".pageTitle", ".news_title", ".title", ".head", ".heading",
            ".contentheading", ".small_header_red"};
    private static final Pattern WS = Pattern.compile("\\s+");

    private static final int MIN_PARAGRAPH_CHARS = 25;

    public Result extract(String html) {
        Document doc = Jsoup.parse(html == null ? "" : html);
        String title = shortTitle(doc);

        doc.select("script, style, noscript, link, meta").remove();
        removeUnlikelyCandidates(doc);

        Map<Element, Double> scores = scoreParagraphs(doc);
        Element best = null;
        double bestScore = 0;
        for (Map.Entry<Element, Double> e : scores.entrySet()) {
            double s = e.getValue() * (1.0 - linkDensity(e.getKey()));
            e.setValue(s);
            if (best == null || s > bestScore) {
                best = e.getKey();
                bestScore = s;
            }
        }

        Element content = new Element("div");
        if (best == null) {
            // 점수 매길 문단이 없음 → body 전체 (폴백 판단은 호출자가 길이로)
            Element body = doc.body();
            if (body != null) content.appendChild(body.clone());
            return new Result(title, content);
        }

        Element parent = best.parent();
        if (parent == null || parent == doc) {
            content.appendChild(best.clone());
            return new Result(title, content);
        }
        double threshold = Math.max(10.0, bestScore * 0.2);
        for (Element sibling : parent.children()) {
            if (sibling == best || includeSibling(sibling, scores, threshold)) {
                content.appendChild(sibling.clone());
            }
        }
        return new Result(title, content);
    }

    // ---------------- title ----------------

    static String shortTitle(Document doc) {
        Element titleEl = doc.selectFirst("title");
        if (titleEl == null) return "";
        String orig = normTitle(titleEl.text());
        if (orig.isEmpty()) return "";

        // 헤딩/제목 블록 중 <title> 안에 그대로 들어 있는 가장 긴 텍스트
        String best = null;
        for (Element h : doc.select("h1, h2, h3")) {
            best = longerMatch(best, h.ownText(), orig);
            best = longerMatch(best, h.text(), orig);
        }
        for (String css : TITLE_SELECTORS) {
            for (Element e : doc.select(css)) {
                best = longerMatch(best, e.ownText(), orig);
                best = longerMatch(best, e.text(), orig);
            }
        }

        String title = orig;
        if (best != null) {
            title = best;
        } else {
            boolean cut = false;
            for (String delim : TITLE_DELIMITERS) {
                if (!orig.contains(delim)) continue;
                String[] parts = orig.split(Pattern.quote(delim), -1);
                if (wordCount(parts[0]) >= 4) { title = parts[0]; cut = true; break; }
                if (wordCount(parts[parts.length - 1]) >= 4) { title = parts[parts.length - 1]; cut = true; break; }
            }
            // 양쪽 다 짧으면 구분자로 자르지 않는다. "Area: Page name" 형태만 한 번 더 본다
            if (!cut && orig.contains(": ")) {
                String[] parts = orig.split(": ", -1);
                String last = parts[parts.length - 1];
                title = (wordCount(last) >= 4) ? last : orig.substring(orig.indexOf(": ") + 2);
            }
        }

        int len = title.codePointCount(0, title.length());
        return (len > 15 && len < 150) ? title : orig;
    }

    private static String longerMatch(String current, String text, String orig) {
        String t = normTitle(text);
        if (wordCount(t) < 2 || t.codePointCount(0, t.length()) < 15) return current;
        if (!orig.replace("\"", "").contains(t.replace("\"", ""))) return current;
        return (current == null || t.length() > current.length()) ? t : current;
    }

    /** 공백 정리 + 대시/따옴표 통일 */
    private static String normTitle(String s) {
        if (s == null) return "";
        String t = s.replace('\u2014', '-').replace('\u2013', '-')
                .replace('\u00AB', '"').replace('\u00BB', '"').replace('\u00A0', ' ');
        return WS.matcher(t).replaceAll(" ").trim();
    }

    private static int wordCount(String s) {
        String t = s.trim();
        return t.isEmpty() ? 0 : t.split("\\s+").length;
    }

    // ---------------- scoring ----------------

    private static void removeUnlikelyCandidates(Document doc) {
        List<Element> doomed = new ArrayList<>();
        for (Element e : doc.getAllElements()) {
            String tag = e.normalName();
            if (tag.equals("html") || tag.equals("body")) continue;
            String cid = e.className() + " " + e.id();
            if (cid.isBlank()) continue;
            if (UNLIKELY.matcher(cid).find() && !MAYBE.matcher(cid).find()) doomed.add(e);
        }
        for (Element e : doomed) {
            if (e.parent() != null) e.remove();
        }
    }

    private static Map<Element, Double> scoreParagraphs(Document doc) {
        Map<Element, Double> scores = new LinkedHashMap<>();
        for (Element el : candidates(doc)) {
            Element parent = el.parent();
            if (parent == null) continue;
            String text = el.text().trim();
            if (text.length() < MIN_PARAGRAPH_CHARS) continue;

            Element grand = parent.parent();
            scores.computeIfAbsent(parent, ReadabilityExtractor::initialScore);
            if (grand != null) scores.computeIfAbsent(grand, ReadabilityExtractor::initialScore);

            double score = 1.0 + commas(text) + Math.min(text.length() / 100, 3);
            scores.merge(parent, score, Double::sum);
            if (grand != null) scores.merge(grand, score / 2.0, Double::sum);
        }
        return scores;
    }

    private static List<Element> candidates(Document doc) {
        List<Element> out = new ArrayList<>(doc.select("p, pre, td"));
        for (Element div : doc.select("div")) {
            boolean hasBlock = false;
            for (Element c : div.children()) {
                if (BLOCK_CHILDREN.contains(c.normalName())) { hasBlock = true; break; }
            }
            if (!hasBlock) out.add(div);
        }
        return out;
    }

    private static int commas(String text) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) if (text.charAt(i) == ',') n++;
        return n;
    }

    private static double initialScore(Element e) {
        double s;
        switch (e.normalName()) {
            case "div": s = 5; break;
            case "pre": case "td": case "blockquote": s = 3; break;
            case "address": case "ol": case "ul": case "dl": case "dd": case "dt": case "li": case "form":
                s = -3; break;
            case "h1": case "h2": case "h3": case "h4": case "h5": case "h6": case "th":
                s = -5; break;
            default: s = 0;
        }
        return s + classWeight(e);
    }

    private static double classWeight(Element e) {
        double w = 0;
        for (String attr : new String[]{e.className(), e.id()}) {
            if (attr == null || attr.isBlank()) continue;
            if (NEGATIVE.matcher(attr).find()) w -= 25;
            if (POSITIVE.matcher(attr).find()) w += 25;
        }
        return w;
    }

    static double linkDensity(Element e) {
        int total = e.text().length();
        if (total == 0) return 0;
        int links = 0;
        Elements as = e.select("a");
        for (Element a : as) links += a.text().length();
        return Math.min(1.0, (double) links / total);
    }

    private static boolean includeSibling(Element sibling, Map<Element, Double> scores, double threshold) {
        Double s = scores.get(sibling);
        if (s != null && s >= threshold) return true;
        if (!sibling.normalName().equals("p")) return false;
        String text = sibling.text().trim();
        double ld = linkDensity(sibling);
        if (text.length() > 80 && ld < 0.25) return true;
        return text.length() <= 80 && ld == 0 && text.toLowerCase(Locale.ROOT).matches(".*\\.( |$).*");
    }
}
