package com.dochunker.core.extract;

import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HtmlMarkdownConverterTest {

    private final HtmlMarkdownConverter conv = new HtmlMarkdownConverter();

    private String md(String bodyHtml) {
        return conv.convert(Jsoup.parseBodyFragment(bodyHtml).body());
    }

    @Test
    void headings_become_atx_lines_separated_by_blank_lines() {
        assertEquals("## Intro\n\nHello **world**", md("<h2>Intro</h2><p>Hello <b>world</b></p>"));
        assertEquals("# One\n\n###### Six", md("<h1> One </h1><h6>Six</h6>"));
    }

    @Test
    void lists_are_bulleted_or_numbered() {
        assertEquals("* One\n* Two", md("<ul><li>One</li><li>Two</li></ul>"));
        assertEquals("1. A\n2. B", md("<ol><li>A</li><li>B</li></ol>"));
    }

    @Test
    void nested_list_is_indented() {
        assertEquals("* Top\n  * Inner", md("<ul><li>Top<ul><li>Inner</li></ul></li></ul>"));
    }

    @Test
    void inline_markup_and_links() {
        assertEquals("See [the docs](/x) and *this* `code`",
                md("<p>See <a href=\"/x\">the docs</a> and <em>this</em> <code>code</code></p>"));
        assertEquals("anchor only", md("<p><a href=\"#frag\">anchor only</a></p>"));
        assertEquals("![diagram](/img/d.png)", md("<p><img src=\"/img/d.png\" alt=\"diagram\"></p>"));
    }

    @Test
    void pre_becomes_fenced_block_preserving_indentation() {
        assertEquals("```\na\n  b\n```", md("<pre>a\n  b\n</pre>"));
    }

    @Test
    void tables_get_header_separator() {
        assertEquals("| K | V |\n| --- | --- |\n| a | b |",
                md("<table><tr><th>K</th><th>V</th></tr><tr><td>a</td><td>b</td></tr></table>"));
    }

    @Test
    void blockquote_and_rule() {
        assertEquals("> quoted\n\n---\n\nafter", md("<blockquote><p>quoted</p></blockquote><hr><p>after</p>"));
    }

    @Test
    void scripts_and_styles_are_dropped() {
        assertEquals("Visible", md("<p>Visible</p><script>var x = 1;</script><style>p{}</style><noscript>n</noscript>"));
    }

    @Test
    void collapse_reduces_runs_of_newlines_and_trims() {
        assertEquals("a\n\nb", HtmlMarkdownConverter.collapseBlankLines("\n\na\n\n\n\nb\n\n\n"));
        assertEquals("a\n\nb", HtmlMarkdownConverter.collapseBlankLines("a\n\n\nb"));
        assertEquals("", HtmlMarkdownConverter.collapseBlankLines(null));
    }
}
