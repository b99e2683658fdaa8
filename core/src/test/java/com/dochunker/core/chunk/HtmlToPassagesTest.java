package com.dochunker.core.chunk;

import com.dochunker.core.extract.ContentExtractor;
import com.dochunker.core.model.CrawlConfig;
import com.dochunker.core.model.ExtractedDocument;
import com.dochunker.core.model.Passage;
import com.dochunker.core.model.Section;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/** HTML 한 장을 추출 → 섹션 → 청크까지 통과시킨다 */
class HtmlToPassagesTest {

    private static final String URL = "https://docs.example.com/GenesysCloud/Routing_Guide";

    @Test
    void three_headings_of_100_400_500_tokens_give_two_passages() {
        String html = "<html><head><title>Routing Guide</title></head><body>"
                + "<div id=\"content\">"
                + "<h2>One</h2><p>" + "a".repeat(390) + "</p>"
                + "<h2>Two</h2><p>" + "b".repeat(1590) + "</p>"
                + "<h2>Three</h2><p>" + "c".repeat(1990) + "</p>"
                + "</div></body></html>";
        CrawlConfig cfg = CrawlConfig.defaults();

        ExtractedDocument doc = new ContentExtractor(cfg).extract(html);
        List<Section> sections = new SectionSplitter().split(doc.getBody());

        assertThat(doc.getTitle()).isEqualTo("Routing Guide");
        assertThat(sections).extracting(Section::heading).containsExactly("One", "Two", "Three");
        assertThat(sections).extracting(s -> TokenEstimator.estimate(s.text())).containsExactly(99, 399, 500);

        List<Passage> out = new Chunker(cfg.getSource(), cfg.getMinTokens(), cfg.getMaxTokens())
                .chunk(URL, doc.getTitle(), sections);

        assertThat(out).hasSize(2);
        assertThat(out.get(0).getText()).isEqualTo(
                "## One\n\n" + "a".repeat(390) + "\n\n## Two\n\n" + "b".repeat(1590));
        assertThat(out.get(0).getMetadata().getSectionPath()).isEqualTo("Routing Guide > One");
        assertThat(out.get(1).getText()).isEqualTo("## Three\n\n" + "c".repeat(1990));
        assertThat(out.get(1).getMetadata().getSectionPath()).isEqualTo("Routing Guide > Three");
        assertThat(out).extracting(p -> p.getMetadata().getUrl()).containsOnly(URL);
    }
}
