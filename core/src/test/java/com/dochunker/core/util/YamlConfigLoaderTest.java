package com.dochunker.core.util;

import com.dochunker.core.model.CrawlConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlConfigLoaderTest {

    @Test
    void all_sections_map_onto_config(@TempDir Path dir) throws IOException {
        Path yml = dir.resolve("crawl.yml");
        Files.writeString(yml, String.join("\n",
                "base: \"https://docs.example.com/Guide/\"",
                "out: \"out/chunks.jsonl\"",
                "source: ExampleDocs",
                "delaySeconds: 0.25",
                "maxPages: 42",
                "userAgent: \"Bot/9\"",
                "timeoutMs: 1500",
                "followRedirects: false",
                "auth:",
                "  cookies: cookies.txt",
                "  cookieHeader: \"a=b\"",
                "chunking:",
                "  minTokens: 100",
                "  maxTokens: 400",
                "extraction:",
                "  minContentChars: 50",
                "  fallbackThresholdChars: 300",
                "  fallbackSelectors: [\"article\", \"body\"]",
                "scope:",
                "  excludePaths: [\"re:/Talk:\", \"/assets/\"]",
                ""), StandardCharsets.UTF_8);

        CrawlConfig c = YamlConfigLoader.load(yml);

        assertThat(c.getBaseUrl()).isEqualTo("https://docs.example.com/Guide/");
        assertThat(c.getOutput()).isEqualTo(Path.of("out/chunks.jsonl"));
        assertThat(c.getSource()).isEqualTo("ExampleDocs");
        assertThat(c.getDelay()).isEqualTo(Duration.ofMillis(250));
        assertThat(c.getMaxPages()).isEqualTo(42);
        assertThat(c.getUserAgent()).isEqualTo("Bot/9");
        assertThat(c.getTimeoutMs()).isEqualTo(1500L);
        assertThat(c.isFollowRedirects()).isFalse();
        assertThat(c.getCookiesFile()).isEqualTo(Path.of("cookies.txt"));
        assertThat(c.getCookieHeader()).isEqualTo("a=b");
        assertThat(c.getMinTokens()).isEqualTo(100);
        assertThat(c.getMaxTokens()).isEqualTo(400);
        assertThat(c.getMinContentChars()).isEqualTo(50);
        assertThat(c.getFallbackThresholdChars()).isEqualTo(300);
        assertThat(c.getFallbackSelectors()).containsExactly("article", "body");
        assertThat(c.getExcludePaths()).containsExactly("re:/Talk:", "/assets/");
        c.validate();
    }

    @Test
    void missing_keys_keep_existing_values(@TempDir Path dir) throws IOException {
        Path yml = dir.resolve("crawl.yml");
        Files.writeString(yml, "maxPages: 7\nscope:\n  excludePaths: []\n", StandardCharsets.UTF_8);

        CrawlConfig base = CrawlConfig.defaults().setSource("Preset").setMinTokens(10).setMaxTokens(20);
        CrawlConfig c = YamlConfigLoader.load(yml, base);

        assertThat(c).isSameAs(base);
        assertThat(c.getMaxPages()).isEqualTo(7);
        assertThat(c.getSource()).isEqualTo("Preset");
        assertThat(c.getMinTokens()).isEqualTo(10);
        assertThat(c.getExcludePaths()).isEmpty();
    }

    @Test
    void empty_file_changes_nothing(@TempDir Path dir) throws IOException {
        Path yml = dir.resolve("empty.yml");
        Files.writeString(yml, "", StandardCharsets.UTF_8);
        assertThat(YamlConfigLoader.load(yml).getMaxPages()).isEqualTo(5000);
    }

    @Test
    void missing_file_is_an_io_error(@TempDir Path dir) {
        assertThatThrownBy(() -> YamlConfigLoader.load(dir.resolve("none.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("config not found");
    }
}
