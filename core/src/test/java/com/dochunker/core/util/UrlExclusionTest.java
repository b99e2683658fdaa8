package com.dochunker.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("UrlExclusion (prefix, contains, glob, regex) on the decoded path")
class UrlExclusionTest {

    private static URI uri(String path) {
        return URI.create("https://docs.example.com" + path);
    }

    @Nested
    @DisplayName("PREFIX rules")
    class PrefixRules {
        @Test
        @DisplayName("'/extensions/' excludes assets under it only")
        void prefix_extensions() {
            var rules = List.of("/extensions/");
            assertTrue(UrlExclusion.isExcluded(uri("/extensions/Player/player.js"), rules));
            assertFalse(UrlExclusion.isExcluded(uri("/extensionsGuide"), rules));
            assertFalse(UrlExclusion.isExcluded(uri("/GenesysCloud/extensions/"), rules));
        }
    }

    @Nested
    @DisplayName("CONTAINS rules")
    class ContainsRules {
        @Test
        @DisplayName("'contains:Special:' matches anywhere in the path, case sensitive")
        void contains_special() {
            var rules = List.of("contains:Special:");
            assertTrue(UrlExclusion.isExcluded(uri("/GenesysCloud/Special:Search"), rules));
            assertTrue(UrlExclusion.isExcluded(uri("/Special:RecentChanges"), rules));
            assertFalse(UrlExclusion.isExcluded(uri("/GenesysCloud/special:search"), rules));
            assertFalse(UrlExclusion.isExcluded(uri("/GenesysCloud/SpecialOffers"), rules));
        }

        @Test
        @DisplayName("percent-encoded colon is decoded before matching")
        void contains_decoded() {
            var rules = List.of("contains:Special:");
            assertTrue(UrlExclusion.isExcluded(uri("/GenesysCloud/Special%3ASearch"), rules));
        }
    }

    @Nested
    @DisplayName("GLOB rules")
    class GlobRules {
        @Test
        @DisplayName("'*.php' matches the whole path")
        void glob_php() {
            var rules = List.of("*.php");
            assertTrue(UrlExclusion.isExcluded(uri("/w/index.php"), rules));
            assertFalse(UrlExclusion.isExcluded(uri("/w/index.php5"), rules));
        }

        @Test
        @DisplayName("'/skins/*' excludes anything below /skins/")
        void glob_skins() {
            var rules = List.of("/skins/*");
            assertTrue(UrlExclusion.isExcluded(uri("/skins/vector/main.css"), rules));
            assertFalse(UrlExclusion.isExcluded(uri("/skinsx/a.css"), rules));
        }
    }

    @Nested
    @DisplayName("REGEX rules")
    class RegexRules {
        @Test
        @DisplayName("'re:' patterns use find semantics")
        void regex_find() {
            var rules = List.of("re:/(Talk|User):");
            assertTrue(UrlExclusion.isExcluded(uri("/GenesysCloud/Talk:Intro"), rules));
            assertTrue(UrlExclusion.isExcluded(uri("/User:Admin"), rules));
            assertFalse(UrlExclusion.isExcluded(uri("/GenesysCloud/Intro"), rules));
        }
    }

    @Test
    void empty_or_null_rules_exclude_nothing() {
        assertFalse(UrlExclusion.isExcluded(uri("/Special:Search"), List.of()));
        assertFalse(UrlExclusion.isExcluded(uri("/Special:Search"), null));
    }
}
