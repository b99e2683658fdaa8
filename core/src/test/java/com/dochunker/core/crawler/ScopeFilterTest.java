package com.dochunker.core.crawler;

import com.dochunker.core.model.CrawlConfig;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScopeFilterTest {

    private static final String BASE = "https://all.docs.genesys.com/GenesysCloud/";

    private final ScopeFilter filter =
            new ScopeFilter(URI.create(BASE), CrawlConfig.DEFAULT_EXCLUDE_PATHS);

    @Test
    void same_origin_is_in_scope_even_outside_base_path() {
        assertThat(ScopeFilter.inScope("https://all.docs.genesys.com/GenesysCloud/Intro", BASE)).isTrue();
        assertThat(ScopeFilter.inScope("https://all.docs.genesys.com/PureConnect/Intro", BASE)).isTrue();
        assertThat(ScopeFilter.inScope("https://ALL.DOCS.genesys.com/x", BASE)).isTrue();
    }

    @Test
    void other_scheme_host_or_port_is_out_of_scope() {
        assertThat(ScopeFilter.inScope("http://all.docs.genesys.com/GenesysCloud/Intro", BASE)).isFalse();
        assertThat(ScopeFilter.inScope("https://help.mypurecloud.com/x", BASE)).isFalse();
        assertThat(ScopeFilter.inScope("https://all.docs.genesys.com:8443/x", BASE)).isFalse();
        assertThat(ScopeFilter.inScope("not a url", BASE)).isFalse();
    }

    @Test
    void default_exclusions_reject_special_pages_and_extension_assets() {
        assertThat(filter.isAllowedPath(URI.create("https://all.docs.genesys.com/GenesysCloud/Special:Search"))).isFalse();
        assertThat(filter.isAllowedPath(URI.create("https://all.docs.genesys.com/extensions/Foo/foo.js"))).isFalse();
        assertThat(filter.isAllowedPath(URI.create("https://all.docs.genesys.com/GenesysCloud/Intro"))).isTrue();
    }

    @Test
    void accepts_combines_scope_and_path_rules() {
        assertThat(filter.accepts("https://all.docs.genesys.com/GenesysCloud/Routing")).isTrue();
        assertThat(filter.accepts("https://all.docs.genesys.com/GenesysCloud/Special:Random")).isFalse();
        assertThat(filter.accepts("https://example.org/GenesysCloud/Routing")).isFalse();
        assertThat(filter.accepts("::bad::")).isFalse();
    }

    @Test
    void custom_patterns_replace_defaults() {
        ScopeFilter f = new ScopeFilter(URI.create(BASE), List.of("re:/Talk:"));
        assertThat(f.accepts("https://all.docs.genesys.com/GenesysCloud/Special:Search")).isTrue();
        assertThat(f.accepts("https://all.docs.genesys.com/GenesysCloud/Talk:Intro")).isFalse();
    }
}
