package com.dochunker.core.http;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.net.CookieManager;
import java.net.HttpCookie;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NetscapeCookieLoaderTest {

    private static final String FILE = String.join("\n",
            "# Netscape HTTP Cookie File",
            "",
            ".docs.example.com\tTRUE\t/\tTRUE\t1999999999\tsession\tabc123",
            "#HttpOnly_docs.example.com\tFALSE\t/GenesysCloud\tFALSE\t0\tauth\txyz",
            "docs.example.com\tTRUE\t/\tFALSE\t0\tshort",
            "docs.example.com\tTRUE\t/\tFALSE\t0\tbad name\tv",
            "   ");

    @Test
    void valid_lines_load_and_malformed_lines_are_skipped() throws IOException {
        CookieManager jar = NetscapeCookieLoader.load(new StringReader(FILE));

        List<HttpCookie> cookies = jar.getCookieStore().getCookies();
        assertThat(cookies).extracting(HttpCookie::getName).containsExactlyInAnyOrder("session", "auth");
    }

    @Test
    void fields_map_onto_cookie_attributes() throws IOException {
        CookieManager jar = NetscapeCookieLoader.load(new StringReader(FILE));

        HttpCookie session = find(jar, "session");
        assertThat(session.getValue()).isEqualTo("abc123");
        assertThat(session.getDomain()).isEqualTo(".docs.example.com");
        assertThat(session.getPath()).isEqualTo("/");
        assertThat(session.getSecure()).isTrue();
        assertThat(session.isHttpOnly()).isFalse();

        HttpCookie auth = find(jar, "auth");
        assertThat(auth.getDomain()).isEqualTo("docs.example.com");
        assertThat(auth.getPath()).isEqualTo("/GenesysCloud");
        assertThat(auth.getSecure()).isFalse();
        assertThat(auth.isHttpOnly()).isTrue();
    }

    @Test
    void cookies_are_sent_for_dotted_domains_and_for_localhost() throws IOException {
        String file = FILE + "\n" + String.join("\n",
                "localhost\tFALSE\t/\tFALSE\t0\tsid\tlocal1",
                "#HttpOnly_.localhost\tTRUE\t/docs\tFALSE\t0\tlauth\tlocal2");
        CookieManager jar = NetscapeCookieLoader.load(new StringReader(file));

        Map<String, List<String>> local = jar.get(URI.create("http://localhost:8080/docs/Routing"), Map.of());
        assertThat(local.get("Cookie")).containsExactlyInAnyOrder("sid=local1", "lauth=local2");

        Map<String, List<String>> docs = jar.get(URI.create("https://docs.example.com/GenesysCloud/Routing"), Map.of());
        assertThat(docs.get("Cookie")).containsExactlyInAnyOrder("session=abc123", "auth=xyz");

        assertThat(find(jar, "sid").getDomain()).isNull();
    }

    @Test
    void parseLine_rejects_short_lines() {
        assertThat(NetscapeCookieLoader.parseLine("a\tb\tc", false)).isNull();
    }

    @Test
    void loads_from_file_and_missing_file_is_an_error(@TempDir Path dir) throws IOException {
        Path f = dir.resolve("cookies.txt");
        Files.writeString(f, FILE, StandardCharsets.UTF_8);
        assertThat(NetscapeCookieLoader.load(f).getCookieStore().getCookies()).hasSize(2);

        assertThatThrownBy(() -> NetscapeCookieLoader.load(dir.resolve("nope.txt")))
                .isInstanceOf(NoSuchFileException.class);
    }

    private static HttpCookie find(CookieManager jar, String name) {
        return jar.getCookieStore().getCookies().stream()
                .filter(c -> c.getName().equals(name)).findFirst().orElseThrow();
    }
}
