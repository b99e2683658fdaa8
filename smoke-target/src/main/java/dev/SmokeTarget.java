package dev;

import com.sun.net.httpserver.*;

import java.io.*;
import java.net.*;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Executors;

/**
 * 수동 스모크용 로컬 문서 사이트.
 *
 *   java dev.SmokeTarget [port] [--sitemap]
 *
 * --sitemap 이면 /sitemap_index.xml → 자식 sitemap 2개를 내주고,
 * 아니면 sitemap 없이 링크 탐색(seed 모드)으로만 도달 가능하다.
 * 위키형 포털(본문 짧음 → 컨테이너 폴백), 일반 기사형, 제외 경로, 비HTML, 404 페이지를 포함한다.
 */
public class SmokeTarget {

  static void add(HttpServer s, String path, HttpHandler h) { s.createContext(path, h); }

  public static void main(String[] args) throws Exception {
    int port = 8080;
    boolean sitemap = false;
    for (String a : args) {
      if ("--sitemap".equals(a)) sitemap = true;
      else port = Integer.parseInt(a);
    }

    HttpServer http = HttpServer.create(new InetSocketAddress(port), 0);
    wireEndpoints(http, sitemap);
    http.setExecutor(Executors.newFixedThreadPool(4));
    http.start();
    System.out.println("[DC] docs site on http://localhost:" + port + "/docs/" + (sitemap ? " (sitemap on)" : ""));
  }

  // 공통 엔드포인트 배선
  static void wireEndpoints(HttpServer s, boolean withSitemap) {
    String origin = "http://localhost:" + s.getAddress().getPort();

    if (withSitemap) {
      add(s, "/sitemap_index.xml", ex -> resp(ex, 200, "application/xml",
          "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
          + "<sitemapindex xmlns=\"http://www.sitemaps.org/schemas/sitemap/0.9\">"
          + "<sitemap><loc>" + origin + "/sitemaps/articles.xml</loc></sitemap>"
          + "<sitemap><loc>" + origin + "/sitemaps/portals.xml</loc></sitemap>"
          + "</sitemapindex>"));
      add(s, "/sitemaps/articles.xml", ex -> resp(ex, 200, "application/xml",
          urlset(origin + "/docs/Getting_Started", origin + "/docs/Routing", origin + "/docs/Special:Search")));
      add(s, "/sitemaps/portals.xml", ex -> resp(ex, 200, "application/xml",
          urlset(origin + "/docs/Portal", origin + "/docs/")));
    }

    // 나머지는 전부 404 (sitemap.xml 포함)
    add(s, "/", ex -> resp(ex, 404, "text/html", "<html><body><h1>Not found</h1></body></html>"));

    add(s, "/docs/", ex -> {
      String path = ex.getRequestURI().getPath();
      String page = path.substring("/docs/".length());
      switch (page) {
        case "":
          resp(ex, 200, "text/html", article("Docs home",
              "<p>Welcome to the local documentation site. Start with the guides below, or open the portal "
              + "to browse every area of the product. Each guide is written as a long article so that the "
              + "chunker has several sections to work with.</p>"
              + "<ul><li><a href=\"Getting_Started\">Getting started</a></li>"
              + "<li><a href=\"Routing#overview\">Routing</a></li>"
              + "<li><a href=\"Portal\">Portal</a></li>"
              + "<li><a href=\"Special:Search\">Search</a></li>"
              + "<li><a href=\"/extensions/player.js\">Player script</a></li>"
              + "<li><a href=\"data.json\">Raw data</a></li>"
              + "<li><a href=\"Missing\">Missing page</a></li>"
              + "<li><a href=\"https://example.org/elsewhere\">Another site</a></li></ul>"));
          break;
        case "Getting_Started":
          resp(ex, 200, "text/html", article("Getting started",
              section("Install", 6) + section("Configure", 8) + section("First run", 5)
              + "<p><a href=\"Routing\">Next: Routing</a></p>"));
          break;
        case "Routing":
          resp(ex, 200, "text/html", article("Routing",
              section("Overview", 4) + section("Queues", 9) + section("Skills", 3) + section("Fallback rules", 7)));
          break;
        case "Portal":
          resp(ex, 200, "text/html", portal());
          break;
        case "Special:Search":
          resp(ex, 200, "text/html", article("Search", "<p>Search results are not documentation.</p>"));
          break;
        case "data.json":
          resp(ex, 200, "application/json", "{\"not\":\"html\"}");
          break;
        default:
          resp(ex, 404, "text/html", "<html><body><h1>Not found</h1></body></html>");
      }
    });

    add(s, "/extensions/", ex -> resp(ex, 200, "application/javascript", "console.log('asset');"));
  }

  static String urlset(String... locs) {
    StringBuilder sb = new StringBuilder("<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
        + "<urlset xmlns=\"http://www.sitemaps.org/schemas/sitemap/0.9\">");
    for (String l : locs) sb.append("<url><loc>").append(l).append("</loc></url>");
    return sb.append("</urlset>").toString();
  }

  static String article(String title, String body) {
    return "<html><head><title>" + title + " | Local Docs</title>"
        + "<style>body{font-family:sans-serif}</style></head><body>"
        + "<div id=\"header\"><a href=\"/docs/\">Home</a> <a href=\"/docs/Portal\">Portal</a></div>"
        + "<main><div class=\"article-content\"><h1>" + title + "</h1>" + body + "</div></main>"
        + "<div id=\"footer\">Local Docs footer</div>"
        + "<script>var tracking = true;</script></body></html>";
  }

  static String section(String heading, int paragraphs) {
    StringBuilder sb = new StringBuilder("<h2>" + heading + "</h2>");
    for (int i = 1; i <= paragraphs; i++) {
      sb.append("<p>").append(heading).append(" paragraph ").append(i)
        .append(": this step explains the settings involved, the order in which they apply, ")
        .append("and what an administrator should verify before moving on to the next part of the guide.</p>");
    }
    return sb.toString();
  }

  // MediaWiki 포털: 링크 목록 위주라 휴리스틱 본문이 짧다
  static String portal() {
    StringBuilder items = new StringBuilder();
    String[] areas = {"Getting_Started", "Routing", "Reporting", "Telephony", "Integrations", "Security"};
    for (String a : areas) {
      items.append("<li><a href=\"/docs/").append(a).append("\">").append(a.replace('_', ' '))
           .append("</a> guides, reference tables and release notes for ").append(a.replace('_', ' '))
           .append("</li>");
    }
    return "<html><head><title>Portal - Local Docs</title></head><body>"
        + "<div id=\"mw-navigation\"><a href=\"/docs/\">Main page</a></div>"
        + "<div id=\"content\"><h1 id=\"firstHeading\">Portal</h1>"
        + "<div id=\"mw-content-text\"><div class=\"mw-parser-output\">"
        + "<h2>Browse by area</h2><ul>" + items + "</ul>"
        + "<h2>Other resources</h2><ul><li><a href=\"/docs/Special:Search\">Search the docs</a></li></ul>"
        + "</div></div></div>"
        + "<div id=\"catlinks\">Categories: Portals</div></body></html>";
  }

  static void resp(HttpExchange ex, int code, String ct, String body) throws IOException {
    byte[] b = body.getBytes(StandardCharsets.UTF_8);
    ex.getResponseHeaders().set("Content-Type", ct + "; charset=utf-8");
    ex.sendResponseHeaders(code, b.length);
    try (OutputStream os = ex.getResponseBody()) { os.write(b); }
  }
}
