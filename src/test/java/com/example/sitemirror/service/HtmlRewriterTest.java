package com.example.sitemirror.service;

import com.example.sitemirror.fixture.FakeHttpFetcher;
import com.example.sitemirror.model.Platform;
import com.example.sitemirror.service.strip.BadgeStrippers;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlRewriterTest {

    private static final String PAGE = "https://example.com/blog/post-1";
    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G'};

    private static final String HTML = "<html><head><title> Post One </title>"
            + "<link rel=\"stylesheet\" href=\"/css/site.css\">"
            + "<link rel=\"icon\" href=\"/favicon.ico\">"
            + "<style>body{background:url(/img/bg.png)}</style>"
            + "</head><body>"
            + "<a id=\"home\" href=\"https://example.com/\">Home</a>"
            + "<a id=\"about\" href=\"/about#team\">About</a>"
            + "<a id=\"next\" href=\"post-2\">Next</a>"
            + "<a id=\"ext\" href=\"https://other.com/x\">Other</a>"
            + "<a id=\"mail\" href=\"mailto:hi@example.com\">Mail</a>"
            + "<a id=\"top\" href=\"#top\">Top</a>"
            + "<img id=\"hero\" src=\"/img/hero.png\" srcset=\"/img/hero.png 1x, /img/hero@2x.png 2x\">"
            + "<script id=\"lib\" src=\"//cdn.example.net/lib.js\"></script>"
            + "<div id=\"styled\" style=\"background-image: url('/img/bg.png')\"></div>"
            + "<img id=\"broken\" src=\"/img/missing.png\">"
            + "</body></html>";

    @TempDir
    Path outputRoot;

    private FakeHttpFetcher http;
    private AssetFetcher assets;

    @BeforeEach
    void setUp() {
        http = new FakeHttpFetcher()
                .css("https://example.com/css/site.css", "body{color:red}")
                .binary("https://example.com/img/bg.png", "image/png", PNG)
                .binary("https://example.com/img/hero.png", "image/png", PNG)
                .binary("https://example.com/img/hero@2x.png", "image/png", PNG)
                .binary("https://cdn.example.net/lib.js", "application/javascript", "x()".getBytes(StandardCharsets.UTF_8));
        assets = new AssetFetcher(http, outputRoot, "example.com");
    }

    private static Document parse(String html, String url) {
        return Jsoup.parse(html, url);
    }

    private RewrittenPage rewrite() {
        return new HtmlRewriter(Runnable::run).rewrite(parse(HTML, PAGE), PAGE, assets, BadgeStrippers.forPlatform(Platform.GENERAL));
    }

    @Nested
    class Hyperlinks {

        @Test
        void same_host_links_become_relative_to_page() {
            Document doc = rewrite().getDocument();

            assertThat(doc.getElementById("home").attr("href")).isEqualTo("../index.html");
            assertThat(doc.getElementById("about").attr("href")).isEqualTo("../about.html#team");
        }

        @Test
        void relative_external_and_special_links_are_untouched() {
            Document doc = rewrite().getDocument();

            assertThat(doc.getElementById("next").attr("href")).isEqualTo("post-2");
            assertThat(doc.getElementById("ext").attr("href")).isEqualTo("https://other.com/x");
            assertThat(doc.getElementById("mail").attr("href")).isEqualTo("mailto:hi@example.com");
            assertThat(doc.getElementById("top").attr("href")).isEqualTo("#top");
        }

        @Test
        void reports_internal_links_in_document_order() {
            RewrittenPage page = rewrite();

            assertThat(page.getInternalLinks()).containsExactly(
                    "https://example.com/",
                    "https://example.com/about",
                    "https://example.com/blog/post-2");
        }

        @Test
        void reports_trimmed_title_and_clean_path() {
            RewrittenPage page = rewrite();

            assertThat(page.getTitle()).isEqualTo("Post One");
            assertThat(page.getLocalPath()).isEqualTo("blog/post-1.html");
        }

        @Test
        void same_host_document_links_point_back_to_origin() {
            Document doc = new HtmlRewriter(Runnable::run)
                    .rewrite(parse("<a id=\"pdf\" href=\"/files/brochure.pdf\">PDF</a>"
                                    + "<a id=\"zip\" href=\"https://example.com/dl/site.zip#v2\">ZIP</a>", PAGE),
                            PAGE, assets, BadgeStrippers.forPlatform(Platform.GENERAL))
                    .getDocument();

            assertThat(doc.getElementById("pdf").attr("href")).isEqualTo("https://example.com/files/brochure.pdf");
            assertThat(doc.getElementById("zip").attr("href")).isEqualTo("https://example.com/dl/site.zip#v2");
            assertThat(http.requested()).isEmpty();
        }

        @Test
        void relative_references_resolve_against_final_address() {
            String requested = "https://example.com/docs";
            http.binary("https://example.com/docs/intro.png", "image/png", PNG);

            RewrittenPage page = new HtmlRewriter(Runnable::run)
                    .rewrite(parse("<img id=\"intro\" src=\"intro.png\"><a href=\"guide\">Guide</a>",
                                    "https://example.com/docs/"),
                            requested, assets, BadgeStrippers.forPlatform(Platform.GENERAL));

            assertThat(page.getLocalPath()).isEqualTo("docs.html");
            assertThat(page.getDocument().getElementById("intro").attr("src")).isEqualTo("docs/intro.png");
            assertThat(page.getInternalLinks()).containsExactly("https://example.com/docs/guide");
        }

        @Test
        void missing_title_falls_back_to_url_name() {
            RewrittenPage page = new HtmlRewriter(Runnable::run).rewrite(parse("<p>hi</p>", "https://example.com/our-team"),
                    "https://example.com/our-team", assets, BadgeStrippers.forPlatform(Platform.GENERAL));

            assertThat(page.getTitle()).isEqualTo("Our Team");
        }
    }

    @Nested
    class Assets {

        @Test
        void asset_references_point_at_local_copies() {
            Document doc = rewrite().getDocument();

            assertThat(doc.selectFirst("link[rel=stylesheet]").attr("href")).isEqualTo("../css/site.css");
            assertThat(doc.getElementById("hero").attr("src")).isEqualTo("../img/hero.png");
            assertThat(doc.getElementById("hero").attr("srcset")).isEqualTo("../img/hero.png 1x, ../img/hero@2x.png 2x");
            assertThat(doc.getElementById("lib").attr("src")).isEqualTo("../cdn.example.net/lib.js");
            assertThat(doc.getElementById("styled").attr("style")).contains("url('../img/bg.png')");
            assertThat(doc.selectFirst("style").data()).isEqualTo("body{background:url('../img/bg.png')}");
        }

        @Test
        void video_and_audio_sources_are_downloaded() {
            http.binary("https://example.com/media/clip.mp4", "video/mp4", PNG)
                    .binary("https://example.com/media/poster.jpg", "image/jpeg", PNG)
                    .binary("https://example.com/media/clip.webm", "video/webm", PNG)
                    .binary("https://example.com/media/a.mp3", "audio/mpeg", PNG);
            String html = "<video id=\"clip\" src=\"/media/clip.mp4\" poster=\"https://example.com/media/poster.jpg\">"
                    + "<source id=\"webm\" src=\"/media/clip.webm\"></video>"
                    + "<audio id=\"sound\" src=\"/media/a.mp3\"></audio>";

            Document doc = new HtmlRewriter(Runnable::run)
                    .rewrite(parse(html, PAGE), PAGE, assets, BadgeStrippers.forPlatform(Platform.GENERAL))
                    .getDocument();

            assertThat(doc.getElementById("clip").attr("src")).isEqualTo("../media/clip.mp4");
            assertThat(doc.getElementById("clip").attr("poster")).isEqualTo("../media/poster.jpg");
            assertThat(doc.getElementById("webm").attr("src")).isEqualTo("../media/clip.webm");
            assertThat(doc.getElementById("sound").attr("src")).isEqualTo("../media/a.mp3");
            assertThat(assets.getDownloadedCount()).isEqualTo(4);
        }

        @Test
        void failed_assets_keep_original_reference() {
            Document doc = rewrite().getDocument();

            assertThat(doc.getElementById("broken").attr("src")).isEqualTo("/img/missing.png");
            assertThat(doc.selectFirst("link[rel=icon]").attr("href")).isEqualTo("/favicon.ico");
        }

        @Test
        void repeated_references_are_fetched_once() {
            rewrite();

            assertThat(http.timesRequested("https://example.com/img/bg.png")).isEqualTo(1);
            assertThat(http.hasDuplicateRequests()).isFalse();
        }

        @Test
        void downloads_run_on_the_asset_executor() {
            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                Document doc = new HtmlRewriter(pool)
                        .rewrite(parse(HTML, PAGE), PAGE, assets, BadgeStrippers.forPlatform(Platform.GENERAL))
                        .getDocument();

                assertThat(doc.getElementById("hero").attr("src")).isEqualTo("../img/hero.png");
                assertThat(assets.getDownloadedCount()).isEqualTo(5);
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    class Ordering {

        @Test
        void stripper_sees_fully_rewritten_document() {
            AtomicReference<String> seen = new AtomicReference<>();

            new HtmlRewriter(Runnable::run).rewrite(parse(HTML, PAGE), PAGE, assets, doc -> {
                seen.set(doc.getElementById("hero").attr("src"));
                return doc;
            });

            assertThat(seen.get()).isEqualTo("../img/hero.png");
        }

        @Test
        void injected_badge_css_is_left_as_written() {
            Document doc = new HtmlRewriter(Runnable::run)
                    .rewrite(parse(HTML, PAGE), PAGE, assets, BadgeStrippers.forPlatform(Platform.FRAMER))
                    .getDocument();

            assertThat(doc.head().select("style").last().data())
                    .contains("#__framer-badge-container { display: none !important; }");
        }
    }

    @Test
    void textual_pass_collapses_only_exact_same_origin() {
        String html = "<a href=\"https://example.com/x\">https://example.com</a> "
                + "https://example.com.evil.org/ http://EXAMPLE.com?q";

        assertThat(HtmlRewriter.collapseSameOrigin(html, PAGE))
                .isEqualTo("<a href=\"/x\">/</a> https://example.com.evil.org/ /?q");
    }

    @Test
    void srcset_urls_ignore_descriptors_and_data_uris() {
        assertThat(HtmlRewriter.srcsetUrls("a.png 1x, b.png 480w")).containsExactly("a.png", "b.png");
        assertThat(HtmlRewriter.srcsetUrls("data:image/png;base64,AAA 1x")).isEmpty();
    }
}
