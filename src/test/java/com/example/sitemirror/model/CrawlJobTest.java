package com.example.sitemirror.model;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlJobTest {

    private static final Path OUT = Paths.get("output", "job-1");

    @Nested
    class FromForm {

        @Test
        void builds_job_from_form_values() {
            CrawlJob job = CrawlJob.of("https://example.com/", " Framer ", "single_page", null, OUT);

            assertThat(job.getPlatform()).isEqualTo(Platform.FRAMER);
            assertThat(job.getMode()).isEqualTo(ScrapeMode.SINGLE_PAGE);
            assertThat(job.hasSelection()).isFalse();
            assertThat(job.getOutputRoot()).isEqualTo(OUT);
        }

        @Test
        void blank_mode_defaults_to_multi_page() {
            assertThat(CrawlJob.of("https://example.com/", "general", "", null, OUT).getMode())
                    .isEqualTo(ScrapeMode.MULTI_PAGE);
        }

        @Test
        void unknown_platform_is_a_configuration_error() {
            assertThatThrownBy(() -> CrawlJob.of("https://example.com/", "geocities", "multi_page", null, OUT))
                    .isInstanceOf(UnsupportedPlatformException.class)
                    .isInstanceOf(CrawlConfigurationException.class)
                    .hasMessage("Unsupported site type: geocities");
        }

        @Test
        void unknown_mode_is_a_configuration_error() {
            assertThatThrownBy(() -> CrawlJob.of("https://example.com/", "general", "everything", null, OUT))
                    .isInstanceOf(CrawlConfigurationException.class);
        }
    }

    @Nested
    class StartUrl {

        @Test
        void missing_scheme_defaults_to_https() {
            assertThat(CrawlJob.multiPage("example.com/shop", Platform.SHOPIFY, OUT).getStartUrl())
                    .isEqualTo("https://example.com/shop");
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "ftp://example.com/", "https://exa mple.com"})
        void invalid_start_url_is_rejected(String url) {
            assertThatThrownBy(() -> CrawlJob.multiPage(url, Platform.GENERAL, OUT))
                    .isInstanceOf(CrawlConfigurationException.class);
        }

        @Test
        void missing_output_root_is_rejected() {
            assertThatThrownBy(() -> CrawlJob.singlePage("https://example.com/", Platform.GENERAL, null))
                    .isInstanceOf(CrawlConfigurationException.class);
        }
    }

    @Test
    void selection_drops_blank_entries_and_keeps_order() {
        CrawlJob job = CrawlJob.selectedPages("https://example.com/", Platform.GENERAL,
                Arrays.asList("https://example.com/b", " ", null, "https://example.com/a", "https://example.com/b"), OUT);

        assertThat(job.getSelectedPages()).containsExactly("https://example.com/b", "https://example.com/a");
        assertThat(job.hasSelection()).isTrue();
    }

    @Test
    void platform_lookup_is_case_insensitive_and_trimmed() {
        assertThat(Platform.fromValue("  SquareSpace ")).isEqualTo(Platform.SQUARESPACE);
        assertThat(Platform.fromValue("general")).isEqualTo(Platform.GENERAL);
        assertThatThrownBy(() -> Platform.fromValue(null)).isInstanceOf(UnsupportedPlatformException.class);
    }
}
