package com.example.sitemirror.service;

import com.example.sitemirror.config.MirrorProperties;
import com.example.sitemirror.model.CrawlConfigurationException;
import com.example.sitemirror.model.CrawlJob;
import com.example.sitemirror.model.CrawlRequest;
import com.example.sitemirror.model.CrawlResult;
import com.example.sitemirror.model.CrawlTask;
import com.example.sitemirror.model.Platform;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CrawlManagerTest {

    @Mock
    CrawlService crawlService;

    @TempDir
    Path baseDir;

    private MirrorProperties properties;
    private CrawlManager manager;

    @BeforeEach
    void setUp() {
        properties = new MirrorProperties();
        properties.setOutputBaseDir(baseDir.toString());
        properties.setJobThreads(2);
        manager = new CrawlManager(crawlService, properties);
        manager.init();
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    private static CrawlRequest request(String siteType, String mode, String... selected) {
        CrawlRequest r = new CrawlRequest();
        r.setStartUrl("https://example.com/");
        r.setSiteType(siteType);
        r.setScrapeMode(mode);
        r.setSelectedPages(Arrays.asList(selected));
        return r;
    }

    private static void awaitDone(CrawlTask task) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!(task.isDone() && task.getEndTime() != null) && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(task.isDone()).as("task %s finished", task.getId()).isTrue();
        assertThat(task.getEndTime()).isNotNull();
    }

    @Test
    void successful_crawl_marks_task_succeeded() throws Exception {
        when(crawlService.crawl(any(CrawlJob.class))).thenReturn(CrawlResult.success("out"));

        CrawlTask task = manager.submit(request("Framer", "multi_page", "https://example.com/about"));
        awaitDone(task);

        assertThat(task.getStatus()).isEqualTo(CrawlTask.Status.SUCCEEDED);
        assertThat(task.getStartTime()).isNotNull();
        assertThat(task.getEndTime()).isNotNull();
        assertThat(task.getThreadName()).startsWith("site-crawler-");
        assertThat(task.getJob().getPlatform()).isEqualTo(Platform.FRAMER);
        assertThat(task.getJob().getSelectedPages()).containsExactly("https://example.com/about");
        assertThat(task.getJob().getOutputRoot()).isEqualTo(baseDir.resolve(task.getId()));
        assertThat(manager.get(task.getId())).isSameAs(task);
        assertThat(manager.list()).containsExactly(task);
    }

    @Test
    void structured_failure_marks_task_failed() throws Exception {
        when(crawlService.crawl(any(CrawlJob.class))).thenReturn(CrawlResult.failure("too many pages"));

        CrawlTask task = manager.submit(request("general", "multi_page"));
        awaitDone(task);

        assertThat(task.getStatus()).isEqualTo(CrawlTask.Status.FAILED);
        assertThat(task.getErrorMessage()).isEqualTo("too many pages");
    }

    @Test
    void unexpected_exception_marks_task_failed() throws Exception {
        when(crawlService.crawl(any(CrawlJob.class))).thenThrow(new IllegalStateException("boom"));

        CrawlTask task = manager.submit(request("general", "single_page"));
        awaitDone(task);

        assertThat(task.getStatus()).isEqualTo(CrawlTask.Status.FAILED);
        assertThat(task.getErrorMessage()).isEqualTo("boom");
    }

    @Test
    void invalid_request_is_rejected_before_queueing() {
        assertThatThrownBy(() -> manager.submit(request("geocities", "multi_page")))
                .isInstanceOf(CrawlConfigurationException.class);

        assertThat(manager.list()).isEmpty();
        verify(crawlService, never()).crawl(any());
    }

    @Test
    void cancel_interrupts_running_job() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        when(crawlService.crawl(any(CrawlJob.class))).thenAnswer(inv -> {
            started.countDown();
            try {
                new CountDownLatch(1).await();
            } catch (InterruptedException ex) {
                interrupted.countDown();
            }
            return CrawlResult.failure("任务已取消");
        });

        CrawlTask task = manager.submit(request("general", "multi_page"));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(manager.cancel(task.getId())).isTrue();
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(task.getStatus()).isEqualTo(CrawlTask.Status.CANCELLED);
        assertThat(task.getEndTime()).isNotNull();
    }

    @Test
    void unknown_task_cannot_be_cancelled() {
        assertThat(manager.cancel("missing")).isFalse();
        assertThat(manager.get("missing")).isNull();
    }

    @Test
    void output_root_tolerates_quoted_base_dir() {
        properties.setOutputBaseDir("'mirrors'");

        assertThat(manager.outputRootFor("abc")).isEqualTo(Paths.get("mirrors", "abc"));
    }
}
