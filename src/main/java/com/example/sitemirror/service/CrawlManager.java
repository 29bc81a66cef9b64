package com.example.sitemirror.service;

import com.example.sitemirror.config.MirrorProperties;
import com.example.sitemirror.model.CrawlJob;
import com.example.sitemirror.model.CrawlRequest;
import com.example.sitemirror.model.CrawlResult;
import com.example.sitemirror.model.CrawlTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.UUID;
import java.util.concurrent.*;

/**
 * 后台任务执行器：把表单请求转换为任务并在有界线程池中运行，按 id 跟踪状态。
 */
@Service
public class CrawlManager {

    private static final Logger log = LoggerFactory.getLogger(CrawlManager.class);

    private final CrawlService crawlService;
    private final MirrorProperties properties;
    private ExecutorService executor;
    private final ConcurrentHashMap<String, CrawlTask> tasks = new ConcurrentHashMap<String, CrawlTask>();
    private final ConcurrentHashMap<String, Future<?>> futures = new ConcurrentHashMap<String, Future<?>>();

    public CrawlManager(CrawlService crawlService, MirrorProperties properties) {
        this.crawlService = crawlService;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        int threads = properties.getJobThreads() > 0
                ? properties.getJobThreads()
                : Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
        this.executor = new ThreadPoolExecutor(
                threads, threads,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<Runnable>(100),
                new ThreadFactory() {
                    private final ThreadFactory df = Executors.defaultThreadFactory();
                    public Thread newThread(Runnable r) {
                        Thread t = df.newThread(r);
                        t.setName("site-crawler-" + t.getId());
                        t.setDaemon(true);
                        return t;
                    }
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    @PreDestroy
    public void shutdown() {
        if (executor != null) executor.shutdownNow();
    }

    /**
     * 校验请求并排队执行。平台、模式或起始地址不合法时直接抛出
     * {@link com.example.sitemirror.model.CrawlConfigurationException}，不会创建任务。
     */
    public CrawlTask submit(CrawlRequest request) {
        final String id = UUID.randomUUID().toString();
        CrawlJob job = CrawlJob.of(request.getStartUrl(), request.getSiteType(), request.getScrapeMode(),
                request.getSelectedPages(), outputRootFor(id));
        final CrawlTask task = new CrawlTask(id, job);
        tasks.put(id, task);

        Future<?> f;
        try {
            f = executor.submit(new Runnable() {
                public void run() {
                    task.setStatus(CrawlTask.Status.RUNNING);
                    task.setStartTime(Instant.now());
                    task.setThreadName(Thread.currentThread().getName());
                    try {
                        CrawlResult result = crawlService.crawl(task.getJob());
                        task.setResult(result);
                        if (isCancelled(id)) {
                            task.setStatus(CrawlTask.Status.CANCELLED);
                        } else if (result.isSuccess()) {
                            task.setStatus(CrawlTask.Status.SUCCEEDED);
                        } else {
                            task.setErrorMessage(result.getMessage());
                            task.setStatus(CrawlTask.Status.FAILED);
                        }
                    } catch (RuntimeException ex) {
                        log.error("[TASK][FAIL] {} -> {}", id, ex.toString(), ex);
                        task.setErrorMessage(ex.getMessage());
                        task.setStatus(CrawlTask.Status.FAILED);
                    } finally {
                        task.setEndTime(Instant.now());
                    }
                }
            });
        } catch (RejectedExecutionException ex) {
            tasks.remove(id);
            throw ex;
        }
        futures.put(id, f);
        log.info("[TASK][SUBMIT] {} {}", id, job);
        return task;
    }

    public boolean cancel(String id) {
        Future<?> f = futures.get(id);
        CrawlTask t = tasks.get(id);
        if (f == null || t == null || t.isDone()) return false;
        boolean ok = f.cancel(true);
        if (ok) {
            t.setStatus(CrawlTask.Status.CANCELLED);
            if (t.getEndTime() == null) t.setEndTime(Instant.now());
            log.info("[TASK][CANCEL] {}", id);
        }
        return ok;
    }

    // FutureTask 在中断线程之前已经进入取消状态
    private boolean isCancelled(String id) {
        Future<?> f = futures.get(id);
        return f != null && f.isCancelled();
    }

    public CrawlTask get(String id) {
        return tasks.get(id);
    }

    public Collection<CrawlTask> list() {
        return Collections.unmodifiableCollection(tasks.values());
    }

    // 每个任务独占 <output-base-dir>/<任务 id>
    public Path outputRootFor(String taskId) {
        return Paths.get(properties.resolvedOutputBaseDir()).resolve(taskId);
    }
}
