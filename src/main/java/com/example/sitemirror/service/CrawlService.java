package com.example.sitemirror.service;

import com.example.sitemirror.config.MirrorProperties;
import com.example.sitemirror.model.CrawlJob;
import com.example.sitemirror.model.CrawlResult;
import com.example.sitemirror.model.PageRecord;
import com.example.sitemirror.model.Platform;
import com.example.sitemirror.model.ScrapeMode;
import com.example.sitemirror.service.strip.BadgeStripper;
import com.example.sitemirror.service.strip.BadgeStrippers;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 抓取入口：发现模式只列出页面，镜像模式把页面与资源写入任务的输出目录。
 * <p>
 * 每次调用自带访问集合与资源缓存，调用之间不共享可变状态。页面按队列顺序逐个抓取，
 * 单个页面内的资源并发下载。页面或资源失败只跳过该单元，记入结果的 errors。
 */
@Service
public class CrawlService {

    private static final Logger log = LoggerFactory.getLogger(CrawlService.class);

    static final int MAX_DISCOVERY_DEPTH = 3;
    static final int MAX_DISCOVERY_LINKS_PER_PAGE = 10;
    static final int MAX_MIRROR_PAGES = 150;
    static final int MAX_SELECTED_PAGES = 25;

    private final HttpFetcher fetcher;
    private final MirrorProperties properties;
    private ExecutorService assetExecutor;
    private HtmlRewriter rewriter;

    @Autowired
    public CrawlService(HttpFetcher fetcher, MirrorProperties properties) {
        this.fetcher = fetcher;
        this.properties = properties;
    }

    CrawlService(HttpFetcher fetcher, Executor assetExecutor) {
        this.fetcher = fetcher;
        this.properties = new MirrorProperties();
        this.rewriter = new HtmlRewriter(assetExecutor);
    }

    @PostConstruct
    public void init() {
        int threads = Math.max(1, properties.getAssetThreads());
        this.assetExecutor = new ThreadPoolExecutor(
                threads, threads,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<Runnable>(1000),
                new ThreadFactory() {
                    private final ThreadFactory df = Executors.defaultThreadFactory();
                    public Thread newThread(Runnable r) {
                        Thread t = df.newThread(r);
                        t.setName("site-asset-" + t.getId());
                        t.setDaemon(true);
                        return t;
                    }
                },
                new ThreadPoolExecutor.AbortPolicy());
        this.rewriter = new HtmlRewriter(assetExecutor);
    }

    @PreDestroy
    public void shutdown() {
        if (assetExecutor != null) assetExecutor.shutdownNow();
    }

    /**
     * 列出站点页面，不写任何文件。深度不超过 3，每个页面最多继续跟进 10 个新链接。
     * 平台值不合法时在任何请求之前抛出 {@link com.example.sitemirror.model.UnsupportedPlatformException}。
     */
    public List<PageRecord> discover(String startUrl, String platform) {
        Platform.fromValue(platform);
        String start = PathMapper.pageKey(CrawlJob.normalizeStartUrl(startUrl));
        log.info("[DISCOVER][START] {} platform={}", start, platform.trim());

        List<PageRecord> pages = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        ArrayDeque<Frontier> queue = new ArrayDeque<>();
        visited.add(start);
        queue.add(new Frontier(start, 0));

        while (!queue.isEmpty()) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("[DISCOVER][INTERRUPTED] {}", start);
                break;
            }
            Frontier current = queue.poll();
            Document doc = fetchDocument(current.url);
            if (doc == null) continue;

            String title = doc.title().trim();
            if (title.isEmpty()) title = PathMapper.pageNameFromUrl(current.url);
            pages.add(new PageRecord(current.url, PathMapper.cleanPath(current.url), title));
            log.info("[DISCOVER][VISIT] depth={} {}", current.depth, current.url);

            if (current.depth >= MAX_DISCOVERY_DEPTH) continue;
            int followed = 0;
            for (String link : HtmlRewriter.collectInternalLinks(doc, doc.location())) {
                if (followed >= MAX_DISCOVERY_LINKS_PER_PAGE) break;
                if (!PathMapper.isLikelyPage(link) || !visited.add(link)) continue;
                queue.add(new Frontier(link, current.depth + 1));
                followed++;
            }
        }
        log.info("[DISCOVER][DONE] {} pages={}", start, pages.size());
        return pages;
    }

    /**
     * 镜像一个站点。配置类错误在构造 {@link CrawlJob} 时已经抛出；选择页面超过 25 个时
     * 返回失败结果而不抛异常；其它页面与资源失败都被吸收并记录。
     */
    public CrawlResult crawl(CrawlJob job) {
        Instant start = Instant.now();
        boolean selection = job.getMode() == ScrapeMode.MULTI_PAGE && job.hasSelection();
        if (selection && job.getSelectedPages().size() > MAX_SELECTED_PAGES) {
            log.warn("[CRAWL][REJECT] {} selected={} max={}", job.getStartUrl(), job.getSelectedPages().size(), MAX_SELECTED_PAGES);
            CrawlResult rejected = CrawlResult.failure("最多只能选择 " + MAX_SELECTED_PAGES + " 个页面，当前为 "
                    + job.getSelectedPages().size() + " 个");
            rejected.setElapsed(Duration.between(start, Instant.now()));
            return rejected;
        }

        Path root = job.getOutputRoot().toAbsolutePath().normalize();
        try {
            Files.createDirectories(root);
        } catch (IOException ex) {
            log.error("[CRAWL][FAIL] 无法创建输出目录 {} -> {}", root, ex.toString());
            CrawlResult failed = CrawlResult.failure("无法创建输出目录: " + root + " -> " + ex.getMessage());
            failed.setElapsed(Duration.between(start, Instant.now()));
            return failed;
        }

        log.info("[CRAWL][START] {}", job);
        CrawlResult result = CrawlResult.success(root.toString());
        URI startUri = PathMapper.safeUri(job.getStartUrl());
        MirrorRun run = new MirrorRun(root,
                new AssetFetcher(fetcher, root, startUri == null ? null : startUri.getHost()),
                BadgeStrippers.forPlatform(job.getPlatform()),
                result);

        if (job.getMode() == ScrapeMode.SINGLE_PAGE) {
            mirrorPage(PathMapper.pageKey(job.getStartUrl()), run);
        } else if (selection) {
            mirrorSelected(job, run);
        } else {
            mirrorSite(job, run);
        }

        result.setAssetsDownloaded(run.assets.getDownloadedCount());
        for (String err : run.assets.getErrors()) {
            result.addError(err);
        }
        if (result.getMessage() == null) {
            result.setMessage("已写出 " + result.getPageCount() + " 个页面，" + result.getAssetsDownloaded() + " 个资源");
        }
        result.setElapsed(Duration.between(start, Instant.now()));
        log.info("[CRAWL][DONE] {} pages={} assets={} errors={} elapsed={}ms", job.getStartUrl(),
                result.getPageCount(), result.getAssetsDownloaded(), result.getErrors().size(),
                result.getElapsed().toMillis());
        return result;
    }

    // 精确抓取所选页面，不再继续发现
    private void mirrorSelected(CrawlJob job, MirrorRun run) {
        Set<String> targets = new LinkedHashSet<>();
        for (String page : job.getSelectedPages()) {
            URI abs = AssetFetcher.absolutize(page, job.getStartUrl());
            if (abs == null) {
                run.result.addError("无效的页面地址: " + page);
                continue;
            }
            targets.add(PathMapper.pageKey(abs.toString()));
        }
        for (String url : targets) {
            if (interrupted(run)) return;
            mirrorPage(url, run);
        }
    }

    // 广度优先遍历全部站内页面；入队即标记为已访问，入队总数不超过 150
    private void mirrorSite(CrawlJob job, MirrorRun run) {
        Set<String> visited = new HashSet<>();
        ArrayDeque<String> frontier = new ArrayDeque<>();
        String start = PathMapper.pageKey(job.getStartUrl());
        visited.add(start);
        frontier.add(start);
        boolean limitLogged = false;

        while (!frontier.isEmpty()) {
            if (interrupted(run)) return;
            RewrittenPage page = mirrorPage(frontier.poll(), run);
            if (page == null) continue;
            for (String link : page.getInternalLinks()) {
                if (visited.size() >= MAX_MIRROR_PAGES) {
                    if (!limitLogged) {
                        log.info("[CRAWL][LIMIT] 已达到 {} 个页面上限，不再入队", MAX_MIRROR_PAGES);
                        limitLogged = true;
                    }
                    break;
                }
                if (!PathMapper.isLikelyPage(link) || !visited.add(link)) continue;
                frontier.add(link);
                log.debug("[CRAWL][ENQUEUE] {}", link);
            }
        }
    }

    private RewrittenPage mirrorPage(String url, MirrorRun run) {
        log.info("[CRAWL][VISIT] {}", url);
        FetchResponse res;
        try {
            res = fetcher.fetch(url, null);
        } catch (IOException ex) {
            log.warn("[PAGE][FAIL] {} -> {}", url, ex.toString());
            run.result.addError(url + " -> " + ex.getMessage());
            return null;
        }
        if (!res.isSuccessful()) {
            log.warn("[PAGE][SKIP-STATUS] {} status={}", url, res.getStatusCode());
            run.result.addError(url + " -> HTTP " + res.getStatusCode());
            return null;
        }

        if (res.getUrl() != null && !res.getUrl().equals(url)) {
            log.info("[PAGE][REDIRECT] {} -> {}", url, res.getUrl());
        }

        RewrittenPage page;
        try {
            page = rewriter.rewrite(res.parseHtml(), url, run.assets, run.stripper);
        } catch (IOException | RuntimeException ex) {
            log.warn("[PAGE][REWRITE-FAIL] {} -> {}", url, ex.toString());
            run.result.addError("页面处理失败: " + url + " -> " + ex.getMessage());
            return null;
        }

        Path target = run.root.resolve(page.getLocalPath()).normalize();
        if (!target.startsWith(run.root)) {
            run.result.addError("页面路径越界: " + url);
            return null;
        }
        try {
            Files.createDirectories(target.getParent());
            // 文件统一以 UTF-8 写出，同步更新页面声明的字符集
            page.getDocument().charset(StandardCharsets.UTF_8);
            Files.write(target, page.html().getBytes(StandardCharsets.UTF_8));
        } catch (IOException ex) {
            log.warn("[PAGE][WRITE-FAIL] {} -> {}", target, ex.toString());
            run.result.addError("页面写入失败: " + url + " -> " + ex.getMessage());
            return null;
        }
        run.result.addPage(new PageRecord(url, page.getLocalPath(), page.getTitle()));
        log.info("[PAGE][SAVE] {} -> {}", url, page.getLocalPath());
        return page;
    }

    private Document fetchDocument(String url) {
        try {
            FetchResponse res = fetcher.fetch(url, null);
            if (!res.isSuccessful()) {
                log.warn("[PAGE][SKIP-STATUS] {} status={}", url, res.getStatusCode());
                return null;
            }
            return res.parseHtml();
        } catch (IOException ex) {
            log.warn("[PAGE][FAIL] {} -> {}", url, ex.toString());
            return null;
        }
    }

    private static boolean interrupted(MirrorRun run) {
        if (!Thread.currentThread().isInterrupted()) return false;
        log.warn("[CRAWL][INTERRUPTED] 任务被中断，已写出 {} 个页面", run.result.getPageCount());
        run.result.setMessage("任务已取消");
        return true;
    }

    private static final class Frontier {
        final String url;
        final int depth;

        Frontier(String url, int depth) {
            this.url = url;
            this.depth = depth;
        }
    }

    // 单次镜像的状态，随调用创建、随调用丢弃
    private static final class MirrorRun {
        final Path root;
        final AssetFetcher assets;
        final BadgeStripper stripper;
        final CrawlResult result;

        MirrorRun(Path root, AssetFetcher assets, BadgeStripper stripper, CrawlResult result) {
            this.root = root;
            this.assets = assets;
            this.stripper = stripper;
            this.result = result;
        }
    }
}
