package com.example.sitemirror.service;

import com.example.sitemirror.model.AssetRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 单个任务内的资源下载器（样式表、脚本、图片、字体）。
 * <p>
 * 按绝对 URL 去重且单飞：同一 URL 的并发请求共享一次下载，失败结果同样被记住，任务内不再重试。
 * 下载失败时软失败，返回原始引用，不中断页面处理。实例随任务创建、随任务丢弃。
 */
public class AssetFetcher {

    private static final Logger log = LoggerFactory.getLogger(AssetFetcher.class);

    // 正则：匹配 CSS 文本中的 url(...) 模式
    static final Pattern CSS_URL_PATTERN = Pattern.compile("url\\(\\s*(['\"]?)([^)'\"]+)\\1\\s*\\)", Pattern.CASE_INSENSITIVE);

    private final HttpFetcher fetcher;
    private final Path outputRoot;
    private final String siteHost;

    private final Map<String, CompletableFuture<Optional<AssetRecord>>> cache = new ConcurrentHashMap<>();
    private final AtomicInteger downloaded = new AtomicInteger();
    private final List<String> errors = Collections.synchronizedList(new ArrayList<>());

    public AssetFetcher(HttpFetcher fetcher, Path outputRoot, String siteHost) {
        this.fetcher = fetcher;
        this.outputRoot = outputRoot;
        this.siteHost = siteHost;
    }

    /**
     * 下载资源并返回其相对输出根目录的本地路径；失败时原样返回 url。
     */
    public String fetchAsset(String url, String baseUrl) {
        return resolve(url, baseUrl).map(AssetRecord::getLocalPath).orElse(url);
    }

    public Optional<AssetRecord> resolve(String url, String baseUrl) {
        return resolve(url, baseUrl, true);
    }

    private Optional<AssetRecord> resolve(String url, String baseUrl, boolean processCss) {
        URI abs = absolutize(url, baseUrl);
        if (abs == null) return Optional.empty();
        String key = abs.toString();

        CompletableFuture<Optional<AssetRecord>> mine = new CompletableFuture<>();
        CompletableFuture<Optional<AssetRecord>> existing = cache.putIfAbsent(key, mine);
        if (existing != null) {
            log.debug("[ASSET][SKIP-DUP] {}", key);
            return existing.join();
        }
        try {
            mine.complete(download(abs, baseUrl, processCss));
        } catch (RuntimeException ex) {
            log.warn("[ASSET][FAIL] {} -> {}", key, ex.toString());
            errors.add("资源处理失败: " + key + " -> " + ex.getMessage());
            mine.complete(Optional.empty());
        }
        return mine.join();
    }

    private Optional<AssetRecord> download(URI abs, String referer, boolean processCss) {
        String key = abs.toString();
        FetchResponse res;
        try {
            res = fetcher.fetch(key, referer);
        } catch (IOException ex) {
            log.warn("[ASSET][FAIL] {} -> {}", key, ex.toString());
            errors.add("资源下载失败: " + key + " -> " + ex.getMessage());
            return Optional.empty();
        }
        if (!res.isSuccessful()) {
            log.warn("[ASSET][SKIP-STATUS] {} status={}", key, res.getStatusCode());
            errors.add("资源下载失败: " + key + " -> HTTP " + res.getStatusCode());
            return Optional.empty();
        }

        String localPath = PathMapper.assetPath(abs, siteHost);
        Path target = outputRoot.resolve(localPath).normalize();
        if (!target.startsWith(outputRoot.normalize())) {
            errors.add("资源路径越界: " + key);
            return Optional.empty();
        }
        try {
            Files.createDirectories(target.getParent());
            if (processCss && isStylesheet(abs, res)) {
                String css = rewriteStylesheet(res.bodyAsString(), key, localPath);
                Files.write(target, css.getBytes(StandardCharsets.UTF_8));
            } else {
                Files.write(target, res.getBody());
            }
        } catch (IOException ex) {
            log.warn("[ASSET][WRITE-FAIL] {} -> {}", target, ex.toString());
            errors.add("资源写入失败: " + key + " -> " + ex.getMessage());
            return Optional.empty();
        }
        downloaded.incrementAndGet();
        log.debug("[ASSET][SAVE] {} -> {}", key, localPath);
        return Optional.of(new AssetRecord(key, localPath));
    }

    // 样式表中的字体、图片按样式表自身的位置下载并改写为相对路径；嵌套的样式表引用保持不变
    private String rewriteStylesheet(String css, String cssUrl, String cssLocalPath) {
        return rewriteCssUrls(css, raw -> {
            URI nested = absolutize(raw, cssUrl);
            if (nested == null || nested.getPath() == null
                    || nested.getPath().toLowerCase(Locale.ROOT).endsWith(".css")) {
                return raw;
            }
            return resolve(raw, cssUrl, false)
                    .map(r -> PathMapper.relativeLink(cssLocalPath, r.getLocalPath()))
                    .orElse(raw);
        });
    }

    /**
     * 替换 CSS 文本中的 url(...) 引用。mapping 返回原值或 null 时保留原文。data: 地址不处理。
     */
    static String rewriteCssUrls(String css, UnaryOperator<String> mapping) {
        if (css == null || css.isEmpty()) return css;
        Matcher m = CSS_URL_PATTERN.matcher(css);
        StringBuffer sb = new StringBuffer();
        while (m.find()) {
            String raw = m.group(2).trim();
            String replacement = m.group();
            if (!raw.isEmpty() && !raw.toLowerCase(Locale.ROOT).startsWith("data:")) {
                String mapped = mapping.apply(raw);
                if (mapped != null && !mapped.equals(raw)) {
                    replacement = "url('" + mapped + "')";
                }
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * 协议相对（//host/...）与根相对（/path）地址按当前页面的源补全，其它相对地址按页面 URL 解析。
     * data: 与非 http(s) 地址返回 null。
     */
    static URI absolutize(String url, String baseUrl) {
        if (url == null) return null;
        String raw = url.trim();
        if (raw.isEmpty() || raw.startsWith("#")) return null;
        String lower = raw.toLowerCase(Locale.ROOT);
        if (lower.startsWith("data:") || lower.startsWith("javascript:")
                || lower.startsWith("mailto:") || lower.startsWith("blob:")) {
            return null;
        }
        URI base = PathMapper.safeUri(baseUrl);
        URI abs;
        if (raw.startsWith("//")) {
            String scheme = base == null || base.getScheme() == null ? "https" : base.getScheme();
            abs = PathMapper.safeUri(scheme + ":" + raw);
        } else if (raw.startsWith("/")) {
            if (base == null || base.getHost() == null) return null;
            abs = PathMapper.safeUri(base.getScheme() + "://" + base.getRawAuthority() + raw);
        } else if (lower.startsWith("http://") || lower.startsWith("https://")) {
            abs = PathMapper.safeUri(raw);
        } else {
            if (base == null) return null;
            if (base.getHost() != null && (base.getRawPath() == null || base.getRawPath().isEmpty())) {
                // https://host 与相对路径直接拼接会丢失分隔符
                base = PathMapper.safeUri(base.getScheme() + "://" + base.getRawAuthority() + "/");
                if (base == null) return null;
            }
            try {
                abs = base.resolve(raw);
            } catch (IllegalArgumentException ex) {
                return null;
            }
        }
        if (abs == null || abs.getHost() == null || abs.getScheme() == null) return null;
        String scheme = abs.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) return null;
        String s = abs.toString();
        int hash = s.indexOf('#');
        return hash >= 0 ? PathMapper.safeUri(s.substring(0, hash)) : abs;
    }

    private static boolean isStylesheet(URI abs, FetchResponse res) {
        if (res.isCss()) return true;
        String path = abs.getPath();
        return path != null && path.toLowerCase(Locale.ROOT).endsWith(".css");
    }

    public int getDownloadedCount() {
        return downloaded.get();
    }

    public List<String> getErrors() {
        synchronized (errors) {
            return new ArrayList<>(errors);
        }
    }
}
