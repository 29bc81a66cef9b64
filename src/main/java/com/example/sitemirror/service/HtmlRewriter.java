package com.example.sitemirror.service;

import com.example.sitemirror.model.AssetRecord;
import com.example.sitemirror.service.strip.BadgeStripper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.regex.Pattern;

/**
 * 页面改写：把站内链接与资源引用改为输出目录内的相对路径，最后交给平台徽标处理器。
 * <p>
 * 步骤顺序固定：文本预处理、解析 DOM、改写超链接、下载并替换资源、去除徽标。
 * 徽标处理必须最后执行，注入的隐藏样式不能再被改写。
 */
public class HtmlRewriter {

    private static final Logger log = LoggerFactory.getLogger(HtmlRewriter.class);

    private static final String ASSET_ATTR_SELECTOR =
            "link[href], script[src], img[src], img[srcset], source[src], source[srcset], "
            + "video[src], video[poster], audio[src]";

    private static final String[] URL_ATTRS = {"href", "src", "poster"};

    private final Executor assetExecutor;

    public HtmlRewriter(Executor assetExecutor) {
        this.assetExecutor = assetExecutor;
    }

    /**
     * 改写一个已解析的页面。{@code pageUrl} 是请求地址，决定本地路径；
     * 相对引用按文档的最终地址（重定向之后）解析。
     */
    public RewrittenPage rewrite(Document source, String pageUrl, AssetFetcher assets, BadgeStripper stripper) {
        String pagePath = PathMapper.cleanPath(pageUrl);
        String baseUrl = source.location() == null || source.location().isEmpty() ? pageUrl : source.location();

        // 1) 尽力而为：页面文本中出现的同源绝对地址先折叠为根相对地址，DOM 改写才是权威步骤
        source.outputSettings().prettyPrint(false);
        String normalized = collapseSameOrigin(source.outerHtml(), baseUrl);

        // 2) 宽松解析
        Document doc = Jsoup.parse(normalized, baseUrl);
        String title = doc.title() == null ? "" : doc.title().trim();
        if (title.isEmpty()) title = PathMapper.pageNameFromUrl(pageUrl);
        List<String> internalLinks = collectInternalLinks(doc, baseUrl);
        internalLinks.remove(PathMapper.pageKey(pageUrl));

        // 3) 超链接
        int links = rewriteLinks(doc, baseUrl, pagePath);

        // 4) 资源
        int rewrittenAssets = rewriteAssets(doc, baseUrl, pagePath, assets);

        // 5) 徽标
        stripper.stripBadge(doc);

        log.debug("[REWRITE][DONE] {} links={} assets={}", pageUrl, links, rewrittenAssets);
        return new RewrittenPage(pageUrl, pagePath, title, doc, internalLinks);
    }

    static String collapseSameOrigin(String html, String pageUrl) {
        URI page = PathMapper.safeUri(pageUrl);
        if (html == null || page == null || page.getRawAuthority() == null) return html;
        Pattern sameOrigin = Pattern.compile(
                "(?i)https?://" + Pattern.quote(page.getRawAuthority()) + "(?:/|(?=[\"'\\s?#)<>]|$))");
        return sameOrigin.matcher(html).replaceAll("/");
    }

    // 页面中的站内链接，按 DOM 顺序，去掉 query 与 fragment，排除页面自身
    static List<String> collectInternalLinks(Document doc, String pageUrl) {
        String self = PathMapper.pageKey(pageUrl);
        Set<String> found = new LinkedHashSet<>();
        for (Element a : doc.select("a[href]")) {
            String href = a.attr("href");
            if (!PathMapper.isInternal(href, pageUrl)) continue;
            String abs = PathMapper.pageKey(a.absUrl("href"));
            if (abs == null || abs.isEmpty() || abs.equals(self)) continue;
            found.add(abs);
        }
        return new ArrayList<>(found);
    }

    private static int rewriteLinks(Document doc, String baseUrl, String pagePath) {
        URI page = PathMapper.safeUri(baseUrl);
        String pageHost = page == null ? null : page.getHost();
        int count = 0;
        for (Element a : doc.select("a[href]")) {
            String href = a.attr("href").trim();
            String lower = href.toLowerCase(Locale.ROOT);
            if (href.isEmpty() || href.startsWith("#") || lower.startsWith("mailto:")
                    || lower.startsWith("tel:") || lower.startsWith("javascript:")) {
                continue;
            }
            boolean rootRelative = href.startsWith("/") && !href.startsWith("//");
            boolean absolute = lower.startsWith("http://") || lower.startsWith("https://") || href.startsWith("//");
            if (!rootRelative && !absolute) continue;

            URI target = PathMapper.safeUri(a.absUrl("href"));
            if (target == null || target.getHost() == null || pageHost == null
                    || !target.getHost().equalsIgnoreCase(pageHost)) {
                continue;
            }
            // 不会作为页面抓取的文件（pdf、zip 等）指回源站
            if (!PathMapper.isLikelyPage(target.toString())) {
                a.attr("href", target.toString());
                continue;
            }
            String rel = PathMapper.relativeLink(pagePath, PathMapper.cleanPath(target.toString()));
            if (target.getRawFragment() != null && !target.getRawFragment().isEmpty()) {
                rel = rel + "#" + target.getRawFragment();
            }
            a.attr("href", rel);
            count++;
        }
        return count;
    }

    private int rewriteAssets(Document doc, String pageUrl, String pagePath, AssetFetcher assets) {
        // 先收集本页全部资源引用，并发下载后再统一替换
        Set<String> refs = new LinkedHashSet<>();
        List<Element> assetElements = new ArrayList<>();
        for (Element el : doc.select(ASSET_ATTR_SELECTOR)) {
            if ("link".equals(el.tagName()) && !isAssetLink(el)) continue;
            assetElements.add(el);
            for (String attr : URL_ATTRS) {
                if (el.hasAttr(attr) && !el.attr(attr).trim().isEmpty()) refs.add(el.attr(attr).trim());
            }
            if (el.hasAttr("srcset")) refs.addAll(srcsetUrls(el.attr("srcset")));
        }
        List<Element> styleBlocks = doc.select("style");
        List<Element> styledElements = new ArrayList<>();
        for (Element el : doc.select("[style]")) {
            if (el.attr("style").toLowerCase(Locale.ROOT).contains("url(")) styledElements.add(el);
        }
        for (Element st : styleBlocks) collectCssUrls(st.data(), refs);
        for (Element el : styledElements) collectCssUrls(el.attr("style"), refs);

        Map<String, String> localByRef = download(refs, pageUrl, pagePath, assets);

        int count = 0;
        for (Element el : assetElements) {
            for (String attr : URL_ATTRS) {
                String mapped = el.hasAttr(attr) ? localByRef.get(el.attr(attr).trim()) : null;
                if (mapped != null) {
                    el.attr(attr, mapped);
                    count++;
                }
            }
            if (el.hasAttr("srcset")) {
                el.attr("srcset", rewriteSrcset(el.attr("srcset"), localByRef));
            }
        }
        for (Element st : styleBlocks) {
            String css = st.data();
            String rewritten = AssetFetcher.rewriteCssUrls(css, localByRef::get);
            if (rewritten != null && !rewritten.equals(css)) {
                st.empty();
                st.appendChild(new DataNode(rewritten));
            }
        }
        for (Element el : styledElements) {
            el.attr("style", AssetFetcher.rewriteCssUrls(el.attr("style"), localByRef::get));
        }
        return count;
    }

    private Map<String, String> download(Set<String> refs, String pageUrl, String pagePath, AssetFetcher assets) {
        Map<String, CompletableFuture<Optional<AssetRecord>>> pending = new LinkedHashMap<>();
        for (String ref : refs) {
            CompletableFuture<Optional<AssetRecord>> f;
            try {
                f = CompletableFuture.supplyAsync(() -> assets.resolve(ref, pageUrl), assetExecutor);
            } catch (RejectedExecutionException ex) {
                f = CompletableFuture.completedFuture(assets.resolve(ref, pageUrl));
            }
            pending.put(ref, f);
        }
        Map<String, String> localByRef = new HashMap<>();
        for (Map.Entry<String, CompletableFuture<Optional<AssetRecord>>> e : pending.entrySet()) {
            e.getValue().join().ifPresent(record ->
                    localByRef.put(e.getKey(), PathMapper.relativeLink(pagePath, record.getLocalPath())));
        }
        return localByRef;
    }

    private static boolean isAssetLink(Element link) {
        String rel = link.attr("rel").toLowerCase(Locale.ROOT);
        return rel.contains("stylesheet") || rel.contains("icon");
    }

    private static void collectCssUrls(String css, Set<String> refs) {
        AssetFetcher.rewriteCssUrls(css, raw -> {
            refs.add(raw);
            return raw;
        });
    }

    static List<String> srcsetUrls(String srcset) {
        List<String> urls = new ArrayList<>();
        if (srcset == null || srcset.toLowerCase(Locale.ROOT).contains("data:")) return urls;
        for (String item : srcset.split(",")) {
            String url = splitCandidate(item.trim())[0];
            if (!url.isEmpty()) urls.add(url);
        }
        return urls;
    }

    private static String rewriteSrcset(String srcset, Map<String, String> localByRef) {
        if (srcset.toLowerCase(Locale.ROOT).contains("data:")) return srcset;
        StringBuilder rebuilt = new StringBuilder();
        for (String item : srcset.split(",")) {
            String[] candidate = splitCandidate(item.trim());
            if (candidate[0].isEmpty()) continue;
            if (rebuilt.length() > 0) rebuilt.append(", ");
            rebuilt.append(localByRef.getOrDefault(candidate[0], candidate[0]));
            if (!candidate[1].isEmpty()) rebuilt.append(' ').append(candidate[1]);
        }
        return rebuilt.toString();
    }

    // srcset 候选项：URL 与可选的宽度/像素密度描述符
    private static String[] splitCandidate(String item) {
        int sp = item.lastIndexOf(' ');
        if (sp > 0 && sp < item.length() - 1) {
            return new String[]{item.substring(0, sp).trim(), item.substring(sp + 1).trim()};
        }
        return new String[]{item, ""};
    }
}
