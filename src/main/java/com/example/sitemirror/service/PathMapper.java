package com.example.sitemirror.service;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * URL 到本地路径的纯函数映射，以及站内/站外链接判断。不做任何 I/O。
 */
public final class PathMapper {

    public static final String INDEX = "index.html";

    // 即使与当前站点同域，也一律视为站外的常见第三方域名
    private static final List<String> EXTERNAL_DOMAINS = Arrays.asList(
            "facebook.com", "twitter.com", "instagram.com", "linkedin.com",
            "youtube.com", "google.com", "maps.google.com");

    private static final List<String> NON_PAGE_EXTENSIONS = Arrays.asList(
            ".jpg", ".jpeg", ".png", ".gif", ".webp", ".svg", ".ico",
            ".css", ".js", ".json", ".map", ".xml", ".txt",
            ".pdf", ".doc", ".docx", ".xls", ".xlsx", ".ppt", ".pptx",
            ".zip", ".rar", ".7z", ".gz", ".tar",
            ".mp3", ".mp4", ".webm", ".woff", ".woff2", ".ttf", ".otf");

    private PathMapper() {
    }

    /**
     * 页面 URL -> 规范化相对路径。去掉 query 与 fragment；根路径为 index.html；
     * 末段强制以 .html 结尾（替换其它扩展名），保留目录层级。
     */
    public static String cleanPath(String url) {
        URI uri = safeUri(url);
        String path = uri == null ? null : uri.getPath();
        if (path == null) {
            // 无法解析的 URL：手工去掉协议与主机部分
            path = stripQueryAndFragment(url == null ? "" : url.trim())
                    .replaceFirst("^[a-zA-Z][a-zA-Z0-9+.-]*://[^/]*", "");
        }
        List<String> segments = new ArrayList<>();
        for (String seg : path.split("/")) {
            if (seg.isEmpty() || ".".equals(seg)) continue;
            if ("..".equals(seg)) {
                if (!segments.isEmpty()) segments.remove(segments.size() - 1);
                continue;
            }
            segments.add(sanitizeSegment(seg));
        }
        if (segments.isEmpty()) return INDEX;

        int lastIndex = segments.size() - 1;
        String last = segments.get(lastIndex);
        if (!last.endsWith(".html")) {
            int dot = last.lastIndexOf('.');
            String stem = dot > 0 ? last.substring(0, dot) : last;
            segments.set(lastIndex, stem + ".html");
        }
        return String.join("/", segments);
    }

    /**
     * 计算从 fromPath 所在目录到 toPath 的相对链接。同目录时只返回文件名。
     */
    public static String relativeLink(String fromPath, String toPath) {
        String fromDir = dirname(fromPath);
        String toDir = dirname(toPath);
        String toName = basename(toPath);
        if (fromDir.equals(toDir)) return toName;

        String[] fromParts = fromDir.isEmpty() ? new String[0] : fromDir.split("/");
        String[] toParts = toDir.isEmpty() ? new String[0] : toDir.split("/");
        int common = 0;
        while (common < fromParts.length && common < toParts.length
                && fromParts[common].equals(toParts[common])) {
            common++;
        }

        StringBuilder sb = new StringBuilder();
        for (int i = common; i < fromParts.length; i++) {
            sb.append("../");
        }
        for (int i = common; i < toParts.length; i++) {
            sb.append(toParts[i]).append('/');
        }
        sb.append(toName);
        return sb.toString();
    }

    /**
     * 判断链接是否属于当前站点。mailto:/tel:/javascript:/纯锚点为站外；
     * 绝对与协议相对地址比较主机名，并排除第三方域名黑名单；相对地址默认站内。
     */
    public static boolean isInternal(String link, String currentUrl) {
        if (link == null) return false;
        String l = link.trim();
        if (l.isEmpty()) return false;
        String lower = l.toLowerCase(Locale.ROOT);
        if (lower.startsWith("mailto:") || lower.startsWith("tel:")
                || lower.startsWith("#") || lower.startsWith("javascript:")) {
            return false;
        }

        URI current = safeUri(currentUrl);
        if (lower.startsWith("http://") || lower.startsWith("https://") || lower.startsWith("//")) {
            URI target = safeUri(lower.startsWith("//") ? schemeOf(current) + ":" + l : l);
            if (target == null || target.getHost() == null) return false;
            String host = target.getHost().toLowerCase(Locale.ROOT);
            if (isDenylisted(host)) return false;
            return current != null && current.getHost() != null && host.equalsIgnoreCase(current.getHost());
        }
        if (lower.matches("^[a-z][a-z0-9+.-]*:.*")) {
            // data:, ftp: 等其它协议
            return false;
        }
        return true;
    }

    /**
     * 按扩展名粗略判断链接是否指向页面：无扩展名或 .html/.htm 等视为页面，常见静态资源与文档不是。
     */
    public static boolean isLikelyPage(String url) {
        URI uri = safeUri(url);
        String path = uri == null || uri.getPath() == null ? stripQueryAndFragment(url) : uri.getPath();
        if (path == null || path.isEmpty()) return true;
        String lower = path.toLowerCase(Locale.ROOT);
        for (String ext : NON_PAGE_EXTENSIONS) {
            if (lower.endsWith(ext)) return false;
        }
        return true;
    }

    static boolean isDenylisted(String host) {
        for (String d : EXTERNAL_DOMAINS) {
            if (host.contains(d)) return true;
        }
        return false;
    }

    /**
     * 资源 URL -> 相对输出根目录的本地路径。同域资源沿用 URL 路径，外域资源放在以主机名命名的目录下；
     * query 折叠进文件名，避免不同版本互相覆盖。
     */
    public static String assetPath(URI assetUri, String pageHost) {
        List<String> segments = new ArrayList<>();
        String host = assetUri.getHost() == null ? "unknown-host" : assetUri.getHost().toLowerCase(Locale.ROOT);
        if (pageHost == null || !host.equalsIgnoreCase(pageHost)) {
            segments.add(sanitizeSegment(host));
        }
        String rawPath = assetUri.getPath() == null ? "" : assetUri.getPath();
        for (String seg : rawPath.split("/")) {
            if (seg.isEmpty() || ".".equals(seg) || "..".equals(seg)) continue;
            segments.add(sanitizeSegment(seg));
        }
        if (rawPath.isEmpty() || rawPath.endsWith("/") || segments.isEmpty()) {
            segments.add("index");
        }

        String query = assetUri.getRawQuery();
        if (query != null && !query.isEmpty()) {
            int lastIndex = segments.size() - 1;
            String last = segments.get(lastIndex);
            String suffix = "_q_" + sanitizeQuery(query);
            int dot = last.lastIndexOf('.');
            segments.set(lastIndex, dot > 0
                    ? last.substring(0, dot) + suffix + last.substring(dot)
                    : last + suffix);
        }
        return String.join("/", segments);
    }

    /**
     * 由 URL 末段推导可读的页面名：our-team -> Our Team，根路径 -> Home。
     */
    public static String pageNameFromUrl(String url) {
        URI uri = safeUri(url);
        String path = uri == null || uri.getPath() == null ? "" : uri.getPath();
        String[] parts = Arrays.stream(path.split("/")).filter(s -> !s.isEmpty()).toArray(String[]::new);
        if (parts.length == 0) return "Home";
        String name = parts[parts.length - 1].replace('-', ' ').replace('_', ' ');
        StringBuilder sb = new StringBuilder();
        boolean upper = true;
        for (char c : name.toCharArray()) {
            if (Character.isLetter(c)) {
                sb.append(upper ? Character.toUpperCase(c) : Character.toLowerCase(c));
                upper = false;
            } else {
                sb.append(c);
                upper = true;
            }
        }
        return sb.toString();
    }

    public static String stripQueryAndFragment(String url) {
        if (url == null) return null;
        String v = url;
        int hash = v.indexOf('#');
        if (hash >= 0) v = v.substring(0, hash);
        int q = v.indexOf('?');
        if (q >= 0) v = v.substring(0, q);
        return v;
    }

    /**
     * 页面去重键：去掉 query 与 fragment，没有路径时补 /，使 https://a.com 与 https://a.com/ 视为同一页面。
     */
    public static String pageKey(String url) {
        String v = stripQueryAndFragment(url);
        if (v == null) return null;
        v = v.trim();
        URI uri = safeUri(v);
        if (uri != null && uri.getHost() != null && (uri.getRawPath() == null || uri.getRawPath().isEmpty())) {
            return v + "/";
        }
        return v;
    }

    static URI safeUri(String url) {
        if (url == null) return null;
        try {
            return new URI(url.trim()).normalize();
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static String schemeOf(URI uri) {
        return uri == null || uri.getScheme() == null ? "https" : uri.getScheme();
    }

    private static String dirname(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }

    private static String basename(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    // 替换文件名中不合法的字符
    private static String sanitizeSegment(String seg) {
        return seg.replaceAll("[<>:\"\\\\|?*\\x00-\\x1f]", "_");
    }

    private static String sanitizeQuery(String query) {
        String cleaned = query.replaceAll("[^a-zA-Z0-9._-]", "-");
        if (cleaned.length() > 40) {
            return Integer.toHexString(query.hashCode());
        }
        return cleaned;
    }
}
