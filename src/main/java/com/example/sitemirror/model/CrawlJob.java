package com.example.sitemirror.model;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * 一次抓取任务的不可变描述。selectedPages 非空时精确限定要抓取的页面集合，否则通过遍历发现页面。
 */
public final class CrawlJob {

	private final String startUrl;
	private final Platform platform;
	private final ScrapeMode mode;
	private final Set<String> selectedPages;
	private final Path outputRoot;

	private CrawlJob(String startUrl, Platform platform, ScrapeMode mode, Set<String> selectedPages, Path outputRoot) {
		this.startUrl = startUrl;
		this.platform = platform;
		this.mode = mode;
		this.selectedPages = selectedPages;
		this.outputRoot = outputRoot;
	}

	public static CrawlJob singlePage(String startUrl, Platform platform, Path outputRoot) {
		return create(startUrl, platform, ScrapeMode.SINGLE_PAGE, null, outputRoot);
	}

	public static CrawlJob multiPage(String startUrl, Platform platform, Path outputRoot) {
		return create(startUrl, platform, ScrapeMode.MULTI_PAGE, null, outputRoot);
	}

	public static CrawlJob selectedPages(String startUrl, Platform platform, Collection<String> pages, Path outputRoot) {
		return create(startUrl, platform, ScrapeMode.MULTI_PAGE, pages, outputRoot);
	}

	/**
	 * 由表单字符串构造任务；平台或模式不合法时抛出 {@link CrawlConfigurationException}。
	 */
	public static CrawlJob of(String startUrl, String siteType, String scrapeMode, Collection<String> pages, Path outputRoot) {
		return create(startUrl, Platform.fromValue(siteType), ScrapeMode.fromValue(scrapeMode), pages, outputRoot);
	}

	private static CrawlJob create(String startUrl, Platform platform, ScrapeMode mode, Collection<String> pages, Path outputRoot) {
		if (platform == null) throw new UnsupportedPlatformException(null);
		if (outputRoot == null) throw new CrawlConfigurationException("outputRoot 不能为空");
		String start = normalizeStartUrl(startUrl);
		Set<String> selected = new LinkedHashSet<>();
		if (pages != null) {
			for (String p : pages) {
				if (p != null && !p.trim().isEmpty()) selected.add(p.trim());
			}
		}
		return new CrawlJob(start, platform, Objects.requireNonNull(mode), Collections.unmodifiableSet(selected), outputRoot);
	}

	/**
	 * 补全协议（缺省 https）并校验为 http(s) 地址，不合法时抛出 {@link CrawlConfigurationException}。
	 */
	public static String normalizeStartUrl(String url) {
		if (url == null || url.trim().isEmpty()) {
			throw new CrawlConfigurationException("startUrl 不能为空");
		}
		String v = url.trim();
		try {
			URI uri = new URI(v);
			if (uri.getScheme() == null) {
				uri = new URI("https://" + v);
			}
			String scheme = uri.getScheme().toLowerCase();
			if (!scheme.equals("http") && !scheme.equals("https") || uri.getHost() == null) {
				throw new CrawlConfigurationException("startUrl 不是合法的 http(s) 地址: " + url);
			}
			return uri.toString();
		} catch (URISyntaxException e) {
			throw new CrawlConfigurationException("startUrl 不是合法的 URL: " + url);
		}
	}

	public String getStartUrl() {
		return startUrl;
	}

	public Platform getPlatform() {
		return platform;
	}

	public ScrapeMode getMode() {
		return mode;
	}

	public Set<String> getSelectedPages() {
		return selectedPages;
	}

	public boolean hasSelection() {
		return !selectedPages.isEmpty();
	}

	public Path getOutputRoot() {
		return outputRoot;
	}

	@Override
	public String toString() {
		return "CrawlJob{" + startUrl + ", " + platform.getValue() + ", " + mode.getValue()
				+ (hasSelection() ? ", selected=" + selectedPages.size() : "") + " -> " + outputRoot + "}";
	}
}
