package com.example.sitemirror.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 外部编排层提交的表单数据，经 {@link CrawlJob#of} 校验后转换为任务。
 */
public class CrawlRequest {

	private String startUrl;

	// framer / webflow / ... / general
	private String siteType = "general";

	// single_page 或 multi_page
	private String scrapeMode = "multi_page";

	// 可选：多页模式下精确指定要抓取的页面
	private List<String> selectedPages = new ArrayList<>();

	public String getStartUrl() {
		return startUrl;
	}

	public void setStartUrl(String startUrl) {
		this.startUrl = startUrl;
	}

	public String getSiteType() {
		return siteType;
	}

	public void setSiteType(String siteType) {
		this.siteType = siteType;
	}

	public String getScrapeMode() {
		return scrapeMode;
	}

	public void setScrapeMode(String scrapeMode) {
		this.scrapeMode = scrapeMode;
	}

	public List<String> getSelectedPages() {
		return selectedPages;
	}

	public void setSelectedPages(List<String> selectedPages) {
		this.selectedPages = selectedPages;
	}
}
