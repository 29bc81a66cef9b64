package com.example.sitemirror.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class CrawlResult {

	private boolean success;
	private String message;
	private String outputRoot;
	private int assetsDownloaded;
	private Duration elapsed = Duration.ZERO;
	private final List<PageRecord> pages = new ArrayList<>();
	private final List<String> errors = new ArrayList<>();

	public static CrawlResult success(String outputRoot) {
		CrawlResult r = new CrawlResult();
		r.success = true;
		r.outputRoot = outputRoot;
		return r;
	}

	// 结构化失败：不抛异常，由调用方读取 message
	public static CrawlResult failure(String message) {
		CrawlResult r = new CrawlResult();
		r.success = false;
		r.message = message;
		return r;
	}

	public boolean isSuccess() {
		return success;
	}

	public String getMessage() {
		return message;
	}

	public void setMessage(String message) {
		this.message = message;
	}

	public String getOutputRoot() {
		return outputRoot;
	}

	public int getPageCount() {
		return pages.size();
	}

	public List<PageRecord> getPages() {
		return Collections.unmodifiableList(pages);
	}

	public void addPage(PageRecord page) {
		if (page != null) pages.add(page);
	}

	public int getAssetsDownloaded() {
		return assetsDownloaded;
	}

	public void setAssetsDownloaded(int assetsDownloaded) {
		this.assetsDownloaded = assetsDownloaded;
	}

	public Duration getElapsed() {
		return elapsed;
	}

	public void setElapsed(Duration elapsed) {
		this.elapsed = elapsed;
	}

	public List<String> getErrors() {
		return Collections.unmodifiableList(errors);
	}

	public void addError(String error) {
		if (error != null && !error.isEmpty()) errors.add(error);
	}
}
