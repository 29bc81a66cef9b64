package com.example.sitemirror.model;

import java.util.Objects;

/**
 * 已发现或已写出的页面：原始 URL、规范化本地路径与标题。
 */
public final class PageRecord {

	private final String url;
	private final String path;
	private final String title;

	public PageRecord(String url, String path, String title) {
		this.url = url;
		this.path = path;
		this.title = title;
	}

	public String getUrl() { return url; }
	public String getPath() { return path; }
	public String getTitle() { return title; }

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof PageRecord)) return false;
		PageRecord that = (PageRecord) o;
		return url.equals(that.url) && Objects.equals(path, that.path) && Objects.equals(title, that.title);
	}

	@Override
	public int hashCode() {
		return Objects.hash(url, path, title);
	}

	@Override
	public String toString() {
		return url + " -> " + path + " (" + title + ")";
	}
}
