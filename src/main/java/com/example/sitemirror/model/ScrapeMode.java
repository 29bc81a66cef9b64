package com.example.sitemirror.model;

import java.util.Locale;

public enum ScrapeMode {
	SINGLE_PAGE("single_page"),
	MULTI_PAGE("multi_page");

	private final String value;

	ScrapeMode(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	// 为空时默认多页
	public static ScrapeMode fromValue(String raw) {
		if (raw == null || raw.trim().isEmpty()) return MULTI_PAGE;
		String v = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
		for (ScrapeMode m : values()) {
			if (m.value.equals(v)) return m;
		}
		throw new CrawlConfigurationException("Unsupported scrape mode: " + raw);
	}
}
