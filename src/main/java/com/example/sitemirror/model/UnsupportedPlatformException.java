package com.example.sitemirror.model;

public class UnsupportedPlatformException extends CrawlConfigurationException {

	private final String siteType;

	public UnsupportedPlatformException(String siteType) {
		super("Unsupported site type: " + siteType);
		this.siteType = siteType;
	}

	public String getSiteType() {
		return siteType;
	}
}
