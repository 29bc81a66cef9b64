package com.example.sitemirror.model;

import java.util.Locale;

/**
 * 站点来源平台。每个平台注入各自的推广徽标，GENERAL 表示未识别的站点，不做徽标处理。
 */
public enum Platform {
	FRAMER("framer"),
	WEBFLOW("webflow"),
	WORDPRESS("wordpress"),
	WIX("wix"),
	SHOPIFY("shopify"),
	BOLT("bolt"),
	LOVABLE("lovable"),
	GUMROAD("gumroad"),
	REPLIT("replit"),
	SQUARESPACE("squarespace"),
	NOTION("notion"),
	ROCKET("rocket"),
	GENERAL("general");

	private final String value;

	Platform(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	public static Platform fromValue(String raw) {
		if (raw == null) throw new UnsupportedPlatformException(null);
		String v = raw.trim().toLowerCase(Locale.ROOT);
		for (Platform p : values()) {
			if (p.value.equals(v)) return p;
		}
		throw new UnsupportedPlatformException(raw);
	}
}
