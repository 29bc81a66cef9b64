package com.example.sitemirror.model;

/**
 * 资源缓存条目：同一任务内每个资源 URL 只对应一个本地文件。
 */
public final class AssetRecord {

	private final String sourceUrl;
	private final String localPath;

	public AssetRecord(String sourceUrl, String localPath) {
		this.sourceUrl = sourceUrl;
		this.localPath = localPath;
	}

	// 相对输出根目录，使用 / 分隔
	public String getLocalPath() { return localPath; }

	@Override
	public String toString() {
		return sourceUrl + " -> " + localPath;
	}
}
