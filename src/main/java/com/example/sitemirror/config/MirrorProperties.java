package com.example.sitemirror.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sitemirror")
public class MirrorProperties {

	// 输出根目录，支持通过外部配置文件覆盖
	private String outputBaseDir = "output";

	private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";

	// 页面与资源请求的统一超时（毫秒），超时视为失败，不重试
	private int requestTimeoutMillis = 30000;

	// 单个页面内资源并发下载的线程数
	private int assetThreads = 4;

	// 任务执行线程数，<= 0 时按 CPU 数推算
	private int jobThreads = 0;

	public String getOutputBaseDir() {
		return outputBaseDir;
	}

	public void setOutputBaseDir(String outputBaseDir) {
		this.outputBaseDir = outputBaseDir;
	}

	public String getUserAgent() {
		return userAgent;
	}

	public void setUserAgent(String userAgent) {
		this.userAgent = userAgent;
	}

	public int getRequestTimeoutMillis() {
		return requestTimeoutMillis;
	}

	public void setRequestTimeoutMillis(int requestTimeoutMillis) {
		this.requestTimeoutMillis = requestTimeoutMillis;
	}

	public int getAssetThreads() {
		return assetThreads;
	}

	public void setAssetThreads(int assetThreads) {
		this.assetThreads = assetThreads;
	}

	public int getJobThreads() {
		return jobThreads;
	}

	public void setJobThreads(int jobThreads) {
		this.jobThreads = jobThreads;
	}

	// 清洗外部配置的路径值（去掉首尾引号，去空白）
	public String resolvedOutputBaseDir() {
		if (outputBaseDir == null) return "output";
		String v = outputBaseDir.trim();
		if ((v.startsWith("\"") && v.endsWith("\"")) || (v.startsWith("'") && v.endsWith("'"))) {
			v = v.substring(1, v.length() - 1).trim();
		}
		return v.isEmpty() ? "output" : v;
	}
}
