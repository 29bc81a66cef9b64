package com.example.sitemirror.model;

/**
 * 任务配置错误：在任何网络请求之前抛出，整个任务被拒绝。
 */
public class CrawlConfigurationException extends IllegalArgumentException {

	public CrawlConfigurationException(String message) {
		super(message);
	}
}
