package com.example.sitemirror.service;

import java.io.IOException;

/**
 * 单次 HTTP GET。传输失败与超时抛出 IOException；非 2xx 状态通过 {@link FetchResponse#getStatusCode()} 返回，不抛异常。
 */
public interface HttpFetcher {

    FetchResponse fetch(String url, String referer) throws IOException;
}
