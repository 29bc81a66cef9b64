package com.example.sitemirror.service;

import com.example.sitemirror.config.MirrorProperties;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * 基于 Jsoup 的抓取实现：跟随重定向、忽略内容类型、不限制响应体大小、不重试。
 */
@Component
public class JsoupHttpFetcher implements HttpFetcher {

    private final MirrorProperties properties;

    public JsoupHttpFetcher(MirrorProperties properties) {
        this.properties = properties;
    }

    @Override
    public FetchResponse fetch(String url, String referer) throws IOException {
        Connection connection = Jsoup.connect(url)
                .userAgent(properties.getUserAgent())
                .timeout(properties.getRequestTimeoutMillis())
                .followRedirects(true)
                .ignoreContentType(true)
                .ignoreHttpErrors(true)
                .maxBodySize(0);
        if (referer != null && !referer.isEmpty()) {
            connection.header("Referer", referer);
        }
        Connection.Response res = connection.execute();
        return new FetchResponse(res.url().toString(), res.statusCode(), res.contentType(), res.bodyAsBytes());
    }
}
