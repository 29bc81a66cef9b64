package com.example.sitemirror.service;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

public final class FetchResponse {

    private final String url;
    private final int statusCode;
    private final String contentType;
    private final byte[] body;

    public FetchResponse(String url, int statusCode, String contentType, byte[] body) {
        this.url = url;
        this.statusCode = statusCode;
        this.contentType = contentType;
        this.body = body == null ? new byte[0] : body;
    }

    // 跟随重定向之后的最终地址
    public String getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public byte[] getBody() { return body; }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isCss() {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith("text/css");
    }

    /**
     * 以最终地址为 base 解析页面。字符集由 jsoup 判断：BOM 优先，其次 Content-Type，
     * 再次 {@code <meta charset>}，都没有时按 UTF-8。
     */
    public Document parseHtml() throws IOException {
        return Jsoup.parse(new ByteArrayInputStream(body), headerCharset(), url == null ? "" : url);
    }

    // 样式表等文本资源：按 Content-Type 声明的字符集解码，未声明时使用 UTF-8
    public String bodyAsString() {
        String charset = headerCharset();
        return new String(body, charset == null ? StandardCharsets.UTF_8 : Charset.forName(charset));
    }

    // 未声明或无法识别时返回 null
    String headerCharset() {
        if (contentType == null) return null;
        for (String part : contentType.split(";")) {
            String p = part.trim();
            if (!p.toLowerCase(Locale.ROOT).startsWith("charset=")) continue;
            String name = p.substring("charset=".length()).replace("\"", "").trim();
            try {
                return Charset.isSupported(name) ? name : null;
            } catch (IllegalCharsetNameException ex) {
                return null;
            }
        }
        return null;
    }
}
