package com.example.sitemirror.service;

import org.jsoup.nodes.Document;

import java.util.Collections;
import java.util.List;

/**
 * 改写后的页面：最终 DOM、标题、本地路径，以及原始页面中出现的站内链接（按出现顺序）。
 */
public class RewrittenPage {

    private final String url;
    private final String localPath;
    private final String title;
    private final Document document;
    private final List<String> internalLinks;

    public RewrittenPage(String url, String localPath, String title, Document document, List<String> internalLinks) {
        this.url = url;
        this.localPath = localPath;
        this.title = title;
        this.document = document;
        this.internalLinks = Collections.unmodifiableList(internalLinks);
    }

    public String getUrl() { return url; }
    public String getLocalPath() { return localPath; }
    public String getTitle() { return title; }
    public Document getDocument() { return document; }
    public List<String> getInternalLinks() { return internalLinks; }

    public String html() {
        return document.outerHtml();
    }
}
