package com.example.sitemirror.service.strip;

import org.jsoup.nodes.Document;

/**
 * 去除站点平台注入的推广徽标。实现无状态，每个任务按平台选定一次，对每个页面调用一次。
 */
public interface BadgeStripper {

    Document stripBadge(Document doc);
}
