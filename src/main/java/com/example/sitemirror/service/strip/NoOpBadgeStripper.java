package com.example.sitemirror.service.strip;

import org.jsoup.nodes.Document;

// general 平台：不做处理
final class NoOpBadgeStripper implements BadgeStripper {

    static final NoOpBadgeStripper INSTANCE = new NoOpBadgeStripper();

    private NoOpBadgeStripper() {
    }

    @Override
    public Document stripBadge(Document doc) {
        return doc;
    }
}
