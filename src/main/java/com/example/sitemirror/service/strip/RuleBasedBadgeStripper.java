package com.example.sitemirror.service.strip;

import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * 按 {@link BadgeRules} 去除徽标：先注入隐藏样式，再删除匹配的节点，最后删除推广链接与短推广文本。
 */
public class RuleBasedBadgeStripper implements BadgeStripper {

    private static final Logger log = LoggerFactory.getLogger(RuleBasedBadgeStripper.class);

    // 纯文本匹配时的长度上限，避免误删恰好提到平台名的正文
    static final int MAX_TEXT_LENGTH = 50;

    private static final String TEXT_CANDIDATES = "a, button, div, span, p";

    private final BadgeRules rules;

    public RuleBasedBadgeStripper(BadgeRules rules) {
        this.rules = rules;
    }

    public BadgeRules getRules() {
        return rules;
    }

    @Override
    public Document stripBadge(Document doc) {
        injectStyle(doc);
        int removed = removeSelected(doc) + removePromoLinks(doc) + removePromoText(doc);
        if (removed > 0) {
            log.debug("[STRIP][REMOVED] platform={} elements={}", rules.getPlatformName(), removed);
        }
        return doc;
    }

    // 优先放入 <head>，其次 <body> 开头，都没有时放在文档最前
    private void injectStyle(Document doc) {
        Element style = doc.createElement("style");
        style.appendChild(new DataNode(rules.toCss()));
        Element head = doc.selectFirst("head");
        if (head != null) {
            head.appendChild(style);
            return;
        }
        Element body = doc.selectFirst("body");
        if (body != null) {
            body.prependChild(style);
        } else {
            doc.prependChild(style);
        }
    }

    private int removeSelected(Document doc) {
        int count = 0;
        for (String selector : rules.getRemoveSelectors()) {
            try {
                for (Element el : doc.select(selector)) {
                    if (detach(el)) count++;
                }
            } catch (Selector.SelectorParseException ex) {
                log.warn("[STRIP][BAD-SELECTOR] {} -> {}", selector, ex.getMessage());
            }
        }
        return count;
    }

    private int removePromoLinks(Document doc) {
        if (rules.getLinkDomains().isEmpty()) return 0;
        int count = 0;
        for (Element a : doc.select("a[href]")) {
            String href = a.attr("href").toLowerCase(Locale.ROOT);
            if (!containsAny(href, rules.getLinkDomains())) continue;
            String text = a.text().toLowerCase(Locale.ROOT);
            if (containsAny(text, rules.getLinkKeywords()) && detach(a)) {
                count++;
            }
        }
        return count;
    }

    private int removePromoText(Document doc) {
        if (rules.getTextPhrases().isEmpty()) return 0;
        int count = 0;
        for (Element el : doc.select(TEXT_CANDIDATES)) {
            String text = el.text().trim();
            if (text.isEmpty() || text.length() >= MAX_TEXT_LENGTH) continue;
            if (containsAny(text.toLowerCase(Locale.ROOT), rules.getTextPhrases()) && detach(el)) {
                count++;
            }
        }
        return count;
    }

    private static boolean detach(Element el) {
        if (el.parent() == null) return false;
        el.remove();
        return true;
    }

    private static boolean containsAny(String haystack, List<String> needles) {
        for (String n : needles) {
            if (haystack.contains(n)) return true;
        }
        return false;
    }
}
