package com.example.sitemirror.service.strip;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 单个平台的徽标规则：注入隐藏的 CSS 选择器、直接删除的 DOM 选择器、推广链接的域名与关键词、短文本短语。
 */
public final class BadgeRules {

    private final String platformName;
    private final List<String> hiddenSelectors;
    private final List<String> extraCss;
    private final List<String> removeSelectors;
    private final List<String> linkDomains;
    private final List<String> linkKeywords;
    private final List<String> textPhrases;

    private BadgeRules(Builder b) {
        this.platformName = b.platformName;
        this.hiddenSelectors = Collections.unmodifiableList(new ArrayList<>(b.hiddenSelectors));
        this.extraCss = Collections.unmodifiableList(new ArrayList<>(b.extraCss));
        this.removeSelectors = Collections.unmodifiableList(new ArrayList<>(b.removeSelectors));
        this.linkDomains = lower(b.linkDomains);
        this.linkKeywords = lower(b.linkKeywords);
        this.textPhrases = lower(b.textPhrases);
    }

    public static Builder builder(String platformName) {
        return new Builder(platformName);
    }

    public String getPlatformName() { return platformName; }
    public List<String> getRemoveSelectors() { return removeSelectors; }
    public List<String> getLinkDomains() { return linkDomains; }
    public List<String> getLinkKeywords() { return linkKeywords; }
    public List<String> getTextPhrases() { return textPhrases; }

    /**
     * 生成注入到页面的样式块内容。
     */
    public String toCss() {
        StringBuilder sb = new StringBuilder("\n");
        for (String selector : hiddenSelectors) {
            sb.append(selector).append(" { display: none !important; }\n");
        }
        for (String rule : extraCss) {
            sb.append(rule).append('\n');
        }
        return sb.toString();
    }

    private static List<String> lower(List<String> values) {
        List<String> out = new ArrayList<>(values.size());
        for (String v : values) out.add(v.toLowerCase(Locale.ROOT));
        return Collections.unmodifiableList(out);
    }

    public static final class Builder {
        private final String platformName;
        private final List<String> hiddenSelectors = new ArrayList<>();
        private final List<String> extraCss = new ArrayList<>();
        private final List<String> removeSelectors = new ArrayList<>();
        private final List<String> linkDomains = new ArrayList<>();
        private final List<String> linkKeywords = new ArrayList<>();
        private final List<String> textPhrases = new ArrayList<>();

        private Builder(String platformName) {
            this.platformName = platformName;
        }

        public Builder hide(String... selectors) {
            hiddenSelectors.addAll(Arrays.asList(selectors));
            return this;
        }

        public Builder css(String... rules) {
            extraCss.addAll(Arrays.asList(rules));
            return this;
        }

        public Builder remove(String... selectors) {
            removeSelectors.addAll(Arrays.asList(selectors));
            return this;
        }

        public Builder linkDomains(String... domains) {
            linkDomains.addAll(Arrays.asList(domains));
            return this;
        }

        public Builder linkKeywords(String... keywords) {
            linkKeywords.addAll(Arrays.asList(keywords));
            return this;
        }

        public Builder textPhrases(String... phrases) {
            textPhrases.addAll(Arrays.asList(phrases));
            return this;
        }

        public BadgeRules build() {
            return new BadgeRules(this);
        }
    }
}
