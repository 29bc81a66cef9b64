package com.example.sitemirror.service.strip;

import com.example.sitemirror.model.Platform;

import java.util.EnumMap;
import java.util.Map;

/**
 * 平台到徽标处理器的映射。general 及没有规则的平台退化为不做处理。
 */
public final class BadgeStrippers {

    private static final Map<Platform, BadgeStripper> STRIPPERS = new EnumMap<>(Platform.class);

    static {
        register(Platform.FRAMER, BadgeRules.builder("Framer")
                .hide("#__framer-badge-container",
                        "[data-framer-name=\"Made with Framer\"]",
                        ".framer-badge",
                        "a[href*=\"framer.com\"][target=\"_blank\"]",
                        "a[href*=\"framer.com/templates\"]",
                        "[data-framer-name*=\"Edit template\"]",
                        "[class*=\"edit-template\"]",
                        "[class*=\"template-badge\"]")
                .remove("#__framer-badge-container",
                        "[data-framer-name=\"Made with Framer\"]",
                        ".framer-badge",
                        ".edit-template",
                        ".template-badge")
                .linkDomains("framer.com")
                .linkKeywords("made", "framer", "built", "edit", "template", "free")
                .textPhrases("edit template"));

        register(Platform.WEBFLOW, BadgeRules.builder("Webflow")
                .hide(".w-webflow-badge",
                        ".webflow-badge",
                        ".w-badge",
                        ".buy-badge.w-inline-block",
                        "a[href*=\"webflow.com\"]",
                        "a[href*=\"webflow.io\"]",
                        "[data-w-id*=\"badge\"]",
                        "[data-w-id*=\"webflow\"]")
                .remove(".w-webflow-badge", ".webflow-badge", ".buy-badge.w-inline-block", ".w-badge")
                .linkDomains("webflow.com", "webflow.io")
                .linkKeywords("made", "webflow", "built", "template", "free"));

        register(Platform.WORDPRESS, BadgeRules.builder("WordPress")
                .hide(".wp-badge",
                        ".wordpress-badge",
                        ".powered-by",
                        "a[href*=\"wordpress.org\"]",
                        "a[href*=\"wordpress.com\"]",
                        ".site-info a[href*=\"wordpress\"]",
                        ".footer-credits a[href*=\"wordpress\"]",
                        "[class*=\"wp-badge\"]",
                        "[id*=\"wp-badge\"]")
                .remove(".wp-badge", ".wordpress-badge", ".powered-by",
                        "meta[name=generator][content~=(?i)wordpress]")
                .linkDomains("wordpress.org", "wordpress.com")
                .linkKeywords("powered", "wordpress", "built", "made"));

        register(Platform.WIX, BadgeRules.builder("Wix")
                .hide(".wix-badge",
                        ".wix-banner",
                        "a[href*=\"wix.com\"]",
                        "[data-wix-id*=\"badge\"]",
                        "[class*=\"wix-badge\"]",
                        "[id*=\"wix-badge\"]",
                        "div[style*=\"position: fixed\"][style*=\"top\"]")
                // 顶部广告条隐藏后回收其占用的空白
                .css("body { margin-top: 0 !important; padding-top: 0 !important; }")
                .remove(".wix-badge", ".wix-banner")
                .linkDomains("wix.com")
                .linkKeywords("created", "designed", "website", "free", "build"));

        register(Platform.SHOPIFY, BadgeRules.builder("Shopify")
                .hide(".shopify-badge",
                        ".powered-by-shopify",
                        ".shopify-credits",
                        "a[href*=\"shopify.com\"]",
                        ".site-footer a[href*=\"shopify\"]",
                        ".footer a[href*=\"shopify\"]",
                        "[class*=\"shopify-badge\"]",
                        "[id*=\"shopify-badge\"]",
                        "[class*=\"powered-by\"]")
                .remove(".shopify-badge", ".powered-by-shopify", ".shopify-credits")
                .linkDomains("shopify.com")
                .linkKeywords("powered", "shopify", "built", "made")
                .textPhrases("powered by shopify"));

        register(Platform.BOLT, BadgeRules.builder("Bolt")
                .hide(".bolt-badge",
                        ".made-in-bolt",
                        "a[href*=\"bolt.new\"]",
                        "[data-bolt-badge]",
                        "[class*=\"bolt-badge\"]",
                        "[id*=\"bolt-badge\"]")
                .remove(".bolt-badge", ".made-in-bolt", "[data-bolt-badge]")
                .linkDomains("bolt.new", "bolt.host")
                .linkKeywords("made", "bolt", "built", "powered", "created")
                .textPhrases("made in bolt"));

        register(Platform.LOVABLE, BadgeRules.builder("Lovable")
                .hide(".lovable-badge",
                        ".edit-with-lovable",
                        "a[href*=\"lovable.dev\"]",
                        "[data-lovable-badge]",
                        "[class*=\"lovable-badge\"]",
                        "[id*=\"lovable-badge\"]")
                .remove(".lovable-badge", ".edit-with-lovable", "[data-lovable-badge]")
                .linkDomains("lovable.dev")
                .linkKeywords("edit", "lovable", "made"));

        register(Platform.GUMROAD, BadgeRules.builder("Gumroad")
                .hide(".gumroad-badge",
                        ".powered-by-gumroad",
                        "a[href*=\"gumroad.com\"]",
                        "[data-gumroad-badge]",
                        "[class*=\"gumroad-badge\"]",
                        "[id*=\"gumroad-badge\"]")
                .remove(".gumroad-badge", ".powered-by-gumroad")
                .linkDomains("gumroad.com")
                .linkKeywords("powered", "gumroad", "made"));

        register(Platform.REPLIT, BadgeRules.builder("Replit")
                .hide(".replit-badge",
                        "[data-replit-badge]",
                        "[class*=\"replit-badge\"]",
                        "[id*=\"replit-badge\"]",
                        "a[href*=\"replit.com\"]",
                        "script[src*=\"replit-badge\"]")
                .remove("script[src*=replit-badge]", ".replit-badge", "[data-replit-badge]")
                .linkDomains("replit.com")
                .linkKeywords("replit", "made", "run"));

        register(Platform.SQUARESPACE, BadgeRules.builder("Squarespace")
                .hide(".squarespace-badge",
                        ".powered-by-link",
                        ".sqs-svg-logo--wordmark",
                        ".sqs-svg-logo--glyph",
                        "a[href*=\"squarespace.com\"]",
                        "[data-squarespace-badge]",
                        "[class*=\"squarespace-badge\"]",
                        "[id*=\"squarespace-badge\"]")
                .remove(".squarespace-badge", ".powered-by-link")
                .linkDomains("squarespace.com")
                .linkKeywords("powered", "squarespace", "made"));

        register(Platform.NOTION, BadgeRules.builder("Notion")
                .hide(".notion-badge",
                        ".made-with-notion",
                        "a[href*=\"notion.so\"]",
                        "a[href*=\"notion.site\"]",
                        "[data-notion-badge]",
                        "[class*=\"notion-badge\"]",
                        "[id*=\"notion-badge\"]")
                .remove(".notion-badge", ".made-with-notion")
                .linkDomains("notion.so", "notion.site")
                .linkKeywords("notion", "made", "powered"));

        register(Platform.ROCKET, BadgeRules.builder("Rocket")
                .hide(".rocket-badge",
                        ".made-in-rocket",
                        "a[href*=\"rocket.new\"]",
                        "[data-rocket-badge]",
                        "[class*=\"rocket-badge\"]",
                        "[id*=\"rocket-badge\"]")
                .remove(".rocket-badge", ".made-in-rocket")
                .linkDomains("rocket.new")
                .linkKeywords("rocket", "made", "built"));
    }

    private BadgeStrippers() {
    }

    private static void register(Platform platform, BadgeRules.Builder rules) {
        STRIPPERS.put(platform, new RuleBasedBadgeStripper(rules.build()));
    }

    public static BadgeStripper forPlatform(Platform platform) {
        if (platform == null) return NoOpBadgeStripper.INSTANCE;
        return STRIPPERS.getOrDefault(platform, NoOpBadgeStripper.INSTANCE);
    }
}
