package com.netwarden.backend.geoip.classify;

import com.netwarden.backend.geoip.config.GeoIpProperties;
import com.netwarden.backend.geoip.model.ConnectionTypes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 第二階段：org 名稱關鍵字規則。
 * 規則照設定清單的順序逐條比對，跨類別也一樣，第一個命中的勝出。
 * provider 的 mobile / hosting flag 視同命中該類別「第一條」規則的位置；
 * 清單裡沒有該類別的規則時，flag 排在所有規則之後。
 * 沒有 org 又沒有 flag → empty（上層回 unknown）；有 org 沒命中 → residential。
 */
@Slf4j
@Order(2)
@Component
public class KeywordRuleStage implements ClassificationStage {

    private static final Set<String> CATEGORIES =
            Set.of(ConnectionTypes.VPN, ConnectionTypes.MOBILE, ConnectionTypes.DATACENTER);

    /** 清單裡沒有對應規則時，flag 的備援順序 */
    private static final List<String> FLAG_FALLBACK_ORDER =
            List.of(ConnectionTypes.MOBILE, ConnectionTypes.DATACENTER);

    /** firstOfCategory：這條是清單中該類別的第一條（flag 在這裡生效） */
    record CompiledRule(String pattern, String category, Pattern regex, boolean firstOfCategory) {
        boolean matches(String orgLower) {
            return regex.matcher(orgLower).find();
        }
    }

    private final List<CompiledRule> rules;

    public KeywordRuleStage(GeoIpProperties props) {
        List<GeoIpProperties.Rule> configured = props.getClassification().getRules();
        List<GeoIpProperties.Rule> source = (configured == null || configured.isEmpty())
                ? DefaultKeywordRules.rules()
                : configured;
        this.rules = compile(source);
        log.info("keyword classification rules loaded. count={} source={}",
                rules.size(), (configured == null || configured.isEmpty()) ? "built-in" : "config");
    }

    private static List<CompiledRule> compile(List<GeoIpProperties.Rule> source) {
        List<CompiledRule> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (GeoIpProperties.Rule r : source) {
            if (r == null || r.getPattern() == null || r.getPattern().isBlank()) continue;
            String category = r.getCategory() == null ? "" : r.getCategory().trim().toLowerCase(Locale.ROOT);
            if (!CATEGORIES.contains(category)) {
                throw new IllegalArgumentException("unknown classification category: " + r.getCategory()
                        + " (pattern=" + r.getPattern() + ")");
            }
            String kw = Pattern.quote(r.getPattern().trim().toLowerCase(Locale.ROOT));
            String regex = r.isWholeWord() ? "(?<![a-z0-9])" + kw + "(?![a-z0-9])" : kw;
            out.add(new CompiledRule(r.getPattern(), category, Pattern.compile(regex), seen.add(category)));
        }
        return List.copyOf(out);
    }

    @Override
    public Optional<Classification> classify(ClassificationInput in) {
        String org = in.asnOrg();
        boolean hasOrg = org != null && !org.isBlank();
        String orgLower = hasOrg ? org.toLowerCase(Locale.ROOT) : "";

        Set<String> withRules = new HashSet<>();
        for (CompiledRule r : rules) {
            withRules.add(r.category());
            if (r.firstOfCategory() && flagFor(r.category(), in)) {
                return Optional.of(Classification.of(r.category(), Classification.Source.PROVIDER_FLAG));
            }
            if (hasOrg && r.matches(orgLower)) {
                return Optional.of(Classification.of(r.category(), Classification.Source.KEYWORD));
            }
        }
        for (String category : FLAG_FALLBACK_ORDER) {
            if (!withRules.contains(category) && flagFor(category, in)) {
                return Optional.of(Classification.of(category, Classification.Source.PROVIDER_FLAG));
            }
        }

        return hasOrg ? Optional.of(Classification.residential()) : Optional.empty();
    }

    private static boolean flagFor(String category, ClassificationInput in) {
        return switch (category) {
            case ConnectionTypes.MOBILE -> in.providerMobile();
            case ConnectionTypes.DATACENTER -> in.providerHosting();
            default -> false;
        };
    }

    List<CompiledRule> rules() {
        return rules;
    }
}
