package com.netwarden.backend.geoip.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "app.geoip")
public class GeoIpProperties {

    /** DB 內的 ip_metadata 多久內算新鮮（預設 30 天） */
    private Duration freshness = Duration.ofDays(30);

    private MemoryCache memoryCache = new MemoryCache();
    private Remote remote = new Remote();
    private MaxMind maxmind = new MaxMind();
    private Classification classification = new Classification();

    public Duration getFreshness() { return freshness; }
    public void setFreshness(Duration freshness) { this.freshness = freshness; }

    public MemoryCache getMemoryCache() { return memoryCache; }
    public void setMemoryCache(MemoryCache memoryCache) { this.memoryCache = memoryCache; }

    public Remote getRemote() { return remote; }
    public void setRemote(Remote remote) { this.remote = remote; }

    public MaxMind getMaxmind() { return maxmind; }
    public void setMaxmind(MaxMind maxmind) { this.maxmind = maxmind; }

    public Classification getClassification() { return classification; }
    public void setClassification(Classification classification) { this.classification = classification; }

    public static class MemoryCache {
        private Duration ttl = Duration.ofHours(24);
        private long maxSize = 100_000;

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }

        public long getMaxSize() { return maxSize; }
        public void setMaxSize(long maxSize) { this.maxSize = maxSize; }
    }

    public static class Remote {
        private boolean enabled = true;

        /** ip-api.com 免費版：45 req/min → 每次至少間隔 1.5 秒 */
        private Duration minInterval = Duration.ofMillis(1500);

        private String fields = "status,message,country,countryCode,region,regionName,city,lat,lon,"
                + "timezone,as,asname,isp,org,mobile,proxy,hosting,query";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getMinInterval() { return minInterval; }
        public void setMinInterval(Duration minInterval) { this.minInterval = minInterval; }

        public String getFields() { return fields; }
        public void setFields(String fields) { this.fields = fields; }
    }

    public static class MaxMind {
        /** GeoLite2-City.mmdb 路徑；空白 = 不啟用本地庫 */
        private String cityDb = "";

        /** GeoLite2-ASN.mmdb 路徑（可選） */
        private String asnDb = "";

        public String getCityDb() { return cityDb; }
        public void setCityDb(String cityDb) { this.cityDb = cityDb; }

        public String getAsnDb() { return asnDb; }
        public void setAsnDb(String asnDb) { this.asnDb = asnDb; }
    }

    public static class Classification {
        /** asn_registry 只對這個國家的 IP 生效 */
        private String registryCountry = "RU";

        /** 依清單順序比對 org 名稱，跨類別也一樣，第一個命中勝出；空 = 用內建清單 */
        private List<Rule> rules = new ArrayList<>();

        public String getRegistryCountry() { return registryCountry; }
        public void setRegistryCountry(String registryCountry) { this.registryCountry = registryCountry; }

        public List<Rule> getRules() { return rules; }
        public void setRules(List<Rule> rules) { this.rules = rules; }
    }

    public static class Rule {
        private String pattern;
        /** vpn / mobile / datacenter */
        private String category;
        /** true：前後不能接英數字（短關鍵字如 ee / o2 用） */
        private boolean wholeWord;

        public Rule() {}

        public Rule(String pattern, String category, boolean wholeWord) {
            this.pattern = pattern;
            this.category = category;
            this.wholeWord = wholeWord;
        }

        public String getPattern() { return pattern; }
        public void setPattern(String pattern) { this.pattern = pattern; }

        public String getCategory() { return category; }
        public void setCategory(String category) { this.category = category; }

        public boolean isWholeWord() { return wholeWord; }
        public void setWholeWord(boolean wholeWord) { this.wholeWord = wholeWord; }
    }
}
