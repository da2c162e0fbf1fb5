package com.netwarden.backend.geoip.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GeoIpCacheConfig {

    public static final String CACHE_IP_METADATA = "ipMetadata";

    @Bean("geoIpCacheManager")
    public CacheManager geoIpCacheManager(GeoIpProperties props) {
        CaffeineCacheManager mgr = new CaffeineCacheManager(CACHE_IP_METADATA);
        mgr.setCaffeine(Caffeine.newBuilder()
                .expireAfterWrite(props.getMemoryCache().getTtl())
                .maximumSize(props.getMemoryCache().getMaxSize())
        );
        // sentinel / miss 不進 cache
        mgr.setAllowNullValues(false);
        return mgr;
    }
}
