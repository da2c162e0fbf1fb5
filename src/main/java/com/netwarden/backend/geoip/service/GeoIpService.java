package com.netwarden.backend.geoip.service;

import com.maxmind.geoip2.exception.GeoIp2Exception;
import com.netwarden.backend.common.status.SyncMetadataEntity;
import com.netwarden.backend.common.status.SyncStatusService;
import com.netwarden.backend.geoip.classify.Classification;
import com.netwarden.backend.geoip.classify.ClassificationInput;
import com.netwarden.backend.geoip.classify.ProviderClassifier;
import com.netwarden.backend.geoip.config.GeoIpCacheConfig;
import com.netwarden.backend.geoip.config.GeoIpProperties;
import com.netwarden.backend.geoip.entity.IpMetadataEntity;
import com.netwarden.backend.geoip.limiter.RemoteLookupGate;
import com.netwarden.backend.geoip.model.ConnectionTypes;
import com.netwarden.backend.geoip.model.IpMetadata;
import com.netwarden.backend.geoip.provider.GeoIpHttpException;
import com.netwarden.backend.geoip.provider.GeoIpParseException;
import com.netwarden.backend.geoip.provider.IpApiClient;
import com.netwarden.backend.geoip.provider.IpApiResult;
import com.netwarden.backend.geoip.provider.MaxMindDatabase;
import com.netwarden.backend.geoip.repo.IpMetadataRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.net.InetAddress;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * IP → 地理 / 業者資訊，五層 cascade：
 * 1) private / internal → sentinel（不 cache、不存）
 * 2) 記憶體 cache（Caffeine, 24h）
 * 3) ip_metadata 表（last_checked_at 在 freshness 內才算數）
 * 4) 本地 MaxMind
 * 5) 遠端 ip-api（經過 RemoteLookupGate）
 * 任一層出錯只記 log，當作 miss 往下一層；全部 miss → empty。
 */
@Slf4j
@Service
public class GeoIpService {

    private final IpMetadataRepository repo;
    private final MaxMindDatabase maxMind;
    private final IpApiClient remote;
    private final RemoteLookupGate gate;
    private final ProviderClassifier classifier;
    private final GeoIpProperties props;
    private final SyncStatusService syncStatus;
    private final Cache cache;
    private final Clock clock;

    public GeoIpService(
            IpMetadataRepository repo,
            MaxMindDatabase maxMind,
            IpApiClient remote,
            RemoteLookupGate gate,
            ProviderClassifier classifier,
            GeoIpProperties props,
            SyncStatusService syncStatus,
            @Qualifier("geoIpCacheManager") CacheManager cacheManager,
            Clock clock
    ) {
        this.repo = repo;
        this.maxMind = maxMind;
        this.remote = remote;
        this.gate = gate;
        this.classifier = classifier;
        this.props = props;
        this.syncStatus = syncStatus;
        this.cache = Objects.requireNonNull(cacheManager.getCache(GeoIpCacheConfig.CACHE_IP_METADATA),
                "cache " + GeoIpCacheConfig.CACHE_IP_METADATA + " missing");
        this.clock = clock;
    }

    public Optional<IpMetadata> lookup(String ip) {
        return lookup(ip, true);
    }

    /**
     * @param useCache false = 跳過記憶體 cache（DB 以下照常）
     */
    public Optional<IpMetadata> lookup(String ip, boolean useCache) {
        InetAddress address = IpAddresses.parse(ip);
        if (address == null) {
            log.debug("geoip lookup skipped: not an ip literal. raw={}", ip);
            return Optional.empty();
        }
        String key = IpAddresses.normalize(ip);

        // 1) private
        if (IpAddresses.isPrivate(address)) {
            return Optional.of(IpMetadata.privateNetwork(key));
        }

        // 2) memory
        if (useCache) {
            IpMetadata hit = cache.get(key, IpMetadata.class);
            if (hit != null) {
                log.debug("geoip memory hit. ip={}", key);
                return Optional.of(hit.withSource("memory"));
            }
        }

        // 3) database
        Optional<IpMetadata> stored = fromStore(key);
        if (stored.isPresent()) {
            cache.put(key, stored.get());
            return stored;
        }

        // 4) + 5)
        return resolveFromProviders(key, address);
    }

    /**
     * 批次查詢：private / cache 先解，剩下的用「一次」findAllById 撈 DB，
     * 還是沒有（或過期）的才逐筆走 MaxMind / 遠端。
     */
    public Map<String, IpMetadata> lookupBatch(Collection<String> ips) {
        Map<String, IpMetadata> out = new LinkedHashMap<>();
        if (ips == null || ips.isEmpty()) return out;

        Set<String> pending = new LinkedHashSet<>();
        for (String raw : ips) {
            InetAddress address = IpAddresses.parse(raw);
            if (address == null) continue;
            String key = IpAddresses.normalize(raw);
            if (out.containsKey(key)) continue;

            if (IpAddresses.isPrivate(address)) {
                out.put(key, IpMetadata.privateNetwork(key));
                continue;
            }
            IpMetadata hit = cache.get(key, IpMetadata.class);
            if (hit != null) {
                out.put(key, hit.withSource("memory"));
                continue;
            }
            pending.add(key);
        }
        if (pending.isEmpty()) return out;

        Instant now = Instant.now(clock);
        int fromDb = 0;
        try {
            for (IpMetadataEntity e : repo.findAllById(pending)) {
                if (!e.isFresh(now, props.getFreshness())) continue;
                IpMetadata m = e.toModel();
                cache.put(e.getIpAddress(), m);
                out.put(e.getIpAddress(), m);
                pending.remove(e.getIpAddress());
                fromDb++;
            }
        } catch (DataAccessException ex) {
            log.warn("geoip batch store query failed, resolving individually. size={} err={}", pending.size(), ex.toString());
        }

        int fromProviders = 0;
        List<String> unresolved = new ArrayList<>();
        for (String key : pending) {
            Optional<IpMetadata> m = resolveFromProviders(key, IpAddresses.parse(key));
            if (m.isPresent()) {
                out.put(key, m.get());
                fromProviders++;
            } else {
                unresolved.add(key);
            }
        }

        if (!unresolved.isEmpty()) {
            log.info("geoip batch: {} ip(s) unresolved, first={}", unresolved.size(), unresolved.get(0));
        }
        syncStatus.record(
                SyncStatusService.KEY_GEOIP_BATCH,
                unresolved.isEmpty() ? SyncMetadataEntity.SyncStatus.SUCCESS : SyncMetadataEntity.SyncStatus.FAILED,
                fromDb + fromProviders,
                unresolved.isEmpty() ? null : "unresolved=" + unresolved.size()
        );
        return out;
    }

    public void clearCache() {
        cache.clear();
        log.info("geoip memory cache cleared");
    }

    public boolean hasLocalDatabase() {
        return maxMind.isAvailable();
    }

    // ===== tiers =====

    private Optional<IpMetadata> fromStore(String key) {
        try {
            Optional<IpMetadataEntity> row = repo.findById(key);
            if (row.isEmpty()) return Optional.empty();
            if (!row.get().isFresh(Instant.now(clock), props.getFreshness())) {
                log.debug("geoip store row stale. ip={} checkedAt={}", key, row.get().getLastCheckedAt());
                return Optional.empty();
            }
            return Optional.of(row.get().toModel());
        } catch (DataAccessException ex) {
            log.warn("geoip store read failed. ip={} err={}", key, ex.toString());
            return Optional.empty();
        }
    }

    private Optional<IpMetadata> resolveFromProviders(String key, InetAddress address) {
        Optional<IpMetadata> local = fromMaxMind(key, address);
        if (local.isPresent()) return Optional.of(remember(local.get()));

        Optional<IpMetadata> fetched = fromRemote(key);
        return fetched.map(this::remember);
    }

    private Optional<IpMetadata> fromMaxMind(String key, InetAddress address) {
        if (!maxMind.isAvailable()) return Optional.empty();
        try {
            return maxMind.lookup(address).map(r -> {
                Classification c = classifier.classify(new ClassificationInput(
                        r.asn(), r.asnOrg(), r.countryCode(), false, false));
                return build(key, r.countryCode(), r.countryName(), r.region(), r.city(),
                        r.latitude(), r.longitude(), r.timezone(), r.asn(), r.asnOrg(),
                        c, false, false, false, "maxmind");
            });
        } catch (IOException | GeoIp2Exception | RuntimeException ex) {
            log.warn("maxmind lookup failed. ip={} err={}", key, ex.toString());
            return Optional.empty();
        }
    }

    private Optional<IpMetadata> fromRemote(String key) {
        if (!props.getRemote().isEnabled()) return Optional.empty();
        try {
            gate.acquire();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.debug("geoip remote lookup interrupted while waiting for gate. ip={}", key);
            return Optional.empty();
        }

        try {
            return remote.lookup(key).map(r -> {
                Classification c = classifier.classify(new ClassificationInput(
                        r.asn(), r.asnOrg(), r.countryCode(), r.mobile(), r.hosting()));
                return build(key, r.countryCode(), r.country(), r.regionName(), r.city(),
                        r.lat(), r.lon(), r.timezone(), r.asn(), r.asnOrg(),
                        c, r.proxy(), r.mobile(), r.hosting(), "ip-api");
            });
        } catch (GeoIpHttpException ex) {
            log.warn("geoip remote http error. ip={} status={} body={}", key, ex.getStatus(), ex.getBodySnippet());
        } catch (GeoIpParseException ex) {
            log.warn("geoip remote parse error. ip={} code={} msg={}", key, ex.getCode(), ex.getMessage());
        } catch (RestClientException ex) {
            log.warn("geoip remote call failed. ip={} err={}", key, ex.toString());
        }
        return Optional.empty();
    }

    private IpMetadata build(
            String key,
            String countryCode,
            String countryName,
            String region,
            String city,
            Double lat,
            Double lon,
            String timezone,
            Long asn,
            String asnOrg,
            Classification c,
            boolean providerProxy,
            boolean providerMobile,
            boolean providerHosting,
            String source
    ) {
        String type = c.connectionType() == null ? ConnectionTypes.UNKNOWN : c.connectionType();
        return IpMetadata.builder()
                .ipAddress(key)
                .countryCode(countryCode)
                .countryName(countryName)
                // registry 命中時 region / city 以 registry 為準
                .region(c.region() != null ? c.region() : region)
                .city(c.city() != null ? c.city() : city)
                .latitude(lat)
                .longitude(lon)
                .timezone(timezone)
                .asn(asn)
                .asnOrg(asnOrg)
                .connectionType(type)
                .proxy(providerProxy)
                .vpn(c.vpn())
                .tor(false)
                .hosting(c.datacenter() || providerHosting)
                .mobile(c.mobile() || providerMobile)
                .lastCheckedAt(Instant.now(clock))
                .source(source)
                .build();
    }

    /** 新查到的結果：寫 DB（失敗只 log）+ 放進記憶體 cache */
    private IpMetadata remember(IpMetadata m) {
        try {
            IpMetadataEntity row = repo.findById(m.ipAddress()).orElseGet(() -> {
                IpMetadataEntity e = new IpMetadataEntity();
                e.setIpAddress(m.ipAddress());
                return e;
            });
            row.apply(m, m.lastCheckedAt());
            repo.save(row);
        } catch (DataAccessException ex) {
            log.warn("geoip store write failed. ip={} err={}", m.ipAddress(), ex.toString());
        }
        cache.put(m.ipAddress(), m);
        return m;
    }
}
