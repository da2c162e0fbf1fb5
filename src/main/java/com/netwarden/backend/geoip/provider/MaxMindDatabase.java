package com.netwarden.backend.geoip.provider;

import com.maxmind.db.CHMCache;
import com.maxmind.geoip2.DatabaseReader;
import com.maxmind.geoip2.exception.GeoIp2Exception;
import com.maxmind.geoip2.model.AsnResponse;
import com.maxmind.geoip2.model.CityResponse;
import com.netwarden.backend.geoip.config.GeoIpProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.net.InetAddress;
import java.util.Optional;

/**
 * 本地 GeoLite2 City（+ 可選 ASN）資料庫。檔案不存在就當作沒有本地庫，直接走遠端。
 * DB 檔更新不在這裡做（由部署流程替換檔案後重啟）。
 */
@Slf4j
@Component
public class MaxMindDatabase implements AutoCloseable {

    public record Result(
            String countryCode,
            String countryName,
            String region,
            String city,
            Double latitude,
            Double longitude,
            String timezone,
            Long asn,
            String asnOrg
    ) {}

    private final DatabaseReader cityReader;
    private final DatabaseReader asnReader;

    public MaxMindDatabase(GeoIpProperties props) {
        this.cityReader = open(props.getMaxmind().getCityDb(), "city");
        this.asnReader = open(props.getMaxmind().getAsnDb(), "asn");
    }

    private static DatabaseReader open(String path, String kind) {
        if (path == null || path.isBlank()) return null;
        File f = new File(path.trim());
        if (!f.isFile()) {
            log.info("maxmind {} db not found, local lookup disabled. path={}", kind, f.getAbsolutePath());
            return null;
        }
        try {
            DatabaseReader r = new DatabaseReader.Builder(f).withCache(new CHMCache()).build();
            log.info("maxmind {} db loaded. type={} path={}", kind, r.getMetadata().getDatabaseType(), f.getAbsolutePath());
            return r;
        } catch (IOException e) {
            log.warn("maxmind {} db open failed. path={} err={}", kind, f.getAbsolutePath(), e.toString());
            return null;
        }
    }

    public boolean isAvailable() {
        return cityReader != null;
    }

    /**
     * @return City 庫沒有這個 IP → empty
     */
    public Optional<Result> lookup(InetAddress address) throws IOException, GeoIp2Exception {
        if (cityReader == null || address == null) return Optional.empty();

        Optional<CityResponse> city = cityReader.tryCity(address);
        if (city.isEmpty()) return Optional.empty();
        CityResponse c = city.get();

        Long asn = null;
        String asnOrg = null;
        if (asnReader != null) {
            Optional<AsnResponse> a = asnReader.tryAsn(address);
            if (a.isPresent()) {
                asn = a.get().getAutonomousSystemNumber();
                asnOrg = a.get().getAutonomousSystemOrganization();
            }
        }

        return Optional.of(new Result(
                c.getCountry().getIsoCode(),
                c.getCountry().getName(),
                c.getMostSpecificSubdivision().getName(),
                c.getCity().getName(),
                c.getLocation().getLatitude(),
                c.getLocation().getLongitude(),
                c.getLocation().getTimeZone(),
                asn,
                asnOrg
        ));
    }

    @PreDestroy
    @Override
    public void close() {
        closeQuietly(cityReader, "city");
        closeQuietly(asnReader, "asn");
    }

    private static void closeQuietly(DatabaseReader r, String kind) {
        if (r == null) return;
        try {
            r.close();
        } catch (IOException e) {
            log.warn("maxmind {} db close failed: {}", kind, e.toString());
        }
    }
}
