package com.netwarden.backend.geoip.limiter;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * ✅ 遠端 GeoIP provider 的最小間隔閘門（process 內共用一個）
 * - acquire() 會等到距離上一次放行滿 minInterval 才回來
 * - 用 monotonic clock（nanoTime），不受系統時間調整影響
 * - 等待可被 interrupt（關機時不會卡住）
 * 多機部署要全域限流：換成 Redis / Bucket4j 這類共享 gate。
 */
@Component
public class RemoteLookupGate {

    private final long minIntervalNanos;

    private long lastPermitNanos;
    private boolean issued;

    public RemoteLookupGate(@Value("${app.geoip.remote.min-interval:PT1.5S}") Duration minInterval) {
        this.minIntervalNanos = Math.max(0L, minInterval.toNanos());
    }

    public synchronized void acquire() throws InterruptedException {
        if (issued) {
            long waitNanos = lastPermitNanos + minIntervalNanos - System.nanoTime();
            while (waitNanos > 0) {
                TimeUnit.NANOSECONDS.sleep(waitNanos);
                waitNanos = lastPermitNanos + minIntervalNanos - System.nanoTime();
            }
        }
        lastPermitNanos = System.nanoTime();
        issued = true;
    }

    public Duration getMinInterval() {
        return Duration.ofNanos(minIntervalNanos);
    }
}
