package com.netwarden.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/** ✅ 全站共用 UTC Clock：service / scheduler 都注入它，測試可換成 fixed clock */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
