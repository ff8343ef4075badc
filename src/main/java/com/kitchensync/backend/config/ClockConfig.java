package com.kitchensync.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /** ✅ 統一 UTC；測試可用 @Primary 的固定 Clock 覆蓋 */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
