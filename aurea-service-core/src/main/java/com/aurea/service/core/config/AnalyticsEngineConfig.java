package com.aurea.service.core.config;

import com.aurea.service.core.bucket.TimeBucketer;
import java.time.Clock;
import java.time.ZoneId;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnalyticsEngineConfig {

    @Bean
    public Clock systemUtcClock() {
        return Clock.systemUTC();
    }

    @Bean
    public TimeBucketer timeBucketer(AnalyticsProperties properties) {
        return new TimeBucketer(ZoneId.of(properties.getBuckets().getZone()));
    }
}
