package com.brokerage.revshare.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class TimeConfig {

    @Bean
    public Clock clock(RevenueShareProperties properties) {
        return Clock.system(ZoneId.of(properties.getTimeZone()));
    }
}
