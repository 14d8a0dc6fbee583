package com.cragmate.x.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;


@Configuration
@Slf4j
public class Beans {

    // "today" for upcoming trip resolution is taken in this zone
    @Bean
    public Clock clock(@Value("${matching.zone-id:UTC}") String zoneId) {
        log.info("Matching clock zone set to {}", zoneId);
        return Clock.system(ZoneId.of(zoneId));
    }
}
