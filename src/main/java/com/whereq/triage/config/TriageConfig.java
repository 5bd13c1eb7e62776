package com.whereq.triage.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Core beans: the frozen tier catalog and the clock used for peak-hour decisions.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Configuration
@EnableScheduling
public class TriageConfig {

    @Bean
    public QueueTierCatalog queueTierCatalog(TriageProperties properties) {
        QueueTierCatalog catalog = QueueTierCatalog.from(properties.getTiers());
        log.info("Loaded {} queue tiers", catalog.asMap().size());
        return catalog;
    }

    @Bean
    public Clock clock(TriageProperties properties) {
        return Clock.system(ZoneId.of(properties.getTimeZone()));
    }
}
