package com.vybescope.alert.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(AlertProperties.class)
@Slf4j
public class AlertConfig {

    /**
     * Fails startup with ConfigurationException on invalid intervals.
     */
    @Bean
    public PollSchedule pollSchedule(AlertProperties properties) {
        PollSchedule schedule = PollSchedule.from(properties);
        log.info("Poll schedule: wallet-tracking every {}s (enabled={}), whale-alert every {}s (enabled={}), dedup retention {}",
                schedule.walletTracking().interval().toSeconds(), schedule.walletTracking().enabled(),
                schedule.whaleAlert().interval().toSeconds(), schedule.whaleAlert().enabled(),
                schedule.dedupRetention());
        return schedule;
    }
}
