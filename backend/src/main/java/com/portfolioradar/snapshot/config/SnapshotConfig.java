package com.portfolioradar.snapshot.config;

import com.portfolioradar.common.RateLimiter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties(SnapshotProperties.class)
public class SnapshotConfig {

    public static final String BACKFILL_PACER = "backfillPacer";

    @Bean(name = BACKFILL_PACER)
    public RateLimiter backfillPacer(SnapshotProperties snapshotProperties) {
        return RateLimiter.perMinute(snapshotProperties.getBackfill().getAssetsPerMinute());
    }

    /**
     * "Today" for snapshots, in the snapshot zone.
     */
    @Bean
    public Clock snapshotClock(SnapshotProperties snapshotProperties) {
        return Clock.system(ZoneId.of(snapshotProperties.getZone()));
    }
}
