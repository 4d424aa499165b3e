package com.portfolioradar.snapshot.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Daily snapshot and backfill configuration.
 */
@ConfigurationProperties(prefix = "portfolioradar.snapshot")
@NoArgsConstructor
@Getter
@Setter
public class SnapshotProperties {

    /**
     * Zone that turns transaction instants into calendar days, and in which the daily job fires.
     */
    private String zone = "UTC";

    /**
     * Cron for the daily snapshot of all assets. Default 21:00.
     */
    private String dailyCron = "0 0 21 * * *";

    private Backfill backfill = new Backfill();

    private Estimator estimator = new Estimator();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Backfill {

        /**
         * Assets processed concurrently on the backfill-executor. 1 runs assets sequentially with pacing.
         */
        private int parallelism = 1;

        /**
         * Pacing between assets in sequential mode.
         */
        private int assetsPerMinute = 60;

        /** Backfill a trailing window once the application is ready. */
        private boolean onStartup = true;

        /** Trailing window size in days, today included. */
        private int startupDays = 30;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Estimator {

        /** Largest day-over-day move of an estimated price, as a fraction (0.05 = 5%). */
        private BigDecimal maxDailyChangePct = new BigDecimal("0.05");

        /** Largest distance from the anchor price, as a fraction. */
        private BigDecimal maxDriftPct = new BigDecimal("0.50");
    }
}
