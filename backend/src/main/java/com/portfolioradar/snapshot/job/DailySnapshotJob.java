package com.portfolioradar.snapshot.job;

import com.portfolioradar.config.AsyncConfig;
import com.portfolioradar.snapshot.BackfillReport;
import com.portfolioradar.snapshot.SnapshotBackfillService;
import com.portfolioradar.snapshot.config.SnapshotProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.concurrent.Executor;

/**
 * Snapshots every asset once a day (default 21:00 in the snapshot zone) and, on startup, fills the trailing window
 * so gaps from downtime close themselves.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DailySnapshotJob {

    private final SnapshotBackfillService snapshotBackfillService;
    private final SnapshotProperties snapshotProperties;
    @Qualifier(AsyncConfig.BACKFILL_EXECUTOR)
    private final Executor backfillExecutor;

    @Scheduled(cron = "${portfolioradar.snapshot.daily-cron:0 0 21 * * *}", zone = "${portfolioradar.snapshot.zone:UTC}")
    public void snapshotToday() {
        LocalDate today = snapshotBackfillService.today();
        try {
            BackfillReport report = snapshotBackfillService.backfill(SnapshotBackfillService.ALL_ASSETS, today, today);
            if (report.hasErrors()) {
                log.warn("Daily snapshot {} finished with {} error(s)", today, report.errors().size());
            }
        } catch (RuntimeException e) {
            log.error("Daily snapshot {} failed", today, e);
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void backfillOnStartup() {
        SnapshotProperties.Backfill cfg = snapshotProperties.getBackfill();
        if (!cfg.isOnStartup() || cfg.getStartupDays() <= 0) {
            return;
        }
        backfillExecutor.execute(this::backfillTrailingWindow);
    }

    void backfillTrailingWindow() {
        LocalDate today = snapshotBackfillService.today();
        LocalDate from = today.minusDays(snapshotProperties.getBackfill().getStartupDays() - 1L);
        try {
            snapshotBackfillService.backfill(SnapshotBackfillService.ALL_ASSETS, from, today);
        } catch (RuntimeException e) {
            log.error("Startup backfill {}..{} failed", from, today, e);
        }
    }
}
