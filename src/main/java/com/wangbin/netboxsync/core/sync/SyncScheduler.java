package com.wangbin.netboxsync.core.sync;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定时同步：固定延迟执行，前一次结束后才开始计时，两次同步不会重叠。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "netbox-sync.schedule", name = "enabled", havingValue = "true")
public class SyncScheduler {

    private final DiscoverySyncService syncService;

    public SyncScheduler(DiscoverySyncService syncService) {
        this.syncService = syncService;
    }

    @Scheduled(fixedDelayString = "${netbox-sync.schedule.interval-ms:600000}")
    public void scheduledSync() {
        SyncReport report = syncService.run();
        if (report.exitCode() != SyncReport.EXIT_OK) {
            log.warn("定时同步未完全成功，exitCode={}", report.exitCode());
        }
    }
}
