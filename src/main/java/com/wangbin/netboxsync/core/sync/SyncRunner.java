package com.wangbin.netboxsync.core.sync;

import com.wangbin.netboxsync.core.config.SyncProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * 单次执行模式：启动后同步一次，退出码反映同步结果。
 */
@Slf4j
@Component
public class SyncRunner implements CommandLineRunner, ExitCodeGenerator {

    private final DiscoverySyncService syncService;
    private final SyncProperties properties;

    private volatile int exitCode = SyncReport.EXIT_OK;

    public SyncRunner(DiscoverySyncService syncService, SyncProperties properties) {
        this.syncService = syncService;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        if (properties.getSchedule().isEnabled()) {
            log.info("已启用定时同步，间隔={}ms", properties.getSchedule().getIntervalMs());
            return;
        }
        try {
            SyncReport report = syncService.run();
            exitCode = report.exitCode();
        } catch (RuntimeException e) {
            log.error("同步异常终止：{}", e.getMessage(), e);
            exitCode = SyncReport.EXIT_ABORTED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
