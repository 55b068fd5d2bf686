package com.wangbin.netboxsync.core.sync;

import com.wangbin.netboxsync.common.exception.SnmpWalkException;
import com.wangbin.netboxsync.core.config.SyncProperties;
import com.wangbin.netboxsync.core.reconcile.model.FactOutcome;
import com.wangbin.netboxsync.core.reconcile.model.FactState;
import com.wangbin.netboxsync.core.reconcile.model.FactType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SyncRunnerTest {

    private DiscoverySyncService syncService;
    private SyncProperties props;
    private SyncRunner runner;

    @BeforeEach
    void setUp() {
        syncService = mock(DiscoverySyncService.class);
        props = new SyncProperties();
        runner = new SyncRunner(syncService, props);
    }

    @Test
    void successfulRunExitsOk() {
        when(syncService.run()).thenReturn(report(FactState.CREATED, FactState.SKIPPED));

        runner.run();

        assertEquals(SyncReport.EXIT_OK, runner.getExitCode());
        verify(syncService, times(1)).run();
    }

    @Test
    void failedFactExitsWithPartialFailure() {
        when(syncService.run()).thenReturn(report(FactState.CREATED, FactState.FAILED));

        runner.run();

        assertEquals(SyncReport.EXIT_PARTIAL_FAILURE, runner.getExitCode());
    }

    @Test
    void abortedRunExitsWithAborted() {
        when(syncService.run()).thenReturn(SyncReport.aborted(
                SnmpWalkException.timeout("10.0.0.1/161", "1.3.6.1.2.1.2.2.1.2"), 3000L));

        runner.run();

        assertEquals(SyncReport.EXIT_ABORTED, runner.getExitCode());
    }

    @Test
    void unexpectedExceptionExitsWithAborted() {
        when(syncService.run()).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> runner.run());
        assertEquals(SyncReport.EXIT_ABORTED, runner.getExitCode());
    }

    @Test
    void scheduledModeSkipsTheOneShotRun() {
        props.getSchedule().setEnabled(true);

        runner.run();

        assertEquals(SyncReport.EXIT_OK, runner.getExitCode());
        verifyNoInteractions(syncService);
    }

    @Test
    void schedulerExistsOnlyWhenEnabled() {
        ApplicationContextRunner contextRunner = new ApplicationContextRunner()
                .withBean(DiscoverySyncService.class, () -> syncService)
                .withUserConfiguration(SyncScheduler.class);

        contextRunner.run(context ->
                assertTrue(context.getBeansOfType(SyncScheduler.class).isEmpty()));
        contextRunner.withPropertyValues("netbox-sync.schedule.enabled=false").run(context ->
                assertTrue(context.getBeansOfType(SyncScheduler.class).isEmpty()));
        contextRunner.withPropertyValues("netbox-sync.schedule.enabled=true").run(context ->
                assertEquals(1, context.getBeansOfType(SyncScheduler.class).size()));
    }

    @Test
    void scheduledSyncRunsTheService() {
        when(syncService.run()).thenReturn(report(FactState.FAILED));

        new SyncScheduler(syncService).scheduledSync();

        verify(syncService, times(1)).run();
    }

    private static SyncReport report(FactState... states) {
        List<FactOutcome> outcomes = Arrays.stream(states)
                .map(state -> FactOutcome.builder()
                        .type(FactType.VLAN)
                        .key("1000")
                        .name("ae0.1000")
                        .state(state)
                        .build())
                .toList();
        return SyncReport.completed(List.of(), List.of(), outcomes, 10L);
    }
}
