package com.wangbin.netboxsync.core.sync;

import com.wangbin.netboxsync.common.exception.BusinessException;
import com.wangbin.netboxsync.core.extract.model.Subnet;
import com.wangbin.netboxsync.core.extract.model.VlanInterface;
import com.wangbin.netboxsync.core.reconcile.model.FactOutcome;
import com.wangbin.netboxsync.core.reconcile.model.FactState;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 一次同步的汇总结果
 */
@Getter
public class SyncReport {

    public static final int EXIT_OK = 0;
    public static final int EXIT_PARTIAL_FAILURE = 1;
    public static final int EXIT_ABORTED = 2;

    private final List<VlanInterface> vlans;
    private final List<Subnet> subnets;
    private final List<FactOutcome> outcomes;

    /**
     * 导致本次同步终止的异常，正常完成时为 null
     */
    private final BusinessException fatalError;

    private final long costTime;

    private SyncReport(List<VlanInterface> vlans, List<Subnet> subnets, List<FactOutcome> outcomes,
                       BusinessException fatalError, long costTime) {
        this.vlans = vlans;
        this.subnets = subnets;
        this.outcomes = outcomes;
        this.fatalError = fatalError;
        this.costTime = costTime;
    }

    public static SyncReport completed(List<VlanInterface> vlans, List<Subnet> subnets,
                                       List<FactOutcome> outcomes, long costTime) {
        return new SyncReport(List.copyOf(vlans), List.copyOf(subnets), List.copyOf(outcomes), null, costTime);
    }

    public static SyncReport aborted(BusinessException error, long costTime) {
        return new SyncReport(Collections.emptyList(), Collections.emptyList(), Collections.emptyList(),
                error, costTime);
    }

    public boolean isAborted() {
        return fatalError != null;
    }

    public long count(FactState state) {
        return outcomes.stream().filter(outcome -> outcome.getState() == state).count();
    }

    public int exitCode() {
        if (isAborted()) {
            return EXIT_ABORTED;
        }
        return count(FactState.FAILED) > 0 ? EXIT_PARTIAL_FAILURE : EXIT_OK;
    }
}
