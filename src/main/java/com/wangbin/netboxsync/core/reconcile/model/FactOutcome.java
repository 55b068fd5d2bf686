package com.wangbin.netboxsync.core.reconcile.model;

import com.wangbin.netboxsync.common.enums.ResultCode;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 单条事实的对账结果
 */
@Getter
@Builder
@ToString
public class FactOutcome {

    private final FactType type;

    /**
     * VLAN 为 VID，前缀为 CIDR
     */
    private final String key;

    private final String name;

    private final FactState state;

    private final Integer statusCode;

    private final String message;

    private final ResultCode resultCode;

    /**
     * 写入请求耗时（毫秒），未发起写入时为 null
     */
    private final Long costTime;

    public boolean isFailed() {
        return state == FactState.FAILED;
    }
}
