package com.wangbin.netboxsync.core.reconcile.model;

/**
 * 单条事实的对账终态
 */
public enum FactState {

    /**
     * 已存在或不满足创建条件，未发起写入
     */
    SKIPPED,

    CREATED,

    FAILED
}
