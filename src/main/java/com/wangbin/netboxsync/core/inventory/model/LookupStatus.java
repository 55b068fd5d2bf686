package com.wangbin.netboxsync.core.inventory.model;

/**
 * 资产库存在性查询结果
 */
public enum LookupStatus {

    FOUND,

    NOT_FOUND,

    /**
     * 查询本身失败，无法判断记录是否存在
     */
    QUERY_FAILED
}
