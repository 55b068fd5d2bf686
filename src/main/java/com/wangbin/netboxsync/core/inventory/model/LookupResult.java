package com.wangbin.netboxsync.core.inventory.model;

import lombok.Getter;
import lombok.ToString;

/**
 * 存在性查询结果，区分“确认不存在”与“查询失败”。
 */
@Getter
@ToString
public class LookupResult {

    private final LookupStatus status;
    private final Integer statusCode;
    private final String errorMessage;

    private LookupResult(LookupStatus status, Integer statusCode, String errorMessage) {
        this.status = status;
        this.statusCode = statusCode;
        this.errorMessage = errorMessage;
    }

    public static LookupResult found() {
        return new LookupResult(LookupStatus.FOUND, 200, null);
    }

    public static LookupResult notFound() {
        return new LookupResult(LookupStatus.NOT_FOUND, 200, null);
    }

    public static LookupResult failed(Integer statusCode, String errorMessage) {
        return new LookupResult(LookupStatus.QUERY_FAILED, statusCode, errorMessage);
    }

    public boolean isFound() {
        return status == LookupStatus.FOUND;
    }

    public boolean isFailed() {
        return status == LookupStatus.QUERY_FAILED;
    }
}
