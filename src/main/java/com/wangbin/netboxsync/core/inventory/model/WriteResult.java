package com.wangbin.netboxsync.core.inventory.model;

import lombok.Data;

/**
 * 资产库写入结果
 */
@Data
public class WriteResult {
    private boolean success;          // 是否成功
    private Integer statusCode;       // HTTP状态码，传输失败时为-1
    private String responseData;      // 响应数据
    private String errorMessage;      // 错误信息
    private long costTime;            // 耗时（毫秒）

    // 成功结果
    public static WriteResult success(int statusCode, String responseData) {
        WriteResult result = new WriteResult();
        result.setSuccess(true);
        result.setStatusCode(statusCode);
        result.setResponseData(responseData);
        return result;
    }

    // 错误结果
    public static WriteResult error(int statusCode, String responseData, String errorMessage) {
        WriteResult result = new WriteResult();
        result.setSuccess(false);
        result.setStatusCode(statusCode);
        result.setResponseData(responseData);
        result.setErrorMessage(errorMessage);
        return result;
    }
}
