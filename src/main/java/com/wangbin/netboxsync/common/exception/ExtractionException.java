package com.wangbin.netboxsync.common.exception;

import com.wangbin.netboxsync.common.enums.ResultCode;
import lombok.Getter;

/**
 * 从 SNMP 遍历结果中解析事实数据失败
 */
@Getter
public class ExtractionException extends BusinessException {

    private final String oid;

    public ExtractionException(String message, String oid) {
        super(ResultCode.PARSE_ERROR, message);
        this.oid = oid;
    }

    // OID 索引不是合法的 IPv4 地址
    public static ExtractionException invalidAddress(String oid) {
        return new ExtractionException("OID索引无法解析为IPv4地址: " + oid, oid);
    }
}
