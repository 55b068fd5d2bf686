package com.wangbin.netboxsync.common.exception;

import com.wangbin.netboxsync.common.enums.ResultCode;
import lombok.Getter;

/**
 * SNMP 遍历异常：超时、不可达、错误状态等，已收集的部分结果一律丢弃。
 */
@Getter
public class SnmpWalkException extends BusinessException {

    private final String target;
    private final String rootOid;

    public SnmpWalkException(String message, String target, String rootOid) {
        super(ResultCode.SNMP_ERROR, message);
        this.target = target;
        this.rootOid = rootOid;
    }

    public SnmpWalkException(String message, String target, String rootOid, Throwable cause) {
        super(ResultCode.SNMP_ERROR, message, cause);
        this.target = target;
        this.rootOid = rootOid;
    }

    // 创建超时异常
    public static SnmpWalkException timeout(String target, String rootOid) {
        return new SnmpWalkException("SNMP请求超时或无响应", target, rootOid);
    }

    // 创建错误状态异常
    public static SnmpWalkException errorStatus(String target, String rootOid, String statusText, int errorIndex) {
        return new SnmpWalkException("SNMP错误: " + statusText + " at index " + errorIndex, target, rootOid);
    }
}
