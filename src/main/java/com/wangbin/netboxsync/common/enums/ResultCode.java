package com.wangbin.netboxsync.common.enums;

/**
 * 同步流程结果码
 */
public enum ResultCode {

    // 成功
    SUCCESS(200, "成功"),

    // 采集相关错误
    SNMP_ERROR(2001, "SNMP遍历失败"),
    PARSE_ERROR(2005, "数据解析错误"),

    // 资产库(NetBox)相关错误
    INVENTORY_QUERY_ERROR(6001, "资产库查询失败"),
    INVENTORY_WRITE_ERROR(6002, "资产库写入失败"),

    // 其他错误
    UNKNOWN_ERROR(9999, "未知错误");

    private final int code;
    private final String message;

    ResultCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    /**
     * 根据code获取枚举
     */
    public static ResultCode getByCode(int code) {
        for (ResultCode resultCode : values()) {
            if (resultCode.getCode() == code) {
                return resultCode;
            }
        }
        return UNKNOWN_ERROR;
    }
}
