package com.wangbin.netboxsync.common.exception;

import lombok.Getter;

/**
 * 子网掩码不是连续的 1 位模式，无法换算为前缀长度。
 */
@Getter
public class InvalidMaskException extends ExtractionException {

    private final String mask;

    public InvalidMaskException(String mask) {
        this(mask, null);
    }

    public InvalidMaskException(String mask, String oid) {
        super("无效的子网掩码: " + mask + (oid != null ? " (oid=" + oid + ")" : ""), oid);
        this.mask = mask;
    }
}
