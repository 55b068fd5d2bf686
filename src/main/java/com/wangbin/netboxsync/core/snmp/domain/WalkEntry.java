package com.wangbin.netboxsync.core.snmp.domain;

/**
 * SNMP 表遍历的一行。
 *
 * @param oid   设备返回的完整点分 OID，末尾若干段为表索引
 * @param value 值的文本形式
 */
public record WalkEntry(String oid, String value) {

    public WalkEntry {
        if (oid == null || oid.isBlank()) {
            throw new IllegalArgumentException("SNMP OID不能为空");
        }
    }

    /**
     * OID 的最后 count 段，不足时返回 null
     */
    public String[] lastComponents(int count) {
        String[] parts = oid.split("\\.");
        if (parts.length < count) {
            return null;
        }
        String[] tail = new String[count];
        System.arraycopy(parts, parts.length - count, tail, 0, count);
        return tail;
    }
}
