package com.wangbin.netboxsync.core.snmp;

import com.wangbin.netboxsync.common.exception.SnmpWalkException;
import com.wangbin.netboxsync.core.snmp.domain.WalkEntry;

import java.util.List;

/**
 * SNMP 子树遍历
 */
public interface SnmpWalker {

    /**
     * 从 rootOid 开始按字典序遍历，直到离开子树。
     *
     * @param rootOid   子树根 OID
     * @param target    设备地址
     * @param community 读 community
     * @return 按遍历顺序返回的条目
     * @throws SnmpWalkException 任一请求超时、传输失败或返回错误状态，部分结果不返回
     */
    List<WalkEntry> walk(String rootOid, String target, String community);
}
