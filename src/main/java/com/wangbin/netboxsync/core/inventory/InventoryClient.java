package com.wangbin.netboxsync.core.inventory;

import com.wangbin.netboxsync.core.inventory.model.LookupResult;
import com.wangbin.netboxsync.core.inventory.model.WriteResult;

/**
 * 资产库（NetBox）最小客户端：查询与创建 VLAN、前缀。
 */
public interface InventoryClient {

    /**
     * 按 VID 查询 VLAN，siteId 为 null 时不按站点过滤
     */
    LookupResult vlanExists(int vid, Integer siteId);

    /**
     * 创建 VLAN，仅 201 视为成功
     */
    WriteResult createVlan(int vid, String name, Integer siteId);

    /**
     * 按 CIDR 查询前缀
     */
    LookupResult prefixExists(String network);

    /**
     * 创建前缀，200/201 视为成功；siteId 为 null 时请求体不带 site
     */
    WriteResult createPrefix(String network, Integer siteId);
}
