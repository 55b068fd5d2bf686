package com.wangbin.netboxsync.core.extract.model;

import com.wangbin.netboxsync.common.utils.IpUtil;

/**
 * 规范化后的 IPv4 子网（主机位已清零）。
 *
 * @param network CIDR 表示，例如 10.0.0.0/24
 */
public record Subnet(String network) {

    public Subnet {
        network = IpUtil.normalizeNetwork(network);
    }

    public static Subnet of(String address, int prefixLength) {
        return new Subnet(IpUtil.normalizeNetwork(address, prefixLength));
    }

    @Override
    public String toString() {
        return network;
    }
}
