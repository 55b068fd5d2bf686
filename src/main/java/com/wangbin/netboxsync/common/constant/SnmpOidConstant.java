package com.wangbin.netboxsync.common.constant;

public class SnmpOidConstant {

    // IF-MIB::ifDescr
    public static final String IF_DESCR = "1.3.6.1.2.1.2.2.1.2";

    // IP-MIB::ipAdEntNetMask，索引为接口 IPv4 地址
    public static final String IP_AD_ENT_NET_MASK = "1.3.6.1.2.1.4.20.1.3";

    // 默认端口
    public static final int DEFAULT_SNMP_PORT = 161;

    private SnmpOidConstant() {
    }
}
