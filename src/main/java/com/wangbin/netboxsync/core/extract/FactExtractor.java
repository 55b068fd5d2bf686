package com.wangbin.netboxsync.core.extract;

import com.wangbin.netboxsync.common.exception.ExtractionException;
import com.wangbin.netboxsync.common.exception.InvalidMaskException;
import com.wangbin.netboxsync.common.utils.IpUtil;
import com.wangbin.netboxsync.core.config.SyncProperties;
import com.wangbin.netboxsync.core.extract.model.Subnet;
import com.wangbin.netboxsync.core.extract.model.VlanInterface;
import com.wangbin.netboxsync.core.snmp.domain.WalkEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 从 SNMP 遍历结果中提取 VLAN 子接口与子网，不做任何网络访问。
 */
@Slf4j
@Component
public class FactExtractor {

    private static final Pattern VLAN_PATTERN = Pattern.compile("^ae\\d+\\.\\d+$");

    private static final int IPV4_OCTETS = 4;

    private final boolean lenient;

    @Autowired
    public FactExtractor(SyncProperties properties) {
        this(properties.getExtract().isLenient());
    }

    public FactExtractor(boolean lenient) {
        this.lenient = lenient;
    }

    /**
     * 筛选 ifDescr 值形如 aeN.M 的条目，保持输入顺序，不去重。
     */
    public List<VlanInterface> extractVlanInterfaces(List<WalkEntry> entries) {
        List<VlanInterface> vlans = new ArrayList<>();
        for (WalkEntry entry : entries) {
            String descr = entry.value();
            if (descr != null && VLAN_PATTERN.matcher(descr).matches()) {
                vlans.add(VlanInterface.fromName(descr));
            }
        }
        return vlans;
    }

    /**
     * ipAdEntNetMask 条目转子网：OID 末四段为地址，值为掩码，主机位向下取整。
     *
     * @throws ExtractionException 严格模式下遇到无法解析的地址或掩码
     */
    public List<Subnet> extractSubnets(List<WalkEntry> entries) {
        List<Subnet> subnets = new ArrayList<>();
        for (WalkEntry entry : entries) {
            try {
                subnets.add(toSubnet(entry));
            } catch (ExtractionException e) {
                if (!lenient) {
                    throw e;
                }
                log.warn("跳过无法解析的条目 oid={} value={}: {}", entry.oid(), entry.value(), e.getMessage());
            }
        }
        return subnets;
    }

    private Subnet toSubnet(WalkEntry entry) {
        String[] octets = entry.lastComponents(IPV4_OCTETS);
        if (octets == null) {
            throw ExtractionException.invalidAddress(entry.oid());
        }
        String address = String.join(".", octets);
        if (!IpUtil.isValidIpv4(address)) {
            throw ExtractionException.invalidAddress(entry.oid());
        }
        int prefixLength;
        try {
            prefixLength = IpUtil.maskToPrefix(entry.value());
        } catch (InvalidMaskException e) {
            throw new InvalidMaskException(entry.value(), entry.oid());
        }
        return Subnet.of(address, prefixLength);
    }
}
