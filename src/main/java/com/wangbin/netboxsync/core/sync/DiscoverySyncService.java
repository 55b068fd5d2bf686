package com.wangbin.netboxsync.core.sync;

import com.wangbin.netboxsync.common.constant.SnmpOidConstant;
import com.wangbin.netboxsync.common.exception.ExtractionException;
import com.wangbin.netboxsync.common.exception.SnmpWalkException;
import com.wangbin.netboxsync.core.config.SyncProperties;
import com.wangbin.netboxsync.core.extract.FactExtractor;
import com.wangbin.netboxsync.core.extract.model.Subnet;
import com.wangbin.netboxsync.core.extract.model.VlanInterface;
import com.wangbin.netboxsync.core.reconcile.InventoryReconciler;
import com.wangbin.netboxsync.core.reconcile.model.FactOutcome;
import com.wangbin.netboxsync.core.reconcile.model.FactState;
import com.wangbin.netboxsync.core.snmp.SnmpWalker;
import com.wangbin.netboxsync.core.snmp.domain.WalkEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 单设备发现与同步流程
 *
 * 执行步骤：
 * 1. 遍历 ifDescr，提取 VLAN 子接口
 * 2. 遍历 ipAdEntNetMask，提取子网
 * 3. 输出发现结果
 * 4. 依次对账 VLAN 与前缀
 */
@Slf4j
@Service
public class DiscoverySyncService {

    private final SnmpWalker snmpWalker;
    private final FactExtractor factExtractor;
    private final InventoryReconciler reconciler;
    private final SyncProperties properties;

    public DiscoverySyncService(SnmpWalker snmpWalker, FactExtractor factExtractor,
                                InventoryReconciler reconciler, SyncProperties properties) {
        this.snmpWalker = snmpWalker;
        this.factExtractor = factExtractor;
        this.reconciler = reconciler;
        this.properties = properties;
    }

    public SyncReport run() {
        long start = System.currentTimeMillis();
        String host = properties.getSnmp().getHost();
        String community = properties.getSnmp().getCommunity();
        Integer siteId = properties.getInventory().getSiteId();
        log.info("开始同步 device={} site={}", host, siteId);

        List<VlanInterface> vlans;
        List<Subnet> subnets;
        try {
            List<WalkEntry> interfaces = snmpWalker.walk(SnmpOidConstant.IF_DESCR, host, community);
            vlans = factExtractor.extractVlanInterfaces(interfaces);

            List<WalkEntry> netmasks = snmpWalker.walk(SnmpOidConstant.IP_AD_ENT_NET_MASK, host, community);
            subnets = factExtractor.extractSubnets(netmasks);
        } catch (SnmpWalkException e) {
            log.error("SNMP遍历失败，同步终止 [{}] target={} root={}：{}", e.getCode(), e.getTarget(), e.getRootOid(), e.getMessage(), e);
            return SyncReport.aborted(e, System.currentTimeMillis() - start);
        } catch (ExtractionException e) {
            log.error("解析SNMP数据失败，同步终止 [{}] oid={}：{}", e.getCode(), e.getOid(), e.getMessage(), e);
            return SyncReport.aborted(e, System.currentTimeMillis() - start);
        }

        printDiscovered(vlans, subnets);

        List<FactOutcome> outcomes = new ArrayList<>(vlans.size() + subnets.size());
        log.info("添加VLAN到NetBox：");
        outcomes.addAll(reconciler.reconcileVlans(vlans, siteId));
        log.info("添加前缀到NetBox：");
        outcomes.addAll(reconciler.reconcilePrefixes(subnets, siteId));

        SyncReport report = SyncReport.completed(vlans, subnets, outcomes, System.currentTimeMillis() - start);
        log.info("同步完成：新增={}，跳过={}，失败={}，耗时={}ms",
                report.count(FactState.CREATED),
                report.count(FactState.SKIPPED),
                report.count(FactState.FAILED),
                report.getCostTime());
        return report;
    }

    private void printDiscovered(List<VlanInterface> vlans, List<Subnet> subnets) {
        log.info("发现的VLAN接口({})：", vlans.size());
        for (VlanInterface vlan : vlans) {
            log.info("  {}", vlan.getName());
        }
        log.info("发现的前缀({})：", subnets.size());
        for (Subnet subnet : subnets) {
            log.info("  {}", subnet.network());
        }
    }
}
