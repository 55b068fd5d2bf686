package com.wangbin.netboxsync.core.reconcile;

import com.wangbin.netboxsync.common.enums.ResultCode;
import com.wangbin.netboxsync.core.config.SyncProperties;
import com.wangbin.netboxsync.core.extract.model.Subnet;
import com.wangbin.netboxsync.core.extract.model.VlanInterface;
import com.wangbin.netboxsync.core.inventory.InventoryClient;
import com.wangbin.netboxsync.core.inventory.model.LookupResult;
import com.wangbin.netboxsync.core.inventory.model.WriteResult;
import com.wangbin.netboxsync.core.reconcile.model.FactOutcome;
import com.wangbin.netboxsync.core.reconcile.model.FactState;
import com.wangbin.netboxsync.core.reconcile.model.FactType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 资产库对账：逐条“先查后建”，按发现顺序串行处理。
 *
 * <p>每条事实相互独立，单条失败不影响后续；查询失败视为该条失败，不会据此创建。</p>
 */
@Slf4j
@Service
public class InventoryReconciler {

    private final InventoryClient inventoryClient;
    private final boolean createUnmatchedVlans;

    @Autowired
    public InventoryReconciler(InventoryClient inventoryClient, SyncProperties properties) {
        this(inventoryClient, properties.getReconcile().isCreateUnmatchedVlans());
    }

    public InventoryReconciler(InventoryClient inventoryClient, boolean createUnmatchedVlans) {
        this.inventoryClient = inventoryClient;
        this.createUnmatchedVlans = createUnmatchedVlans;
    }

    public List<FactOutcome> reconcileVlans(List<VlanInterface> vlans, Integer siteId) {
        List<FactOutcome> outcomes = new ArrayList<>(vlans.size());
        for (VlanInterface vlan : vlans) {
            FactOutcome outcome = reconcileVlan(vlan, siteId);
            logOutcome(outcome);
            outcomes.add(outcome);
        }
        return outcomes;
    }

    public List<FactOutcome> reconcilePrefixes(List<Subnet> subnets, Integer siteId) {
        List<FactOutcome> outcomes = new ArrayList<>(subnets.size());
        for (Subnet subnet : subnets) {
            FactOutcome outcome = reconcilePrefix(subnet, siteId);
            logOutcome(outcome);
            outcomes.add(outcome);
        }
        return outcomes;
    }

    private FactOutcome reconcileVlan(VlanInterface vlan, Integer siteId) {
        String key = String.valueOf(vlan.getVid());
        if (!vlan.isMatched() && !createUnmatchedVlans) {
            return outcome(FactType.VLAN, key, vlan.getName(), FactState.SKIPPED, null,
                    "接口名称无法解析出VID", ResultCode.SUCCESS);
        }

        LookupResult lookup = inventoryClient.vlanExists(vlan.getVid(), siteId);
        if (lookup.isFound()) {
            return outcome(FactType.VLAN, key, vlan.getName(), FactState.SKIPPED, null, "已存在",
                    ResultCode.SUCCESS);
        }
        if (lookup.isFailed()) {
            return outcome(FactType.VLAN, key, vlan.getName(), FactState.FAILED, lookup.getStatusCode(),
                    "查询失败：" + lookup.getErrorMessage(), ResultCode.INVENTORY_QUERY_ERROR);
        }

        WriteResult result = inventoryClient.createVlan(vlan.getVid(), vlan.getName(), siteId);
        return fromWrite(FactType.VLAN, key, vlan.getName(), result);
    }

    private FactOutcome reconcilePrefix(Subnet subnet, Integer siteId) {
        String network = subnet.network();
        LookupResult lookup = inventoryClient.prefixExists(network);
        if (lookup.isFound()) {
            return outcome(FactType.PREFIX, network, network, FactState.SKIPPED, null, "已存在",
                    ResultCode.SUCCESS);
        }
        if (lookup.isFailed()) {
            return outcome(FactType.PREFIX, network, network, FactState.FAILED, lookup.getStatusCode(),
                    "查询失败：" + lookup.getErrorMessage(), ResultCode.INVENTORY_QUERY_ERROR);
        }

        WriteResult result = inventoryClient.createPrefix(network, siteId);
        return fromWrite(FactType.PREFIX, network, network, result);
    }

    private static FactOutcome fromWrite(FactType type, String key, String name, WriteResult result) {
        FactOutcome.FactOutcomeBuilder builder = FactOutcome.builder()
                .type(type)
                .key(key)
                .name(name)
                .statusCode(result.getStatusCode())
                .costTime(result.getCostTime());
        if (result.isSuccess()) {
            return builder.state(FactState.CREATED)
                    .message("已添加")
                    .resultCode(ResultCode.SUCCESS)
                    .build();
        }
        String detail = result.getResponseData() != null ? result.getResponseData() : result.getErrorMessage();
        return builder.state(FactState.FAILED)
                .message("添加失败：" + detail)
                .resultCode(ResultCode.INVENTORY_WRITE_ERROR)
                .build();
    }

    private static FactOutcome outcome(FactType type, String key, String name, FactState state,
                                       Integer statusCode, String message, ResultCode resultCode) {
        return FactOutcome.builder()
                .type(type)
                .key(key)
                .name(name)
                .state(state)
                .statusCode(statusCode)
                .message(message)
                .resultCode(resultCode)
                .build();
    }

    private void logOutcome(FactOutcome outcome) {
        switch (outcome.getState()) {
            case SKIPPED -> log.info("{} {} {}，跳过", outcome.getType(), outcome.getKey(), outcome.getMessage());
            case CREATED -> log.info("{} {} 已添加，耗时={}ms", outcome.getType(), outcome.getKey(),
                    outcome.getCostTime());
            case FAILED -> log.error("{} {} {} (status={}, code={}, 耗时={}ms)", outcome.getType(), outcome.getKey(),
                    outcome.getMessage(), outcome.getStatusCode(), outcome.getResultCode().getCode(),
                    outcome.getCostTime());
        }
    }
}
