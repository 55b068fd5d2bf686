package com.wangbin.netboxsync.core.snmp;

import com.wangbin.netboxsync.common.exception.SnmpWalkException;
import com.wangbin.netboxsync.core.config.SyncProperties;
import com.wangbin.netboxsync.core.snmp.domain.WalkEntry;
import com.wangbin.netboxsync.core.snmp.util.SnmpUtils;
import lombok.extern.slf4j.Slf4j;
import org.snmp4j.CommunityTarget;
import org.snmp4j.PDU;
import org.snmp4j.Snmp;
import org.snmp4j.Target;
import org.snmp4j.event.ResponseEvent;
import org.snmp4j.mp.SnmpConstants;
import org.snmp4j.smi.OID;
import org.snmp4j.smi.OctetString;
import org.snmp4j.smi.UdpAddress;
import org.snmp4j.smi.VariableBinding;
import org.snmp4j.transport.DefaultUdpTransportMapping;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;

/**
 * 基于 SNMP4J 的 GETNEXT 遍历实现，每次遍历使用独立的 UDP 会话。
 */
@Slf4j
@Component
public class Snmp4jWalker implements SnmpWalker {

    private final SyncProperties.SnmpConfig snmpConfig;

    public Snmp4jWalker(SyncProperties properties) {
        this.snmpConfig = properties.getSnmp();
    }

    @Override
    public List<WalkEntry> walk(String rootOid, String target, String community) {
        if (rootOid == null || rootOid.isBlank()) {
            throw new IllegalArgumentException("根OID不能为空");
        }
        String targetText = target + "/" + snmpConfig.getPort();
        log.debug("开始SNMP遍历 target={} root={}", targetText, rootOid);

        try (Snmp snmp = new Snmp(new DefaultUdpTransportMapping())) {
            snmp.listen();
            Target<UdpAddress> snmpTarget = buildTarget(target, community);
            List<WalkEntry> entries = performWalk(snmp, snmpTarget, new OID(rootOid.trim()), targetText);
            log.debug("SNMP遍历完成 target={} root={} count={}", targetText, rootOid, entries.size());
            return entries;
        } catch (IOException e) {
            throw new SnmpWalkException("SNMP WALK 执行失败: " + e.getMessage(), targetText, rootOid, e);
        }
    }

    private List<WalkEntry> performWalk(Snmp snmp, Target<UdpAddress> target, OID root, String targetText)
            throws IOException {
        String rootText = root.toDottedString();
        List<WalkEntry> nodes = new ArrayList<>();
        long deadline = System.currentTimeMillis() + snmpConfig.getWalkTimeout();
        OID current = root;
        while (true) {
            if (System.currentTimeMillis() > deadline) {
                throw new SnmpWalkException("SNMP遍历超时(" + snmpConfig.getWalkTimeout() + "ms)",
                        targetText, rootText);
            }

            PDU pdu = new PDU();
            pdu.add(new VariableBinding(current));
            pdu.setType(PDU.GETNEXT);
            ResponseEvent<UdpAddress> event = snmp.send(pdu, target);
            PDU response = validateResponse(event, target, targetText, rootText);
            if (response == null || response.size() == 0) {
                break;
            }
            VariableBinding vb = response.get(0);
            OID oid = vb.getOid();
            if (vb.getVariable().isException() || oid.size() <= root.size() || !oid.startsWith(root)) {
                break;
            }
            if (oid.compareTo(current) <= 0) {
                throw new SnmpWalkException("SNMP遍历OID未递增: " + oid.toDottedString(), targetText, rootText);
            }
            if (nodes.size() >= snmpConfig.getMaxNodes()) {
                throw new SnmpWalkException("SNMP遍历节点数超过上限(" + snmpConfig.getMaxNodes() + ")",
                        targetText, rootText);
            }
            nodes.add(new WalkEntry(oid.toDottedString(), SnmpUtils.variableToText(vb.getVariable())));
            current = oid;
        }
        return nodes;
    }

    /**
     * 校验响应，返回 null 表示 SNMPv1 已到达 MIB 末尾。
     */
    private PDU validateResponse(ResponseEvent<UdpAddress> event, Target<UdpAddress> target,
                                 String targetText, String rootText) {
        if (event != null && event.getError() != null) {
            throw new SnmpWalkException("SNMP传输错误: " + event.getError().getMessage(),
                    targetText, rootText, event.getError());
        }
        if (event == null || event.getResponse() == null) {
            throw SnmpWalkException.timeout(targetText, rootText);
        }
        PDU response = event.getResponse();
        if (response.getErrorStatus() != PDU.noError) {
            if (target.getVersion() == SnmpConstants.version1
                    && response.getErrorStatus() == PDU.noSuchName) {
                return null;
            }
            throw SnmpWalkException.errorStatus(targetText, rootText,
                    response.getErrorStatusText(), response.getErrorIndex());
        }
        return response;
    }

    private Target<UdpAddress> buildTarget(String host, String community) throws IOException {
        CommunityTarget<UdpAddress> communityTarget = new CommunityTarget<>();
        communityTarget.setCommunity(new OctetString(community));
        communityTarget.setVersion(SnmpUtils.parseVersion(snmpConfig.getVersion()));
        communityTarget.setRetries(snmpConfig.getRetries());
        communityTarget.setTimeout(snmpConfig.getTimeout());
        communityTarget.setAddress(new UdpAddress(InetAddress.getByName(host), snmpConfig.getPort()));
        return communityTarget;
    }
}
