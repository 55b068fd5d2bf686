package com.wangbin.netboxsync.core.snmp.util;

import lombok.extern.slf4j.Slf4j;
import org.snmp4j.mp.SnmpConstants;
import org.snmp4j.smi.Counter32;
import org.snmp4j.smi.Counter64;
import org.snmp4j.smi.Gauge32;
import org.snmp4j.smi.Integer32;
import org.snmp4j.smi.IpAddress;
import org.snmp4j.smi.Null;
import org.snmp4j.smi.OID;
import org.snmp4j.smi.OctetString;
import org.snmp4j.smi.TimeTicks;
import org.snmp4j.smi.Variable;

/**
 * SNMP 工具方法。
 */
@Slf4j
public final class SnmpUtils {

    private SnmpUtils() {
    }

    /**
     * 将 SNMP 变量转为可读文本，IpAddress 输出点分十进制。
     */
    public static String variableToText(Variable variable) {
        if (variable == null || variable instanceof Null) {
            return "";
        }
        if (variable instanceof Integer32 int32) {
            return String.valueOf(int32.getValue());
        }
        if (variable instanceof Counter32 counter32) {
            return String.valueOf(counter32.getValue());
        }
        if (variable instanceof Counter64 counter64) {
            return String.valueOf(counter64.getValue());
        }
        if (variable instanceof Gauge32 gauge32) {
            return String.valueOf(gauge32.getValue());
        }
        if (variable instanceof TimeTicks timeTicks) {
            return String.valueOf(timeTicks.getValue());
        }
        if (variable instanceof IpAddress ipAddress) {
            return ipAddress.getInetAddress().getHostAddress();
        }
        if (variable instanceof OID oid) {
            return oid.toDottedString();
        }
        if (variable instanceof OctetString octetString) {
            return octetString.toString();
        }
        return variable.toString();
    }

    public static int parseVersion(String versionText) {
        if (versionText == null) {
            return SnmpConstants.version2c;
        }
        return switch (versionText.trim()) {
            case "1", "v1" -> SnmpConstants.version1;
            case "3", "v3" -> {
                log.warn("SNMPv3暂未实现安全参数，当前默认按照v2c处理");
                yield SnmpConstants.version2c;
            }
            default -> SnmpConstants.version2c;
        };
    }
}
