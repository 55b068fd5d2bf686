package com.wangbin.netboxsync.common.utils;

import com.google.common.net.InetAddresses;
import com.google.common.primitives.Ints;
import com.wangbin.netboxsync.common.exception.InvalidMaskException;

import java.net.InetAddress;
import java.util.regex.Pattern;

/**
 * IPv4 地址/掩码工具类
 */
public final class IpUtil {

    private static final Pattern IP_PATTERN = Pattern.compile(
            "^((25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.){3}(25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)$");

    private static final int MAX_PREFIX = 32;

    private IpUtil() {
        // 工具类，防止实例化
    }

    /**
     * 验证点分十进制 IPv4 地址
     */
    public static boolean isValidIpv4(String ip) {
        if (ip == null || ip.isBlank()) {
            return false;
        }
        if (!IP_PATTERN.matcher(ip.trim()).matches()) {
            return false;
        }
        try {
            toInt(ip.trim());
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * 子网掩码转前缀长度，例如 255.255.255.0 -> 24。
     *
     * @param netmask 点分十进制掩码
     * @return 前缀长度（高位连续 1 的个数）
     * @throws InvalidMaskException 掩码格式错误或 1 位不连续
     */
    public static int maskToPrefix(String netmask) {
        if (!isValidIpv4(netmask)) {
            throw new InvalidMaskException(netmask);
        }
        int bits = toInt(netmask.trim());
        int inverted = ~bits;
        // 取反后必须形如 0...01...1
        if ((inverted & (inverted + 1)) != 0) {
            throw new InvalidMaskException(netmask);
        }
        return Integer.bitCount(bits);
    }

    /**
     * 按前缀长度清零主机位，返回规范的 CIDR 字符串。
     * 非严格模式：地址不是网络地址时向下取整，不报错。
     */
    public static String normalizeNetwork(String address, int prefixLength) {
        if (prefixLength < 0 || prefixLength > MAX_PREFIX) {
            throw new IllegalArgumentException("前缀长度超出范围: " + prefixLength);
        }
        if (!isValidIpv4(address)) {
            throw new IllegalArgumentException("无效的IPv4地址: " + address);
        }
        int network = toInt(address.trim()) & prefixMask(prefixLength);
        return InetAddresses.toAddrString(InetAddresses.fromInteger(network)) + "/" + prefixLength;
    }

    /**
     * 对 "a.b.c.d/len" 形式的 CIDR 做规范化
     */
    public static String normalizeNetwork(String cidr) {
        if (cidr == null) {
            throw new IllegalArgumentException("CIDR不能为空");
        }
        int slash = cidr.indexOf('/');
        if (slash <= 0 || slash == cidr.length() - 1) {
            throw new IllegalArgumentException("无效的CIDR: " + cidr);
        }
        int prefixLength;
        try {
            prefixLength = Integer.parseInt(cidr.substring(slash + 1).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("无效的CIDR: " + cidr, e);
        }
        return normalizeNetwork(cidr.substring(0, slash), prefixLength);
    }

    static int prefixMask(int prefixLength) {
        return prefixLength == 0 ? 0 : -1 << (MAX_PREFIX - prefixLength);
    }

    private static int toInt(String ip) {
        InetAddress address = InetAddresses.forString(ip);
        return Ints.fromByteArray(address.getAddress());
    }
}
