package com.wangbin.netboxsync.core.extract.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 聚合口 VLAN 子接口，名称形如 aeN.M，M 即 VLAN ID。
 */
@Getter
@ToString
@EqualsAndHashCode
public class VlanInterface {

    private static final Pattern UNIT_PATTERN = Pattern.compile("ae\\d+\\.(\\d+)");

    private final String name;
    private final int vid;

    /**
     * 名称中是否解析出了 VID；为 false 时 vid 固定为 0
     */
    private final boolean matched;

    private VlanInterface(String name, int vid, boolean matched) {
        this.name = name;
        this.vid = vid;
        this.matched = matched;
    }

    public static VlanInterface fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("接口名称不能为空");
        }
        Matcher matcher = UNIT_PATTERN.matcher(name);
        if (matcher.find()) {
            try {
                return new VlanInterface(name, Integer.parseInt(matcher.group(1)), true);
            } catch (NumberFormatException e) {
                // 单元号超出 int 范围
                return new VlanInterface(name, 0, false);
            }
        }
        return new VlanInterface(name, 0, false);
    }
}
