package com.wangbin.netboxsync.core.config;

import com.wangbin.netboxsync.common.constant.SnmpOidConstant;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * 同步服务配置类，启动时一次性绑定，缺少必填项时在任何网络访问之前失败。
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "netbox-sync")
public class SyncProperties {

    /**
     * 设备 SNMP 配置
     */
    @Valid
    private SnmpConfig snmp = new SnmpConfig();

    /**
     * NetBox 配置
     */
    @Valid
    private InventoryConfig inventory = new InventoryConfig();

    /**
     * 解析配置
     */
    private ExtractConfig extract = new ExtractConfig();

    /**
     * 对账配置
     */
    private ReconcileConfig reconcile = new ReconcileConfig();

    /**
     * 定时执行配置
     */
    private ScheduleConfig schedule = new ScheduleConfig();

    // =============== 配置类定义 ===============

    @Data
    public static class SnmpConfig {
        @NotBlank(message = "设备地址不能为空")
        private String host;
        @Min(1)
        @Max(65535)
        private int port = SnmpOidConstant.DEFAULT_SNMP_PORT;
        @NotBlank(message = "SNMP community不能为空")
        @ToString.Exclude
        private String community;
        private String version = "2c";
        private int timeout = 3000;
        private int retries = 1;
        private long walkTimeout = 60000;
        private int maxNodes = 10000;
    }

    @Data
    public static class InventoryConfig {
        @NotBlank(message = "NetBox地址不能为空")
        private String baseUrl;
        @NotBlank(message = "NetBox令牌不能为空")
        @ToString.Exclude
        private String token;
        private Integer siteId;
        private boolean ignoreSsl = true;
        private int connectTimeout = 5000;
        private int readTimeout = 10000;
    }

    @Data
    public static class ExtractConfig {
        /**
         * true 时跳过无法解析的条目，false 时首个错误即终止本次同步
         */
        private boolean lenient = false;
    }

    @Data
    public static class ReconcileConfig {
        /**
         * 名称无法解析出 VID 的接口是否仍按 vid=0 创建
         */
        private boolean createUnmatchedVlans = false;
    }

    @Data
    public static class ScheduleConfig {
        private boolean enabled = false;
        private long intervalMs = 600000;
    }
}
