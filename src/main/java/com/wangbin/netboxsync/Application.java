package com.wangbin.netboxsync;

import com.wangbin.netboxsync.core.config.SyncProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties
@EnableScheduling
public class Application {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(Application.class, args);
        if (context.getBean(SyncProperties.class).getSchedule().isEnabled()) {
            // 定时模式由调度线程保持进程存活
            return;
        }
        System.exit(SpringApplication.exit(context));
    }
}
