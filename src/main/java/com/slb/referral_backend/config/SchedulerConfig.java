package com.slb.referral_backend.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 启用 Spring 定时任务；结算相关 cron 默认为 "-"（关闭），由外部调度器调用内部接口。
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {
}
