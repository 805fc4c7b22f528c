package com.slb.referral_backend.config;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.context.annotation.Configuration;

/**
 * Mapper 扫描放在独立配置类，Web 切片测试不会加载数据层。
 */
@Configuration
@MapperScan("com.slb.referral_backend.modules.*.mapper")
public class MybatisConfig {
}
