package com.slb.referral_backend.modules.settlement.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app.settlement")
@Data
public class SettlementProperties {

    /**
     * 清算期：PENDING 流水自创建起满该时长后才可结算。
     */
    private Duration clearingInterval = Duration.ofDays(7);

    /**
     * 全局最低打款金额；受益人偏好里的最低金额只能更高，不能更低。
     */
    private BigDecimal minimumPayout = new BigDecimal("10.00");

    /**
     * maturePending 每次查询的行数上限。
     */
    private int matureBatchSize = 500;

    /**
     * 批次认领后超过该时长仍为 CLAIMED，视为上次执行中断，下次结算时用原幂等键重新打款。
     */
    private Duration staleClaimAfter = Duration.ofHours(1);

    /**
     * 进程内定时触发；默认 "-" 关闭，由外部调度器调用内部接口。
     */
    private String matureCron = "-";

    private String settlementCron = "-";
}
