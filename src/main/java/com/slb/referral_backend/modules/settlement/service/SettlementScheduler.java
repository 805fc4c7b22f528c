package com.slb.referral_backend.modules.settlement.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 进程内定时触发（默认关闭）。生产环境由外部调度器调用 /api/v1/internal/settlement/*。
 */
@Slf4j
@Component
public class SettlementScheduler {

    private final TransactionLifecycleService lifecycleService;
    private final Clock clock;

    public SettlementScheduler(TransactionLifecycleService lifecycleService, Clock clock) {
        this.lifecycleService = lifecycleService;
        this.clock = clock;
    }

    @Scheduled(cron = "${app.settlement.mature-cron:-}")
    public void maturePending() {
        lifecycleService.maturePending(LocalDateTime.now(clock));
    }

    @Scheduled(cron = "${app.settlement.settlement-cron:-}")
    public void runSettlement() {
        lifecycleService.runBatchSettlement(LocalDateTime.now(clock));
    }
}
