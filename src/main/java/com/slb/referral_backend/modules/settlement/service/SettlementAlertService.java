package com.slb.referral_backend.modules.settlement.service;

import com.slb.referral_backend.modules.settlement.entity.SettlementAlert;
import com.slb.referral_backend.modules.settlement.mapper.SettlementAlertMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 结算告警：写入 settlement_alerts 供运维处理。
 */
@Slf4j
@Service
public class SettlementAlertService {

    public static final String PAYOUT_FAILED = "PAYOUT_FAILED";
    public static final String SETTLEMENT_ERROR = "SETTLEMENT_ERROR";

    private final SettlementAlertMapper alertMapper;
    private final Clock clock;

    public SettlementAlertService(SettlementAlertMapper alertMapper, Clock clock) {
        this.alertMapper = alertMapper;
        this.clock = clock;
    }

    public void raiseAlert(Long beneficiaryId, Long batchId, String alertType, String message) {
        if (!StringUtils.hasText(alertType)) {
            return;
        }
        SettlementAlert alert = new SettlementAlert();
        alert.setBeneficiaryId(beneficiaryId);
        alert.setBatchId(batchId);
        alert.setAlertType(alertType);
        alert.setMessage(StringUtils.hasText(message) ? message : alertType);
        alert.setStatus("OPEN");
        alert.setCreateTime(LocalDateTime.now(clock));
        if (alertMapper.insertIgnore(alert) == 0) {
            log.debug("Settlement alert already open: batch={}, type={}", batchId, alertType);
        }
    }

    public List<SettlementAlert> listOpen(int limit) {
        return alertMapper.selectOpen(Math.max(1, Math.min(limit, 500)));
    }
}
