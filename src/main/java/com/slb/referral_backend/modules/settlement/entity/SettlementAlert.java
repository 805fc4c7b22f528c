package com.slb.referral_backend.modules.settlement.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 对应表：settlement_alerts（运维告警通道）
 */
@Data
public class SettlementAlert {
    private Long id;
    private Long beneficiaryId;
    private Long batchId;
    private String alertType;
    private String message;
    private String status;
    private LocalDateTime createTime;
}
