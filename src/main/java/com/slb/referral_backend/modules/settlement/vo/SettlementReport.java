package com.slb.referral_backend.modules.settlement.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Schema(description = "结算批次执行报告 / Settlement run report")
public class SettlementReport {

    @Schema(description = "结算周期ID（ISO 周）/ Run id, ISO week.", example = "2024-W23")
    private String runId;
    private int beneficiaries;
    private int paid;
    private int failed;
    private int skippedOptedOut;
    private int skippedCadence;
    private int skippedBelowMinimum;
    @Schema(description = "本周期已被其他执行认领 / Already claimed by another run invocation.")
    private int alreadyClaimed;
    @Schema(description = "重新驱动的中断批次数 / Stale claimed batches re-driven with their original idempotency key.")
    private int redriven;
    private int errors;
    private BigDecimal paidAmount = BigDecimal.ZERO;

    public SettlementReport() {
    }

    public SettlementReport(String runId) {
        this.runId = runId;
    }

    public void addPaid(BigDecimal amount) {
        paid++;
        paidAmount = paidAmount.add(amount);
    }
}
