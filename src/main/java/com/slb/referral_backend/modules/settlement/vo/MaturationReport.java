package com.slb.referral_backend.modules.settlement.vo;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "清算结果 / Maturation result")
public record MaturationReport(@Schema(description = "本次转为 AVAILABLE 的流水数") int matured) {
}
