package com.slb.referral_backend.modules.account.entity;

import com.slb.referral_backend.modules.account.enums.ReferralSource;
import lombok.Data;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * 对应表：accounts
 */
@Data
public class Account implements Serializable {

    private static final long serialVersionUID = 1L;

    /** 由外部身份服务在注册时分配 */
    private Long id;

    private String email;

    private String displayName;

    /** 7 位推荐码，全局唯一 */
    private String referralCode;

    /** 推荐人，仅在建号时写入一次 */
    private Long referredBy;

    private ReferralSource referralSource;

    private LocalDateTime referredAt;

    /**
     * 1=正常 0=禁用（禁用账户的推荐码不再生效）
     */
    private Integer status;

    /** 外部打款目标引用，可为空 */
    private String payoutAccountRef;

    private LocalDateTime createTime;

    public boolean isLive() {
        return status != null && status == 1;
    }
}
