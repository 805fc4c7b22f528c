package com.slb.referral_backend.modules.pipeline.mapper;

import com.slb.referral_backend.modules.account.enums.ReferralSource;
import com.slb.referral_backend.modules.pipeline.entity.ReferralAttempt;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.Optional;

@Mapper
public interface ReferralAttemptMapper {

    int insert(ReferralAttempt attempt);

    /**
     * 统计某来源 IP 在 [since, now] 内的点击数（速率风控，单条 count 查询）。
     */
    long countClicksFromIpSince(@Param("clientIp") String clientIp,
                                @Param("since") LocalDateTime since,
                                @Param("now") LocalDateTime now);

    /**
     * 该推荐人最近一条未绑定被推荐人的 CLICKED 记录。
     */
    Optional<ReferralAttempt> selectLatestUnboundClick(@Param("referrerId") Long referrerId);

    /**
     * CLICKED → ATTRIBUTED，条件更新；返回 0 表示状态已被其他请求推进。
     */
    int markAttributed(@Param("id") Long id,
                       @Param("targetAccountId") Long targetAccountId,
                       @Param("source") ReferralSource source,
                       @Param("now") LocalDateTime now);

    /**
     * 被推荐人最近一条 ATTRIBUTED 记录 → CONVERTED，条件更新。
     */
    int markConverted(@Param("targetAccountId") Long targetAccountId,
                      @Param("bookingId") String bookingId,
                      @Param("now") LocalDateTime now);
}
