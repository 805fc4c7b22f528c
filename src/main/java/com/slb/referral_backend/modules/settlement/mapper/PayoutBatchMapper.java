package com.slb.referral_backend.modules.settlement.mapper;

import com.slb.referral_backend.modules.settlement.entity.PayoutBatch;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Mapper
public interface PayoutBatchMapper {

    /**
     * INSERT IGNORE：同一受益人同一结算周期已被认领时返回 0。
     */
    int insertIgnore(PayoutBatch batch);

    int updateTotals(@Param("id") Long id,
                     @Param("amount") BigDecimal amount,
                     @Param("transactionCount") int transactionCount);

    int markPaid(@Param("id") Long id,
                 @Param("providerReference") String providerReference,
                 @Param("now") LocalDateTime now);

    int markFailed(@Param("id") Long id,
                   @Param("reason") String reason,
                   @Param("now") LocalDateTime now);

    int markEmpty(@Param("id") Long id, @Param("now") LocalDateTime now);

    /** since 之后已成功打款的批次数（月度节奏判断） */
    long countPaidSince(@Param("beneficiaryId") Long beneficiaryId, @Param("since") LocalDateTime since);

    /**
     * before 之前认领、至今仍为 CLAIMED 的批次（打款结果未落库，需要沿用原幂等键重新驱动）。
     */
    List<PayoutBatch> selectStaleClaimed(@Param("before") LocalDateTime before, @Param("limit") int limit);
}
