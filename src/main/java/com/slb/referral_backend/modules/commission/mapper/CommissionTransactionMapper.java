package com.slb.referral_backend.modules.commission.mapper;

import com.slb.referral_backend.modules.commission.entity.CommissionTransaction;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Mapper
public interface CommissionTransactionMapper {

    /**
     * INSERT IGNORE：(booking_id, tier) 已存在时返回 0，不报错。
     */
    int insertIgnore(CommissionTransaction transaction);

    Optional<CommissionTransaction> selectById(@Param("id") Long id);

    /**
     * 当前读（LOCK IN SHARE MODE）：insertIgnore 撞上并发事务刚提交的行后，用它取回该行。
     */
    Optional<CommissionTransaction> selectByBookingAndTierForShare(@Param("bookingId") String bookingId,
                                                                   @Param("tier") int tier);

    List<CommissionTransaction> selectByBookingId(@Param("bookingId") String bookingId);

    /* ---------- 清算 ---------- */

    /** 已过清算期的 PENDING 流水ID */
    List<Long> selectMaturableIds(@Param("cutoff") LocalDateTime cutoff, @Param("limit") int limit);

    /** PENDING → AVAILABLE，条件更新 */
    int markAvailable(@Param("id") Long id,
                      @Param("cutoff") LocalDateTime cutoff,
                      @Param("now") LocalDateTime now);

    /* ---------- 结算 ---------- */

    /** 存在未认领 AVAILABLE 流水的受益人 */
    List<Long> selectBeneficiariesWithAvailable();

    BigDecimal sumUnclaimedAvailable(@Param("beneficiaryId") Long beneficiaryId);

    /** 把受益人未认领的 AVAILABLE 流水写入批次，返回认领条数 */
    int claimForBatch(@Param("beneficiaryId") Long beneficiaryId, @Param("batchId") Long batchId);

    BigDecimal sumByBatch(@Param("batchId") Long batchId);

    int markBatchPaidOut(@Param("batchId") Long batchId, @Param("now") LocalDateTime now);

    int markBatchFailed(@Param("batchId") Long batchId,
                        @Param("reason") String reason,
                        @Param("now") LocalDateTime now);

    /* ---------- 人工/退款 ---------- */

    int voidPendingByBooking(@Param("bookingId") String bookingId,
                             @Param("reason") String reason,
                             @Param("now") LocalDateTime now);

    /** FAILED → AVAILABLE，清空批次，条件更新 */
    int resetFailed(@Param("id") Long id);
}
