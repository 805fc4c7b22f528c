package com.slb.referral_backend.modules.settlement.mapper;

import com.slb.referral_backend.modules.settlement.entity.PayoutPreference;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Optional;

@Mapper
public interface PayoutPreferenceMapper {

    Optional<PayoutPreference> selectByAccountId(@Param("accountId") Long accountId);

    /** INSERT ... ON DUPLICATE KEY UPDATE */
    int upsert(PayoutPreference preference);
}
