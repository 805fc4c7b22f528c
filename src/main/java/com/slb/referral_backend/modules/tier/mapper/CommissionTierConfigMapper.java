package com.slb.referral_backend.modules.tier.mapper;

import com.slb.referral_backend.modules.tier.entity.CommissionTierConfig;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Mapper
public interface CommissionTierConfigMapper {

    /** 全部层级，按 tier 升序 */
    List<CommissionTierConfig> selectAll();

    Optional<CommissionTierConfig> selectByTier(@Param("tier") int tier);

    Optional<CommissionTierConfig> selectByTierForUpdate(@Param("tier") int tier);

    /**
     * 启用并标记为已审批，追加备注。PROHIBITED 行不会被更新。
     */
    int activate(@Param("tier") int tier,
                 @Param("operator") String operator,
                 @Param("notes") String notes,
                 @Param("now") LocalDateTime now);

    int deactivate(@Param("tier") int tier,
                   @Param("operator") String operator,
                   @Param("notes") String notes,
                   @Param("now") LocalDateTime now);
}
