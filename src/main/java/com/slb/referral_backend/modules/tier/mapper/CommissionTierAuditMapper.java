package com.slb.referral_backend.modules.tier.mapper;

import com.slb.referral_backend.modules.tier.entity.CommissionTierAudit;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface CommissionTierAuditMapper {

    int insert(CommissionTierAudit audit);

    List<CommissionTierAudit> selectRecent(@Param("limit") int limit);
}
