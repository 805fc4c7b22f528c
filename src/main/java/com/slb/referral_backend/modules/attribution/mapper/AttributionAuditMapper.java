package com.slb.referral_backend.modules.attribution.mapper;

import com.slb.referral_backend.modules.attribution.entity.AttributionAudit;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface AttributionAuditMapper {

    int insert(AttributionAudit audit);

    List<AttributionAudit> selectByNewAccountId(@Param("newAccountId") Long newAccountId);
}
