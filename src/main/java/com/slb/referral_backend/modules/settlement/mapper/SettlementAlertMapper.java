package com.slb.referral_backend.modules.settlement.mapper;

import com.slb.referral_backend.modules.settlement.entity.SettlementAlert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface SettlementAlertMapper {

    /** 同一批次同一类型告警只保留一条 */
    int insertIgnore(SettlementAlert alert);

    List<SettlementAlert> selectOpen(@Param("limit") int limit);
}
