package com.slb.referral_backend.modules.commission.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * listing_delegations 由商品服务维护，这里只读。
 */
@Mapper
public interface ListingDelegationMapper {

    /**
     * @return 一级佣金委托账户，未设置时为 null
     */
    Long selectDelegate(@Param("listingId") Long listingId);
}
