package com.slb.referral_backend.modules.account.mapper;

import com.slb.referral_backend.modules.account.entity.Account;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Optional;

@Mapper
public interface AccountMapper {

    /**
     * 根据ID查找账户
     *
     * @param id 账户ID
     * @return Optional<Account>
     */
    Optional<Account> selectById(@Param("id") Long id);

    /**
     * 通过推荐码查找账户（推荐码已统一为大写）
     *
     * @param referralCode 推荐码
     * @return Optional<Account>
     */
    Optional<Account> selectByReferralCode(@Param("referralCode") String referralCode);

    /**
     * 插入新账户；归因字段随插入一次写入，之后不再更新。
     * 主键或推荐码冲突时抛出 DuplicateKeyException。
     *
     * @param account 账户实体
     * @return 影响的行数
     */
    int insert(Account account);

    /**
     * 只取推荐人ID，用于沿推荐链向上遍历。账户不存在或无推荐人时返回 null。
     */
    Long selectReferredBy(@Param("id") Long id);
}
