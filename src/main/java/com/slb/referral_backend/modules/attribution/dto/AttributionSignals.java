package com.slb.referral_backend.modules.attribution.dto;

/**
 * 注册请求携带的归因信号，全部可为空。
 *
 * @param explicitCode 注册链接 URL 上带的邀请码
 * @param token        点击推广链接时下发的签名 token
 * @param manualCode   用户在表单里手填的邀请码
 */
public record AttributionSignals(String explicitCode, String token, String manualCode,
                                 String clientIp, String userAgent) {

    public static AttributionSignals none() {
        return new AttributionSignals(null, null, null, null, null);
    }
}
