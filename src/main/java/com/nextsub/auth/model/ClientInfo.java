package com.nextsub.auth.model;

/**
 * 请求方信息：限流键（来源地址）与 User-Agent，用于限流与审计。
 */
public record ClientInfo(String ip, String userAgent) {

    public static final String UNKNOWN = "unknown";

    public ClientInfo {
        ip = ip == null || ip.isBlank() ? UNKNOWN : ip.trim();
        userAgent = userAgent == null || userAgent.isBlank() ? UNKNOWN : userAgent;
    }
}
