package com.nextsub.auth.verification;

// 分别对应：成功、无记录、已过期、已被使用（含并发竞争失败）、不匹配、尝试次数耗尽
public enum VerificationCodeStatus {
    SUCCESS,
    NOT_FOUND,
    EXPIRED,
    ALREADY_CONSUMED,
    MISMATCH,
    TOO_MANY_ATTEMPTS
}
