package com.nextsub.common.exception;

/**
 * 验证码存储或限流存储不可用（连接失败、超时等），不做自动重试，按服务端错误处理。
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
