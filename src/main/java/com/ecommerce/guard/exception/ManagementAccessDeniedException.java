package com.ecommerce.guard.exception;

/**
 * 管理接口令牌缺失或不匹配
 */
public class ManagementAccessDeniedException extends RuntimeException {

    public ManagementAccessDeniedException(String message) {
        super(message);
    }
}
