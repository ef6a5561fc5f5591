package com.ecommerce.guard.dto;

import lombok.Data;

/**
 * 地址空间限制请求
 */
@Data
public class MemoryLimitRequest {

    private Long limitMb;
}
