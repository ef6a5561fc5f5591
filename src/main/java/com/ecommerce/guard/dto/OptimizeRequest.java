package com.ecommerce.guard.dto;

import lombok.Data;

/**
 * 内存优化请求
 */
@Data
public class OptimizeRequest {

    /** normal 或 aggressive，缺省为 normal */
    private String level;
}
