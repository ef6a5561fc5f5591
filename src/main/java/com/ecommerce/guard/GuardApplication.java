package com.ecommerce.guard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 资源守护服务启动类
 * 进程内自适应资源压力控制：采样、回收、分级降载
 */
@SpringBootApplication
public class GuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(GuardApplication.class, args);
    }
}
