package com.ecommerce.guard.config;

import com.ecommerce.guard.web.StressGateInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC 配置
 */
@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

    private final GuardProperties properties;
    private final StressGateInterceptor stressGateInterceptor;

    /**
     * 跨域配置（仅状态接口）
     */
    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping(properties.getApi().getEndpointPrefix() + "/**")
            .allowedOriginPatterns(properties.getApi().getCorsOrigins().toArray(new String[0]))
            .allowedMethods("GET", "POST", "OPTIONS")
            .allowedHeaders("*")
            .allowCredentials(true)
            .maxAge(3600);
    }

    /**
     * 压力闸门，状态接口与 actuator 不受影响
     */
    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(stressGateInterceptor)
            .addPathPatterns("/**")
            .excludePathPatterns("/actuator/**", properties.getApi().getEndpointPrefix() + "/**", "/error");
    }
}
