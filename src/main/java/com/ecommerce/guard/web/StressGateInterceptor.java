package com.ecommerce.guard.web;

import com.ecommerce.guard.dto.ApiResponse;
import com.ecommerce.guard.stress.GateDecision;
import com.ecommerce.guard.stress.StressRequestGate;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;

/**
 * 请求前置闸门：压力状态下拒绝非关键请求
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StressGateInterceptor implements HandlerInterceptor {

    private final StressRequestGate stressRequestGate;
    private final ObjectMapper objectMapper;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        String handlerName = handler instanceof HandlerMethod method ? method.getMethod().getName() : null;

        GateDecision decision = stressRequestGate.evaluate(path, handlerName);
        if (decision.allowed()) {
            return true;
        }

        log.debug("Request rejected by stress gate: path={}, status={}", path, decision.status());
        response.setStatus(decision.status());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setHeader("Retry-After", "5");
        response.getWriter().write(objectMapper.writeValueAsString(
            ApiResponse.error(decision.status(), decision.message())));
        return false;
    }
}
