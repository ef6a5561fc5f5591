package com.ecommerce.guard.controller;

import com.ecommerce.guard.config.GuardProperties;
import com.ecommerce.guard.dto.ApiResponse;
import com.ecommerce.guard.dto.MemoryLimitRequest;
import com.ecommerce.guard.dto.OptimizeRequest;
import com.ecommerce.guard.exception.ManagementAccessDeniedException;
import com.ecommerce.guard.monitor.ResourceUsage;
import com.ecommerce.guard.optimizer.GrowthReport;
import com.ecommerce.guard.optimizer.MemoryLimitResult;
import com.ecommerce.guard.optimizer.MemorySpike;
import com.ecommerce.guard.optimizer.OptimizationResult;
import com.ecommerce.guard.service.GuardStatus;
import com.ecommerce.guard.service.ResourceGuardService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * 资源守护状态与管理 API
 * <p>
 * - 状态：/status、/system
 * - 明细（api.detailed-endpoints）：/history、/growth、/spikes、/metrics
 * - 管理（api.management-endpoints，需 X-Auth-Token）：/optimize、/limit
 */
@RestController
@RequestMapping("${guard.api.endpoint-prefix:/api/guard}")
@ConditionalOnProperty(prefix = "guard.api", name = "enabled", havingValue = "true", matchIfMissing = true)
public class GuardController {

    private static final Logger log = LoggerFactory.getLogger(GuardController.class);

    static final String AUTH_HEADER = "X-Auth-Token";

    private final ResourceGuardService guardService;
    private final GuardProperties properties;

    public GuardController(ResourceGuardService guardService, GuardProperties properties) {
        this.guardService = guardService;
        this.properties = properties;
    }

    // ========== 状态 ==========

    @GetMapping("/status")
    public ApiResponse<GuardStatus> status() {
        return ApiResponse.success(guardService.currentStatus());
    }

    @GetMapping("/system")
    public ApiResponse<Map<String, Object>> system() {
        return ApiResponse.success(guardService.systemSummary());
    }

    // ========== 明细 ==========

    @GetMapping("/history")
    public ResponseEntity<ApiResponse<List<ResourceUsage>>> history(@RequestParam(defaultValue = "5") int minutes) {
        if (!properties.getApi().isDetailedEndpoints()) {
            return notFound();
        }
        return ResponseEntity.ok(ApiResponse.success(guardService.usageHistory(minutes)));
    }

    @GetMapping("/growth")
    public ResponseEntity<ApiResponse<GrowthReport>> growth() {
        if (!properties.getApi().isDetailedEndpoints()) {
            return notFound();
        }
        return ResponseEntity.ok(ApiResponse.success(guardService.growthReport()));
    }

    @GetMapping("/spikes")
    public ResponseEntity<ApiResponse<List<MemorySpike>>> spikes() {
        if (!properties.getApi().isDetailedEndpoints()) {
            return notFound();
        }
        return ResponseEntity.ok(ApiResponse.success(guardService.memorySpikes()));
    }

    @GetMapping("/metrics")
    public ResponseEntity<ApiResponse<Map<String, Object>>> metrics() {
        if (!properties.getApi().isDetailedEndpoints()) {
            return notFound();
        }
        return ResponseEntity.ok(ApiResponse.success(guardService.metrics()));
    }

    // ========== 管理 ==========

    @PostMapping("/optimize")
    public ResponseEntity<ApiResponse<OptimizationResult>> optimize(
            @RequestHeader(value = AUTH_HEADER, required = false) String token,
            @RequestBody(required = false) OptimizeRequest request) {
        if (!properties.getApi().isManagementEndpoints()) {
            return notFound();
        }
        checkToken(token);
        String level = request != null ? request.getLevel() : null;
        log.info("Manual memory optimization requested: level={}", level);
        return ResponseEntity.ok(ApiResponse.success(guardService.optimize(level)));
    }

    @PostMapping("/limit")
    public ResponseEntity<ApiResponse<MemoryLimitResult>> limit(
            @RequestHeader(value = AUTH_HEADER, required = false) String token,
            @RequestBody MemoryLimitRequest request) {
        if (!properties.getApi().isManagementEndpoints()) {
            return notFound();
        }
        checkToken(token);
        if (request.getLimitMb() == null) {
            throw new IllegalArgumentException("limitMb is required");
        }
        log.info("Memory limit requested: {}MB", request.getLimitMb());
        MemoryLimitResult result = guardService.setMemoryLimit(request.getLimitMb());
        if (!result.success()) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ApiResponse.<MemoryLimitResult>builder()
                    .code(HttpStatus.UNPROCESSABLE_ENTITY.value())
                    .message(result.message())
                    .data(result)
                    .timestamp(System.currentTimeMillis())
                    .build());
        }
        return ResponseEntity.ok(ApiResponse.success(result));
    }

    private void checkToken(String token) {
        String expected = properties.getApi().getAuthToken();
        if (expected != null && !expected.isEmpty() && !expected.equals(token)) {
            throw new ManagementAccessDeniedException("Invalid or missing " + AUTH_HEADER);
        }
    }

    private static <T> ResponseEntity<ApiResponse<T>> notFound() {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.notFound("Endpoint disabled"));
    }
}
