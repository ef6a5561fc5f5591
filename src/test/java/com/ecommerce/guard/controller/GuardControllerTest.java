package com.ecommerce.guard.controller;

import com.ecommerce.guard.config.GuardProperties;
import com.ecommerce.guard.optimizer.MemoryLimitResult;
import com.ecommerce.guard.optimizer.MemorySpike;
import com.ecommerce.guard.optimizer.OptimizationLevel;
import com.ecommerce.guard.optimizer.OptimizationResult;
import com.ecommerce.guard.service.GuardStatus;
import com.ecommerce.guard.service.ResourceGuardService;
import com.ecommerce.guard.stress.StressRequestGate;
import com.ecommerce.guard.stress.StressState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * 资源守护控制器测试
 */
@WebMvcTest(controllers = GuardController.class, properties = {
    "guard.api.management-endpoints=true",
    "guard.api.auth-token=secret"
})
@Import(GuardControllerTest.PropertiesConfig.class)
class GuardControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ResourceGuardService guardService;

    @MockBean
    private StressRequestGate stressRequestGate;

    @TestConfiguration
    @EnableConfigurationProperties(GuardProperties.class)
    static class PropertiesConfig {
    }

    @Test
    @DisplayName("查询当前状态")
    void testStatus() throws Exception {
        when(guardService.currentStatus()).thenReturn(new GuardStatus(StressState.ELEVATED, 1.06, false, false,
            false, 85.0, 40.0, 512.0, 6.25, true, true, 1_700_000_000_000L));

        mockMvc.perform(get("/api/guard/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value(0))
            .andExpect(jsonPath("$.data.state").value("ELEVATED"))
            .andExpect(jsonPath("$.data.cpuPercent").value(85.0));
    }

    @Test
    @DisplayName("查询系统汇总")
    void testSystem() throws Exception {
        when(guardService.systemSummary()).thenReturn(Map.of("cpu", Map.of("percent", 12.5)));

        mockMvc.perform(get("/api/guard/system"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.cpu.percent").value(12.5));
    }

    @Test
    @DisplayName("历史查询 - 默认 5 分钟")
    void testHistory_defaultMinutes() throws Exception {
        when(guardService.usageHistory(5)).thenReturn(List.of());

        mockMvc.perform(get("/api/guard/history"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data").isArray());
    }

    @Test
    @DisplayName("历史查询 - 无效分钟数")
    void testHistory_invalidMinutes() throws Exception {
        when(guardService.usageHistory(0)).thenThrow(new IllegalArgumentException("minutes must be positive"));

        mockMvc.perform(get("/api/guard/history").param("minutes", "0"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(400));
    }

    @Test
    @DisplayName("查询内存突增记录")
    void testSpikes() throws Exception {
        when(guardService.memorySpikes()).thenReturn(List.of(
            new MemorySpike(1_700_000_000_000L, 130.0, 200.0, 70.0, 60.0)));

        mockMvc.perform(get("/api/guard/spikes"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].diffMb").value(70.0))
            .andExpect(jsonPath("$.data[0].currentMb").value(200.0));
    }

    @Test
    @DisplayName("手动优化 - 缺少令牌")
    void testOptimize_missingToken() throws Exception {
        mockMvc.perform(post("/api/guard/optimize")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"level\":\"aggressive\"}"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.code").value(401));

        verify(guardService, never()).optimize(anyString());
    }

    @Test
    @DisplayName("手动优化 - 成功")
    void testOptimize_success() throws Exception {
        when(guardService.optimize("aggressive")).thenReturn(new OptimizationResult(OptimizationLevel.AGGRESSIVE,
            200L * 1024 * 1024, 150L * 1024 * 1024, 50L * 1024 * 1024, 50.0, 12, Map.of()));

        mockMvc.perform(post("/api/guard/optimize")
                .header("X-Auth-Token", "secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"level\":\"aggressive\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.level").value("AGGRESSIVE"))
            .andExpect(jsonPath("$.data.savedMb").value(50.0));
    }

    @Test
    @DisplayName("设置内存上限 - 缺少参数")
    void testLimit_missingValue() throws Exception {
        mockMvc.perform(post("/api/guard/limit")
                .header("X-Auth-Token", "secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("设置内存上限 - 平台不支持")
    void testLimit_unsupported() throws Exception {
        when(guardService.setMemoryLimit(anyLong()))
            .thenReturn(MemoryLimitResult.failure(256, "Address-space limiting is not supported on Mac OS X"));

        mockMvc.perform(post("/api/guard/limit")
                .header("X-Auth-Token", "secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"limitMb\":256}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.code").value(422))
            .andExpect(jsonPath("$.data.success").value(false));
    }
}
