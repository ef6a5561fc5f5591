package com.ecommerce.guard;

import com.ecommerce.guard.service.ResourceGuardService;
import com.ecommerce.guard.stress.StressState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.env.Environment;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Spring Boot 应用启动测试
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class GuardApplicationTest {

    @Autowired
    private ResourceGuardService guardService;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private Environment environment;

    @Test
    @DisplayName("应用上下文加载测试")
    void contextLoads() {
        assertDoesNotThrow(() -> guardService.currentStatus());
        assertEquals(StressState.NORMAL, guardService.currentStatus().state());
        assertFalse(guardService.currentStatus().monitoring());
    }

    @Test
    @DisplayName("状态接口可访问")
    void testStatusEndpoint() throws Exception {
        mockMvc.perform(get("/api/guard/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value(0))
            .andExpect(jsonPath("$.data.state").value("NORMAL"));
    }

    @Test
    @DisplayName("管理接口按令牌执行优化")
    void testOptimizeEndpoint() throws Exception {
        mockMvc.perform(post("/api/guard/optimize")
                .header("X-Auth-Token", "test-token")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"level\":\"normal\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.level").value("NORMAL"))
            .andExpect(jsonPath("$.data.details.collection.ran").value(true));
    }

    @Test
    @DisplayName("只暴露已装配的 actuator 端点")
    void testActuatorExposure() throws Exception {
        assertEquals("health,info,metrics",
            environment.getProperty("management.endpoints.web.exposure.include"));

        mockMvc.perform(get("/actuator/metrics"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.names").isArray());
        mockMvc.perform(get("/actuator"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$._links.metrics").exists())
            .andExpect(jsonPath("$._links.prometheus").doesNotExist());
    }
}
