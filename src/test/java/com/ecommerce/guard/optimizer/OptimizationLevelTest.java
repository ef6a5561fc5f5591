package com.ecommerce.guard.optimizer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OptimizationLevelTest {

    @Test
    @DisplayName("空值默认为 NORMAL")
    void testFrom_blank() {
        assertEquals(OptimizationLevel.NORMAL, OptimizationLevel.from(null));
        assertEquals(OptimizationLevel.NORMAL, OptimizationLevel.from(" "));
    }

    @Test
    @DisplayName("忽略大小写")
    void testFrom_caseInsensitive() {
        assertEquals(OptimizationLevel.AGGRESSIVE, OptimizationLevel.from("aggressive"));
        assertEquals(OptimizationLevel.NORMAL, OptimizationLevel.from("Normal"));
    }

    @Test
    @DisplayName("未知级别抛出异常")
    void testFrom_unknown() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> OptimizationLevel.from("extreme"));
        assertTrue(e.getMessage().contains("extreme"));
    }
}
