package com.ecommerce.guard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 资源守护配置属性类
 * <p>
 * 所有分组都带默认值，未提供配置时各组件按默认值运行。
 */
@Data
@ConfigurationProperties(prefix = "guard")
public class GuardProperties {

    /** 回收（GC）配置 */
    private GcConfig gc = new GcConfig();

    /** 内存阈值配置 */
    private ThresholdsConfig thresholds = new ThresholdsConfig();

    /** 采样监控配置 */
    private MonitoringConfig monitoring = new MonitoringConfig();

    /** 压力处理配置 */
    private StressConfig stress = new StressConfig();

    /** 状态/管理接口配置 */
    private ApiConfig api = new ApiConfig();

    @Data
    public static class GcConfig {
        /** 是否启用周期回收 */
        private boolean enabled = true;
        /** 触发回收的进程内存占比（%） */
        private double thresholdPercent = 70.0;
        /** 周期回收间隔（秒），0 表示关闭 */
        private double intervalSeconds = 300.0;
        /** 调优系数 */
        private double tuneFactor = 0.8;
        /** 启动时是否按物理内存调优阈值 */
        private boolean tuneThresholds = true;
        /** 调试标志，非 0 时打开 verbose GC 输出 */
        private int debugFlags = 0;
        /** 内存系数的除数（GB） */
        private double memoryFactorDivisorGb = 4.0;
        /** 内存系数下限 */
        private double memoryFactorMin = 0.5;
        /** 内存系数上限 */
        private double memoryFactorMax = 2.0;
        /** 基础阈值（堆内存池容量百分比） */
        private PoolThresholds baseThresholds = new PoolThresholds(40, 45, 55);
        /** 阈值下限 */
        private PoolThresholds thresholdFloors = new PoolThresholds(20, 20, 30);
        /** 阈值上限（%） */
        private int thresholdCeiling = 95;
        /** 估算回收对象数时使用的平均对象大小（字节） */
        private long averageObjectSizeBytes = 100;
    }

    @Data
    public static class PoolThresholds {
        private int young;
        private int survivor;
        private int tenured;

        public PoolThresholds() {
        }

        public PoolThresholds(int young, int survivor, int tenured) {
            this.young = young;
            this.survivor = survivor;
            this.tenured = tenured;
        }
    }

    @Data
    public static class ThresholdsConfig {
        /** 告警阈值（%） */
        private double warningPercent = 70.0;
        /** 严重阈值（%） */
        private double criticalPercent = 85.0;
        /** 紧急阈值（%） */
        private double emergencyPercent = 95.0;
        /** 泄漏判定阈值（每小时增长 %） */
        private double leakPercent = 10.0;
        /** 相邻两次采样进程内存增量超过该值视为突增（MB） */
        private double spikeThresholdMb = 50.0;
    }

    @Data
    public static class MonitoringConfig {
        /** 是否自动启动采样 */
        private boolean enabled = true;
        /** 采样间隔（秒） */
        private double intervalSeconds = 5.0;
        /** 历史快照容量 */
        private int historySize = 720;
        /** 每 N 次采样刷新一次硬件信息 */
        private int refreshEveryTicks = 120;
        /** 磁盘容量统计路径，为空时使用工作目录 */
        private String diskPath;
    }

    @Data
    public static class StressConfig {
        /** 是否启用压力处理 */
        private boolean enabled = true;
        /** 正常状态检查间隔（秒） */
        private double normalCheckInterval = 5.0;
        /** 压力状态检查间隔（秒） */
        private double stressCheckInterval = 1.0;
        /** 判定为持续压力的时长（秒） */
        private double stressDurationSeconds = 30.0;
        /** CPU 压力阈值（%） */
        private double cpuThresholdPercent = 80.0;
        /** 网络压力阈值（MB/s） */
        private double networkThresholdMbs = 100.0;
        /** 关键接口，熔断期间放行（支持 Ant 风格路径） */
        private List<String> criticalEndpoints = new ArrayList<>();
        /** 启用的压力动作 */
        private List<String> stressActions = new ArrayList<>(List.of(
            "reduce_logging", "pause_background", "optimize_memory", "circuit_break", "throttle_requests"));
        /** 最长压力时间（秒），0 表示不限 */
        private double maxStressTime = 300.0;
        /** 限流时每秒放行请求数 */
        private int throttlePermitsPerSecond = 100;
    }

    @Data
    public static class ApiConfig {
        /** 是否启用状态接口 */
        private boolean enabled = true;
        /** 接口前缀 */
        private String endpointPrefix = "/api/guard";
        /** 是否开放明细接口 */
        private boolean detailedEndpoints = true;
        /** 是否开放管理接口 */
        private boolean managementEndpoints = false;
        /** 管理接口令牌 */
        private String authToken;
        /** 允许的跨域来源 */
        private List<String> corsOrigins = new ArrayList<>(List.of("*"));
    }
}
