package com.resilia.neurogrid.core.config;

import com.resilia.neurogrid.common.domain.enums.StorageType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * neurogrid 配置映射
 */
@Data
@Component
@ConfigurationProperties(prefix = "neurogrid")
public class NeuroGridProperties {

    /**
     * 本节点身份与拓扑
     */
    private NodeConfig node = new NodeConfig();

    /**
     * 控制周期
     */
    private ControlConfig control = new ControlConfig();

    /**
     * 遥测窗口
     */
    private TelemetryConfig telemetry = new TelemetryConfig();

    /**
     * 供需预测
     */
    private EstimatorConfig estimator = new EstimatorConfig();

    /**
     * 储能层级
     */
    private List<TierConfig> storage = new ArrayList<>();

    /**
     * 调度约束
     */
    private DispatchConfig dispatch = new DispatchConfig();

    /**
     * 孤岛检测
     */
    private IslandingConfig islanding = new IslandingConfig();

    /**
     * 邻居 gossip
     */
    private GossipConfig gossip = new GossipConfig();

    /**
     * 联邦学习
     */
    private LearningConfig learning = new LearningConfig();

    /**
     * 可调负荷
     */
    private List<LoadConfig> loads = new ArrayList<>();

    // =============== 配置类定义 ===============

    @Data
    public static class NodeConfig {
        private String id = "microgrid-01";
        private String name;
        private String zone;
        private double latitude;
        private double longitude;
        /**
         * 邻居节点集合（有界邻居集，而非全网）
         */
        private List<String> peers = new ArrayList<>();
    }

    @Data
    public static class ControlConfig {
        private boolean enabled = true;
        private long periodMs = 1000;
        /**
         * 单周期实时预算（毫秒）
         */
        private long budgetMs = 50;
        /**
         * 连续超预算多少个周期视为通信劣化
         */
        private int maxBudgetOverruns = 3;
        private long initialDelayMs = 2000;
    }

    @Data
    public static class TelemetryConfig {
        /**
         * 滚动窗口时长
         */
        private long windowMs = 300_000;
        /**
         * 传感器过期阈值
         */
        private long stalenessMs = 5_000;
        /**
         * 单条序列最大样本数
         */
        private int maxSamplesPerSeries = 2_000;
    }

    @Data
    public static class EstimatorConfig {
        private int horizonSteps = 12;
        private long stepMs = 1000;
        private double ewmaAlpha = 0.2;
        private double errorThresholdKw = 5.0;
        /**
         * 误差持续超阈值多少个周期后请求重新聚合
         */
        private int sustainCycles = 30;
        private double confidenceZ = 1.96;
        private double sigmaFloorKw = 0.5;
        private double degradedWidening = 2.0;
        /**
         * 天气预报混合权重
         */
        private double feedWeight = 0.5;
        private long feedMaxGapMs = 900_000;
        private double solarFactor = 0.2;
        private double windFactor = 0.1;
    }

    @Data
    public static class TierConfig {
        private String id;
        private StorageType type = StorageType.BATTERY;
        /**
         * 为空时取类型默认排序
         */
        private Integer rank;
        private double capacityKwh;
        private double initialSoc = 0.5;
        private double maxChargeKw;
        private double maxDischargeKw;
        private double efficiency = 0.9;
    }

    @Data
    public static class DispatchConfig {
        private double toleranceKw = 0.01;
        private double rateMargin = 1.0;
        /**
         * 越限后重算时的收紧系数
         */
        private double tightenFactor = 0.9;
        /**
         * 自治能力评估的最小时长
         */
        private long autonomyHorizonMs = 900_000;
    }

    @Data
    public static class IslandingConfig {
        private long heartbeatTimeoutMs = 2_000;
        private long debounceMs = 1_000;
        private double nominalFrequencyHz = 50.0;
        private double frequencyToleranceHz = 0.5;
        private double voltageTolerancePu = 0.1;
        private double phaseToleranceDeg = 10.0;
        /**
         * 重新同步确认时长：电压/频率/相角持续对齐多久才允许合闸
         */
        private long resyncConfirmationMs = 5_000;
        private int historySize = 100;
    }

    @Data
    public static class GossipConfig {
        private boolean enabled = true;
        /**
         * 传输方式：MQTT / IN_MEMORY
         */
        private String transport = "IN_MEMORY";
        private long periodMs = 5_000;
        private int fanout = 3;
        private long timeoutMs = 1_000;
        private long peerTtlMs = 15_000;
        private MqttConfig mqtt = new MqttConfig();
    }

    @Data
    public static class MqttConfig {
        private String brokerUrl = "tcp://localhost:1883";
        private String clientId;
        private String username;
        private String password;
        private String topicPrefix = "neurogrid/gossip";
        private int qos = 1;
        private boolean cleanSession = true;
        private int connectionTimeout = 10;
        private int keepAliveInterval = 30;
    }

    @Data
    public static class LearningConfig {
        private boolean enabled = true;
        private long periodMs = 60_000;
        private double learningRate = 0.05;
        private double biasLearningRate = 0.01;
        private double maxDeltaMagnitude = 0.05;
        private int maxStalenessRounds = 5;
        private double stalenessDecay = 0.5;
        private double initialReserveFraction = 0.1;
        private double reserveStep = 0.01;
        private double maxReserveFraction = 0.3;
    }

    @Data
    public static class LoadConfig {
        private String id;
        /**
         * 1 为最高优先级
         */
        private int priority = 5;
        /**
         * 可削减比例 0..1
         */
        private double flexibility;
        private boolean critical;
    }
}
