package com.resilia.neurogrid.core.dispatch;

import com.resilia.neurogrid.common.domain.entity.StorageTier;
import com.resilia.neurogrid.common.domain.entity.TelemetrySample;
import com.resilia.neurogrid.common.domain.enums.TelemetryQuantity;
import com.resilia.neurogrid.core.config.NeuroGridProperties;
import com.resilia.neurogrid.core.telemetry.TelemetryWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 储能库，持有所有储能层级的可变状态
 *
 * <p>只由控制线程修改：提交调度计划或合并 SOC 遥测。其他线程只能读取 {@link #snapshot()} 的副本。
 * 从未上报过 SOC 的层级按计划提交结果记账，视为新鲜。</p>
 */
@Slf4j
@Component
public class StorageBank {

    private static final int COMMITTED_PLAN_HISTORY = 1024;

    private final Map<String, StorageTier> tiers = new LinkedHashMap<>();
    private final Map<String, Boolean> socReported = new LinkedHashMap<>();

    /**
     * 最近提交过的计划ID，按插入顺序淘汰
     */
    private final Set<String> committedPlanIds = Collections.newSetFromMap(new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
            return size() > COMMITTED_PLAN_HISTORY;
        }
    });

    private String lastCommittedPlanId;

    @Autowired
    public StorageBank(NeuroGridProperties properties) {
        for (NeuroGridProperties.TierConfig tierConfig : properties.getStorage()) {
            StorageTier tier = fromConfig(tierConfig);
            register(tier);
        }
        log.info("储能库初始化完成, 共 {} 个层级: {}", tiers.size(), tiers.keySet());
    }

    public StorageBank(Collection<StorageTier> initialTiers) {
        for (StorageTier tier : initialTiers) {
            register(tier);
        }
    }

    private void register(StorageTier tier) {
        if (tiers.containsKey(tier.getId())) {
            throw new IllegalArgumentException("duplicate storage tier id: " + tier.getId());
        }
        tiers.put(tier.getId(), tier);
        socReported.put(tier.getId(), Boolean.FALSE);
    }

    static StorageTier fromConfig(NeuroGridProperties.TierConfig config) {
        if (config.getId() == null || config.getId().isBlank()) {
            throw new IllegalArgumentException("storage tier id must not be blank");
        }
        if (config.getCapacityKwh() <= 0) {
            throw new IllegalArgumentException("storage tier capacity must be positive: " + config.getId());
        }
        int rank = config.getRank() != null ? config.getRank() : config.getType().getDefaultRank();
        StorageTier tier = StorageTier.builder()
                .id(config.getId())
                .type(config.getType())
                .responseRank(rank)
                .capacityKwh(config.getCapacityKwh())
                .maxChargeKw(config.getMaxChargeKw())
                .maxDischargeKw(config.getMaxDischargeKw())
                .roundTripEfficiency(config.getEfficiency())
                .build();
        tier.setEnergyKwh(config.getInitialSoc() * config.getCapacityKwh());
        return tier;
    }

    /**
     * 控制线程使用的活动层级集合
     */
    public Collection<StorageTier> liveTiers() {
        return Collections.unmodifiableCollection(tiers.values());
    }

    public Optional<StorageTier> find(String tierId) {
        return Optional.ofNullable(tiers.get(tierId));
    }

    public List<StorageTier> snapshot() {
        List<StorageTier> copies = new ArrayList<>(tiers.size());
        for (StorageTier tier : tiers.values()) {
            copies.add(tier.copy());
        }
        return copies;
    }

    /**
     * 合并 SOC 遥测：新鲜样本覆盖能量，过期则标记该层级不可调度
     */
    public void applySocTelemetry(TelemetryWindow window, long now) {
        for (StorageTier tier : tiers.values()) {
            Optional<TelemetrySample> latest = window.latest(TelemetryQuantity.STORAGE_SOC, tier.getId());
            if (latest.isPresent()) {
                socReported.put(tier.getId(), Boolean.TRUE);
                TelemetrySample sample = latest.get();
                if (window.isFresh(sample)) {
                    if (sample.getTimestamp() > tier.getLastSocUpdateAt()) {
                        tier.setEnergyKwh(sample.getValue() * tier.getCapacityKwh());
                    }
                    markFreshness(tier, true, sample.getTimestamp());
                    continue;
                }
            }
            if (Boolean.TRUE.equals(socReported.get(tier.getId()))) {
                markFreshness(tier, false, now);
            }
        }
    }

    private void markFreshness(StorageTier tier, boolean fresh, long timestamp) {
        if (tier.isTelemetryFresh() != fresh) {
            if (fresh) {
                log.info("储能层级 {} SOC 遥测恢复", tier.getId());
            } else {
                log.warn("储能层级 {} SOC 遥测过期, 暂停调度该层级", tier.getId());
            }
        }
        tier.markTelemetry(fresh, timestamp);
    }

    /**
     * 将计划应用到层级能量，同一计划只生效一次
     *
     * @return 是否实际应用
     */
    public boolean commit(DispatchPlan plan, long cycleMs) {
        if (plan == null) {
            return false;
        }
        if (committedPlanIds.contains(plan.getPlanId())) {
            log.debug("调度计划 {} 已提交, 忽略重复提交", plan.getPlanId());
            return false;
        }
        double hours = cycleMs / 3_600_000.0;
        for (TierFlow flow : plan.getFlows()) {
            StorageTier tier = tiers.get(flow.getTierId());
            if (tier == null || flow.getFlowKw() == 0.0) {
                continue;
            }
            double deltaKwh = flow.getFlowKw() * hours;
            if (deltaKwh > 0) {
                deltaKwh *= tier.getRoundTripEfficiency();
            }
            tier.setEnergyKwh(tier.getEnergyKwh() + deltaKwh);
        }
        committedPlanIds.add(plan.getPlanId());
        lastCommittedPlanId = plan.getPlanId();
        return true;
    }

    public boolean hasStaleTelemetry() {
        for (StorageTier tier : tiers.values()) {
            if (!tier.isTelemetryFresh()) {
                return true;
            }
        }
        return false;
    }

    public double totalEnergyKwh() {
        double total = 0.0;
        for (StorageTier tier : tiers.values()) {
            total += tier.getEnergyKwh();
        }
        return total;
    }

    public double totalCapacityKwh() {
        double total = 0.0;
        for (StorageTier tier : tiers.values()) {
            total += tier.getCapacityKwh();
        }
        return total;
    }

    public String getLastCommittedPlanId() {
        return lastCommittedPlanId;
    }
}
