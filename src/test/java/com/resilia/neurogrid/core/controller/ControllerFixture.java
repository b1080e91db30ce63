package com.resilia.neurogrid.core.controller;

import com.resilia.neurogrid.common.domain.entity.MicrogridNode;
import com.resilia.neurogrid.common.domain.entity.TelemetrySample;
import com.resilia.neurogrid.common.domain.enums.StorageType;
import com.resilia.neurogrid.common.domain.enums.TelemetryQuantity;
import com.resilia.neurogrid.core.command.CommandEmitter;
import com.resilia.neurogrid.core.command.CommandGate;
import com.resilia.neurogrid.core.command.GridCommand;
import com.resilia.neurogrid.core.command.LoadSheddingPlanner;
import com.resilia.neurogrid.core.config.NeuroGridProperties;
import com.resilia.neurogrid.core.dispatch.StorageBank;
import com.resilia.neurogrid.core.dispatch.StorageDispatcher;
import com.resilia.neurogrid.core.estimator.RenewableProductionModel;
import com.resilia.neurogrid.core.estimator.SupplyDemandEstimator;
import com.resilia.neurogrid.core.gossip.InMemoryGossipNetwork;
import com.resilia.neurogrid.core.gossip.InMemoryGossipTransport;
import com.resilia.neurogrid.core.gossip.PeerGossip;
import com.resilia.neurogrid.core.islanding.IslandingStateMachine;
import com.resilia.neurogrid.core.learning.FederatedLearningCoordinator;
import com.resilia.neurogrid.core.learning.LocalModelTrainer;
import com.resilia.neurogrid.core.learning.StalenessWeightedAggregator;
import com.resilia.neurogrid.core.telemetry.TelemetryIngest;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 用真实组件装配一个不依赖 Spring 容器的控制器
 */
public class ControllerFixture implements AutoCloseable {

    public final NeuroGridProperties properties;
    public final MicrogridNode node;
    public final TelemetryIngest ingest;
    public final StorageBank storageBank;
    public final IslandingStateMachine stateMachine;
    public final PeerGossip peerGossip;
    public final LocalModelTrainer trainer;
    public final FederatedLearningCoordinator coordinator;
    public final InMemoryGossipNetwork network;
    public final LocalController controller;
    public final List<GridCommand> delivered = new ArrayList<>();
    public final List<Object> events = new ArrayList<>();

    private final ExecutorService networkExecutor = Executors.newCachedThreadPool();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

    public ControllerFixture(NeuroGridProperties properties) {
        this.properties = properties;
        this.node = new MicrogridNode(properties.getNode().getId(), null, null, 0, 0, properties.getNode().getPeers());
        this.ingest = new TelemetryIngest(properties);
        this.storageBank = new StorageBank(properties);
        this.stateMachine = new IslandingStateMachine(properties, node);
        this.network = new InMemoryGossipNetwork(networkExecutor);
        this.peerGossip = new PeerGossip(properties, new InMemoryGossipTransport(network), scheduler);
        this.trainer = new LocalModelTrainer(properties);
        this.coordinator = new FederatedLearningCoordinator(properties, trainer,
                new StalenessWeightedAggregator(properties), peerGossip, scheduler, Runnable::run);
        this.controller = new LocalController(
                properties,
                node,
                ingest,
                new SupplyDemandEstimator(properties, events::add, new RenewableProductionModel(properties)),
                new StorageDispatcher(),
                storageBank,
                stateMachine,
                new CommandGate(),
                new CommandEmitter(delivered::add),
                new LoadSheddingPlanner(properties),
                peerGossip,
                coordinator,
                trainer,
                scheduler);
    }

    /**
     * 单节点、单电池、一个可削减负荷
     */
    public static NeuroGridProperties defaultProperties() {
        NeuroGridProperties properties = new NeuroGridProperties();
        properties.getNode().setId("node-a");
        properties.getControl().setPeriodMs(1_000);
        properties.getControl().setBudgetMs(10_000);
        properties.getTelemetry().setStalenessMs(5_000);
        properties.getEstimator().setHorizonSteps(12);
        properties.getEstimator().setStepMs(1_000);

        NeuroGridProperties.TierConfig battery = new NeuroGridProperties.TierConfig();
        battery.setId("battery");
        battery.setType(StorageType.BATTERY);
        battery.setCapacityKwh(100);
        battery.setInitialSoc(0.5);
        battery.setMaxChargeKw(50);
        battery.setMaxDischargeKw(50);
        battery.setEfficiency(1.0);
        properties.setStorage(new ArrayList<>(List.of(battery)));

        NeuroGridProperties.LoadConfig load = new NeuroGridProperties.LoadConfig();
        load.setId("load");
        load.setPriority(5);
        load.setFlexibility(0.5);
        properties.setLoads(new ArrayList<>(List.of(load)));
        return properties;
    }

    public void balance(double productionKw, double consumptionKw, long timestamp) {
        ingest.submit(TelemetrySample.of("pv", TelemetryQuantity.PRODUCTION_KW, productionKw, timestamp));
        ingest.submit(TelemetrySample.of("load", TelemetryQuantity.CONSUMPTION_KW, consumptionKw, timestamp));
    }

    public void heartbeat(long timestamp) {
        ingest.submit(TelemetrySample.of("grid", TelemetryQuantity.GRID_HEARTBEAT, 1, timestamp));
        ingest.submit(TelemetrySample.of("grid", TelemetryQuantity.GRID_FREQUENCY_HZ, 50.0, timestamp));
        ingest.submit(TelemetrySample.of("grid", TelemetryQuantity.GRID_VOLTAGE_PU, 1.0, timestamp));
        ingest.submit(TelemetrySample.of("grid", TelemetryQuantity.GRID_PHASE_DEG, 0.0, timestamp));
    }

    @Override
    public void close() {
        controller.stop();
        peerGossip.stop();
        scheduler.shutdownNow();
        networkExecutor.shutdownNow();
    }
}
