package org.meshbus;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.meshbus.api.providers.ServiceType;
import org.meshbus.api.resources.IMonitorable;
import org.meshbus.api.resources.OperationalError;
import org.meshbus.audit.AuditTrail;
import org.meshbus.buses.AbstractBus;
import org.meshbus.buses.BusStats;
import org.meshbus.buses.communication.CommunicationBus;
import org.meshbus.buses.llm.LlmBus;
import org.meshbus.buses.runtime.RuntimeControlBus;
import org.meshbus.buses.tool.ToolBus;
import org.meshbus.buses.wise.WiseBus;
import org.meshbus.registry.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns the five buses of the mesh and their shared {@link ServiceRegistry}.
 * <p>
 * Each bus reads its block under {@code meshbus.buses} ({@code communication}, {@code tool},
 * {@code llm}, {@code wise}, {@code runtime}), falling back to {@code meshbus.buses.defaults}.
 * Buses start in the order communication, tool, llm, wise, runtime and stop in reverse.
 */
public class BusManager implements IMonitorable {

    private static final Logger log = LoggerFactory.getLogger(BusManager.class);

    private final Config meshConfig;
    private final ServiceRegistry registry;
    private final CommunicationBus communicationBus;
    private final ToolBus toolBus;
    private final LlmBus llmBus;
    private final WiseBus wiseBus;
    private final RuntimeControlBus runtimeControlBus;
    private final Map<ServiceType, AbstractBus<?>> buses = new EnumMap<>(ServiceType.class);

    /**
     * Creates the manager with its own registry and audit trail.
     *
     * @param rootConfig Configuration containing a {@code meshbus} section.
     * @throws IllegalArgumentException if the section is missing or invalid.
     */
    public BusManager(Config rootConfig) {
        this(rootConfig, new ServiceRegistry(loadMeshConfig(rootConfig), new AuditTrail(), Clock.systemUTC()));
    }

    /**
     * Creates the manager around an existing registry.
     *
     * @param rootConfig Configuration containing a {@code meshbus} section.
     * @param registry   The registry shared by all buses.
     * @throws IllegalArgumentException if the section is missing or invalid.
     */
    public BusManager(Config rootConfig, ServiceRegistry registry) {
        this.meshConfig = loadMeshConfig(rootConfig);
        this.registry = registry;
        log.info("Initializing BusManager...");

        this.communicationBus = new CommunicationBus(registry, busConfig("communication"));
        this.toolBus = new ToolBus(registry, busConfig("tool"));
        this.llmBus = new LlmBus(registry, busConfig("llm"));
        this.wiseBus = new WiseBus(registry, busConfig("wise"));
        this.runtimeControlBus = new RuntimeControlBus(registry, busConfig("runtime"));

        buses.put(ServiceType.COMMUNICATION, communicationBus);
        buses.put(ServiceType.TOOL, toolBus);
        buses.put(ServiceType.LLM, llmBus);
        buses.put(ServiceType.WISE_AUTHORITY, wiseBus);
        buses.put(ServiceType.RUNTIME_CONTROL, runtimeControlBus);
        log.info("BusManager initialized with {} buses.", buses.size());
    }

    private static Config loadMeshConfig(Config rootConfig) {
        if (!rootConfig.hasPath("meshbus")) {
            throw new IllegalArgumentException("Configuration must contain 'meshbus' section");
        }
        return rootConfig.getConfig("meshbus");
    }

    private Config busConfig(String name) {
        Config defaults = meshConfig.hasPath("buses.defaults")
            ? meshConfig.getConfig("buses.defaults")
            : ConfigFactory.empty();
        String path = "buses." + name;
        Config own = meshConfig.hasPath(path) ? meshConfig.getConfig(path) : ConfigFactory.empty();
        return own.withFallback(defaults);
    }

    /**
     * Starts every stopped bus. Buses already running are left alone.
     */
    public void startAll() {
        log.info("\u001B[34m══════════════════════════════════ Bus Startup ══════════════════════════════════════════\u001B[0m");
        for (AbstractBus<?> bus : buses.values()) {
            if (bus.getCurrentState() == AbstractBus.State.STOPPED) {
                bus.start();
            }
        }
    }

    /**
     * Stops every bus in reverse start order, draining their queues.
     */
    public void stopAll() {
        log.info("\u001B[34m═════════════════════════════════ Bus Shutdown ══════════════════════════════════════════\u001B[0m");
        List<AbstractBus<?>> reversed = new ArrayList<>(buses.values());
        Collections.reverse(reversed);
        for (AbstractBus<?> bus : reversed) {
            bus.stop();
        }
        log.info("All buses stopped.");
    }

    /**
     * @return Stats of every bus, in start order.
     */
    public Map<ServiceType, BusStats> getStats() {
        Map<ServiceType, BusStats> stats = new LinkedHashMap<>();
        buses.forEach((type, bus) -> stats.put(type, bus.getStats()));
        return stats;
    }

    public AbstractBus<?> getBus(ServiceType serviceType) {
        return buses.get(serviceType);
    }

    public ServiceRegistry getRegistry() {
        return registry;
    }

    public CommunicationBus getCommunicationBus() {
        return communicationBus;
    }

    public ToolBus getToolBus() {
        return toolBus;
    }

    public LlmBus getLlmBus() {
        return llmBus;
    }

    public WiseBus getWiseBus() {
        return wiseBus;
    }

    public RuntimeControlBus getRuntimeControlBus() {
        return runtimeControlBus;
    }

    /**
     * Returns every bus metric prefixed with the bus's service type, e.g. {@code tool.processed}.
     */
    @Override
    public Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        buses.forEach((type, bus) -> bus.getMetrics()
            .forEach((name, value) -> metrics.put(type.name().toLowerCase() + "." + name, value)));
        return metrics;
    }

    @Override
    public List<OperationalError> getErrors() {
        List<OperationalError> errors = new ArrayList<>();
        buses.values().forEach(bus -> errors.addAll(bus.getErrors()));
        return errors;
    }

    @Override
    public void clearErrors() {
        buses.values().forEach(AbstractBus::clearErrors);
    }

    @Override
    public boolean isHealthy() {
        return buses.values().stream().allMatch(AbstractBus::isHealthy);
    }
}
