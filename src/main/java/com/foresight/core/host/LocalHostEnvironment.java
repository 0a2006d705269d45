package com.foresight.core.host;

import com.foresight.core.model.CapabilityDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * In-process host environment.
 * <p>
 * Capabilities are the {@link Capability} beans in the application context plus
 * whatever the registered {@link CapabilitySource}s discover. Sources are enumerated
 * when capabilities are listed; lookups and dispatch reuse that listing and only
 * enumerate again for a name it does not contain. Execution contexts are tracked
 * in memory.
 */
@Component
public class LocalHostEnvironment implements HostEnvironment {

    private static final Logger log = LoggerFactory.getLogger(LocalHostEnvironment.class);

    private final Supplier<List<Capability>> capabilityBeans;
    private final Supplier<List<CapabilitySource>> sources;
    private final Supplier<List<ContextProvider>> providers;
    private final ResultRegistry registry;

    private final Map<String, ExecutionContext> contexts = new ConcurrentHashMap<>();
    private volatile Map<String, Capability> listing = Map.of();

    @Autowired
    public LocalHostEnvironment(ObjectProvider<Capability> capabilityBeans,
                                ObjectProvider<CapabilitySource> sources,
                                ObjectProvider<ContextProvider> providers,
                                ResultRegistry registry) {
        this.capabilityBeans = () -> capabilityBeans.orderedStream().toList();
        this.sources = () -> sources.orderedStream().toList();
        this.providers = () -> providers.orderedStream().toList();
        this.registry = registry;
    }

    LocalHostEnvironment(List<Capability> capabilities, List<CapabilitySource> sources,
                         List<ContextProvider> providers, ResultRegistry registry) {
        this.capabilityBeans = () -> capabilities;
        this.sources = () -> sources;
        this.providers = () -> providers;
        this.registry = registry;
    }

    @Override
    public List<CapabilityDescriptor> capabilities() {
        return resolveAll().values().stream().map(Capability::describe).toList();
    }

    @Override
    public Optional<CapabilityDescriptor> findCapability(String name) {
        return Optional.ofNullable(resolve(name)).map(Capability::describe);
    }

    @Override
    public Map<String, Object> composeContext() {
        var composed = new LinkedHashMap<String, Object>();
        for (ContextProvider provider : providers.get()) {
            try {
                Object payload = provider.provide();
                if (payload != null) {
                    composed.put(provider.name(), payload);
                }
            } catch (Exception e) {
                log.warn("Context provider '{}' failed: {}", provider.name(), e.getMessage());
            }
        }
        return composed;
    }

    @Override
    public void dispatch(String correlationId, String triggerText, String capabilityName) {
        Capability capability = resolve(capabilityName);
        if (capability == null) {
            throw new CapabilityNotFoundException(capabilityName);
        }
        log.debug("Dispatching {} [{}]", capabilityName, correlationId);
        CapabilityResult result;
        try {
            result = capability.invoke(triggerText);
        } catch (Exception e) {
            log.warn("Capability {} threw: {}", capabilityName, e.getMessage());
            result = CapabilityResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
        if (result != null) {
            registry.put(correlationId, result);
        }
    }

    @Override
    public void ensureExecutionContext(String id, String parentWorldId) {
        if (parentWorldId != null && !contexts.containsKey(parentWorldId)) {
            throw new IllegalStateException("World " + parentWorldId + " not found");
        }
        if (contexts.putIfAbsent(id, new ExecutionContext(id, parentWorldId, Instant.now())) == null) {
            log.debug("Created execution context {} (parent: {})", id, parentWorldId);
        }
    }

    @Override
    public boolean executionContextExists(String id) {
        return contexts.containsKey(id);
    }

    @Override
    public void deleteExecutionContext(String id) {
        if (contexts.remove(id) == null) {
            throw new IllegalArgumentException("Execution context " + id + " not found");
        }
        contexts.values().removeIf(ctx -> id.equals(ctx.parentId()));
    }

    int contextCount() {
        return contexts.size();
    }

    private Capability resolve(String name) {
        for (Capability capability : capabilityBeans.get()) {
            if (capability.name().equals(name)) {
                return capability;
            }
        }
        Capability listed = listing.get(name);
        return listed != null ? listed : resolveAll().get(name);
    }

    private Map<String, Capability> resolveAll() {
        var all = new ArrayList<Capability>(capabilityBeans.get());
        for (CapabilitySource source : sources.get()) {
            try {
                all.addAll(source.capabilities());
            } catch (Exception e) {
                log.warn("Capability source '{}' failed: {}", source.name(), e.getMessage());
            }
        }
        var byName = new LinkedHashMap<String, Capability>();
        for (Capability capability : all) {
            if (byName.putIfAbsent(capability.name(), capability) != null) {
                log.debug("Duplicate capability name {} ignored", capability.name());
            }
        }
        listing = Map.copyOf(byName);
        return byName;
    }

    private record ExecutionContext(String id, String parentId, Instant createdAt) {}
}
