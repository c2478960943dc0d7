package com.querygate.registry;

import com.querygate.gateway.GatewayContext;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Explicit dependency graph for the gateway's components.
 *
 * <p>Each component is registered with a factory and the names it depends on. {@link #resolve()}
 * validates the whole graph first (unknown names and cycles fail there, before anything is
 * built) and then builds every component once, dependencies first. A registration may be
 * replaced before resolution, which is how tests substitute mocks.
 */
@Slf4j
public class ComponentRegistry {
    private final GatewayContext context;
    private final Map<String, Registration> registrations = new LinkedHashMap<>();
    private final Map<String, Object> instances = new LinkedHashMap<>();
    private List<String> resolutionOrder;

    public ComponentRegistry(GatewayContext context) {
        this.context = context;
    }

    /**
     * Creates one component from the context and its declared dependencies.
     */
    @FunctionalInterface
    public interface Factory<T> {
        T create(GatewayContext context, Dependencies dependencies);
    }

    public <T> ComponentRegistry register(String name, Class<T> type, List<String> dependsOn, Factory<? extends T> factory) {
        if (resolutionOrder != null) {
            throw new IllegalStateException("Registry already resolved; cannot register " + name);
        }
        registrations.put(name, new Registration(name, type, List.copyOf(dependsOn), factory));
        log.debug("Registered component '{}' with dependencies {}", name, dependsOn);
        return this;
    }

    /**
     * Replace a registration with a ready-made instance that has no dependencies.
     */
    public <T> ComponentRegistry override(String name, Class<T> type, T instance) {
        if (!registrations.containsKey(name)) {
            throw new IllegalArgumentException("Component '" + name + "' is not registered");
        }
        return register(name, type, List.of(), (ctx, deps) -> instance);
    }

    public boolean has(String name) {
        return registrations.containsKey(name);
    }

    public synchronized ComponentRegistry resolve() {
        if (resolutionOrder != null) {
            return this;
        }
        List<String> order = topologicalOrder();
        for (String name : order) {
            Registration registration = registrations.get(name);
            Object instance = registration.factory.create(context, new Dependencies(registration));
            if (instance == null || !registration.type.isInstance(instance)) {
                throw new IllegalStateException("Factory for '" + name + "' did not produce a " + registration.type.getSimpleName());
            }
            instances.put(name, instance);
        }
        this.resolutionOrder = Collections.unmodifiableList(order);
        log.info("Resolved {} gateway components", order.size());
        return this;
    }

    public <T> T get(String name, Class<T> type) {
        Object instance = instances.get(name);
        if (instance == null) {
            throw new IllegalStateException("Component '" + name + "' is not resolved");
        }
        return type.cast(instance);
    }

    public List<String> resolutionOrder() {
        if (resolutionOrder == null) {
            throw new IllegalStateException("Registry not resolved");
        }
        return resolutionOrder;
    }

    List<String> topologicalOrder() {
        List<String> order = new ArrayList<>(registrations.size());
        Set<String> done = new HashSet<>();
        LinkedHashSet<String> visiting = new LinkedHashSet<>();
        for (String name : registrations.keySet()) {
            visit(name, null, done, visiting, order);
        }
        return order;
    }

    private void visit(String name, String requiredBy, Set<String> done, LinkedHashSet<String> visiting, List<String> order) {
        if (done.contains(name)) {
            return;
        }
        Registration registration = registrations.get(name);
        if (registration == null) {
            throw new IllegalStateException("Component '" + requiredBy + "' depends on unregistered '" + name + "'");
        }
        if (visiting.contains(name)) {
            List<String> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (String v : visiting) {
                inCycle = inCycle || v.equals(name);
                if (inCycle) {
                    cycle.add(v);
                }
            }
            cycle.add(name);
            throw new ComponentCycleException(cycle);
        }
        visiting.add(name);
        for (String dependency : registration.dependsOn) {
            visit(dependency, name, done, visiting, order);
        }
        visiting.remove(name);
        done.add(name);
        order.add(name);
    }

    /**
     * Resolved dependencies of one component. Only declared names are reachable.
     */
    public final class Dependencies {
        private final Registration owner;

        private Dependencies(Registration owner) {
            this.owner = owner;
        }

        public <T> T get(String name, Class<T> type) {
            if (!owner.dependsOn.contains(name)) {
                throw new IllegalStateException("Component '" + owner.name + "' did not declare dependency '" + name + "'");
            }
            return ComponentRegistry.this.get(name, type);
        }
    }

    private static final class Registration {
        private final String name;
        private final Class<?> type;
        private final List<String> dependsOn;
        private final Factory<?> factory;

        private Registration(String name, Class<?> type, List<String> dependsOn, Factory<?> factory) {
            this.name = name;
            this.type = type;
            this.dependsOn = dependsOn;
            this.factory = factory;
        }
    }
}
