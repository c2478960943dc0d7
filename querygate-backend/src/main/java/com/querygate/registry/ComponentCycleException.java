package com.querygate.registry;

import java.util.List;

/**
 * Thrown at startup when component dependencies form a cycle.
 */
public class ComponentCycleException extends IllegalStateException {
    private final List<String> cycle;

    public ComponentCycleException(List<String> cycle) {
        super("Circular component dependency: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
