package com.finplan.core.scheduler;

import com.finplan.core.model.ProjectionException;

import java.util.List;

/**
 * The driver graph contains a cycle. {@link #getCycle()} lists the driver ids along the cycle,
 * starting and ending with the same id.
 */
public class CyclicDependencyException extends ProjectionException {

    private final List<String> cycle;

    public CyclicDependencyException(List<String> cycle) {
        super("Circular dependency detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
