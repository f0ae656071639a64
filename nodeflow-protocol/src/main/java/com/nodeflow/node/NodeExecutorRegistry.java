package com.nodeflow.node;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single responsibility: map node type strings to {@link NodeExecutor}s.
 * Registration is rejected for blank or already registered types.
 */
public final class NodeExecutorRegistry {

    private static final Logger log = LoggerFactory.getLogger(NodeExecutorRegistry.class);

    private final Map<String, NodeExecutor> executorsByType = new ConcurrentHashMap<>();

    /**
     * Registers an executor under its definition's type.
     *
     * @throws IllegalArgumentException if the type is already registered
     */
    public NodeExecutorRegistry register(NodeExecutor executor) {
        return register(executor.type(), executor);
    }

    /**
     * Registers an executor under an explicit type (aliases such as {@code workflowTrigger}).
     *
     * @throws IllegalArgumentException if type is blank or already registered
     */
    public NodeExecutorRegistry register(String type, NodeExecutor executor) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("node type is blank");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor is null for type " + type);
        }
        NodeExecutor existing = executorsByType.putIfAbsent(type.trim(), executor);
        if (existing != null) {
            throw new IllegalArgumentException("Executor already registered for node type: " + type);
        }
        if (log.isDebugEnabled()) {
            log.debug("Node executor registered | type={} | executor={}", type, executor.getClass().getSimpleName());
        }
        return this;
    }

    public Optional<NodeExecutor> find(String type) {
        if (type == null) return Optional.empty();
        return Optional.ofNullable(executorsByType.get(type.trim()));
    }

    public boolean contains(String type) {
        return find(type).isPresent();
    }

    /** Registered types, sorted. */
    public Set<String> types() {
        return Collections.unmodifiableSet(new TreeSet<>(executorsByType.keySet()));
    }
}
