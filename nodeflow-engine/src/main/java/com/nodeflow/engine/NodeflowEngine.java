package com.nodeflow.engine;

import com.nodeflow.config.NodeflowConfig;
import com.nodeflow.engine.executors.BuiltinNodeExecutors;
import com.nodeflow.engine.subworkflow.InMemoryWorkflowCatalog;
import com.nodeflow.engine.subworkflow.InProcessWorkflowLauncher;
import com.nodeflow.engine.subworkflow.WorkflowCatalog;
import com.nodeflow.engine.subworkflow.WorkflowLauncher;
import com.nodeflow.envelope.DataEnvelope;
import com.nodeflow.graph.WorkflowGraph;
import com.nodeflow.node.NodeExecutor;
import com.nodeflow.node.NodeExecutorRegistry;
import com.nodeflow.scriptlet.ScriptletEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires a ready-to-use engine: configuration, scriptlet evaluator, timeout guard, the built-in executors
 * (plus any custom ones) and the scheduler. Sub-workflows go to the configured {@link WorkflowLauncher};
 * without one they run in process against the configured {@link WorkflowCatalog}.
 * <p>
 * Owns its threads; close it when done.
 */
public final class NodeflowEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NodeflowEngine.class);
    private static final AtomicInteger NESTED_THREADS = new AtomicInteger();

    private final NodeflowConfig config;
    private final ScriptletEvaluator evaluator;
    private final TimeoutGuard timeoutGuard;
    private final NodeExecutorRegistry registry;
    private final GraphScheduler scheduler;
    private final ExecutorService nestedRuns;

    private NodeflowEngine(Builder b) {
        this.config = b.config != null ? b.config : NodeflowConfig.fromEnvironment();
        this.evaluator = new ScriptletEvaluator(config.getScriptletCacheSize(), config.getScriptletThreads());
        this.timeoutGuard = new TimeoutGuard();
        this.nestedRuns = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "nodeflow-subworkflow-" + NESTED_THREADS.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        WorkflowLauncher launcher = b.launcher != null
                ? b.launcher
                : new InProcessWorkflowLauncher(b.catalog != null ? b.catalog : new InMemoryWorkflowCatalog(),
                this::scheduler, nestedRuns);
        this.registry = BuiltinNodeExecutors.registerAll(new NodeExecutorRegistry(), evaluator, timeoutGuard,
                launcher, config);
        for (NodeExecutor executor : b.executors) {
            registry.register(executor);
        }
        this.scheduler = new GraphScheduler(registry, timeoutGuard, config);
        log.info("Engine ready | config={} | types={}", config, registry.types().size());
    }

    public static Builder builder() {
        return new Builder();
    }

    public RunTrace run(WorkflowGraph graph, DataEnvelope initialInput, RunOptions options) {
        return scheduler.run(graph, initialInput, options);
    }

    public RunTrace run(WorkflowGraph graph, Object input) {
        return scheduler.run(graph, DataEnvelope.input(input), RunOptions.defaults());
    }

    public GraphScheduler scheduler() {
        return scheduler;
    }

    public NodeExecutorRegistry registry() {
        return registry;
    }

    public ScriptletEvaluator evaluator() {
        return evaluator;
    }

    public TimeoutGuard timeoutGuard() {
        return timeoutGuard;
    }

    public NodeflowConfig config() {
        return config;
    }

    @Override
    public void close() {
        nestedRuns.shutdownNow();
        evaluator.close();
        timeoutGuard.close();
    }

    public static final class Builder {
        private NodeflowConfig config;
        private WorkflowLauncher launcher;
        private WorkflowCatalog catalog;
        private final List<NodeExecutor> executors = new ArrayList<>();

        private Builder() {
        }

        public Builder config(NodeflowConfig config) {
            this.config = config;
            return this;
        }

        public Builder launcher(WorkflowLauncher launcher) {
            this.launcher = launcher;
            return this;
        }

        public Builder catalog(WorkflowCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder executor(NodeExecutor executor) {
            this.executors.add(executor);
            return this;
        }

        public NodeflowEngine build() {
            return new NodeflowEngine(this);
        }
    }
}
