package com.nodeflow.engine;

import com.nodeflow.node.CallStack;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Per-run settings. Built via {@link #builder()}; {@link #defaults()} has no listeners and an empty call stack.
 */
public final class RunOptions {

    private final String entryNodeId;
    private final String workflowId;
    private final CallStack callStack;
    private final Duration nodeTimeout;
    private final List<RunListener> listeners;

    private RunOptions(Builder b) {
        this.entryNodeId = b.entryNodeId;
        this.workflowId = b.workflowId;
        this.callStack = b.callStack != null ? b.callStack : CallStack.empty();
        this.nodeTimeout = b.nodeTimeout;
        this.listeners = List.copyOf(b.listeners);
    }

    public static RunOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Node that receives the initial input; null to use the graph's entry node or its first source. */
    public String getEntryNodeId() {
        return entryNodeId;
    }

    /** Id under which the run is reported and pushed on the call stack; null to use the graph id. */
    public String getWorkflowId() {
        return workflowId;
    }

    public CallStack getCallStack() {
        return callStack;
    }

    /** Per-node deadline; null to use the configured default. */
    public Duration getNodeTimeout() {
        return nodeTimeout;
    }

    public List<RunListener> getListeners() {
        return listeners;
    }

    public static final class Builder {
        private String entryNodeId;
        private String workflowId;
        private CallStack callStack;
        private Duration nodeTimeout;
        private final List<RunListener> listeners = new ArrayList<>();

        private Builder() {
        }

        public Builder entryNodeId(String entryNodeId) {
            this.entryNodeId = entryNodeId;
            return this;
        }

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder callStack(CallStack callStack) {
            this.callStack = callStack;
            return this;
        }

        public Builder nodeTimeout(Duration nodeTimeout) {
            this.nodeTimeout = nodeTimeout;
            return this;
        }

        public Builder listener(RunListener listener) {
            if (listener != null) listeners.add(listener);
            return this;
        }

        public Builder onNodeStateChange(BiConsumer<String, NodeRunState> callback) {
            return listener(new RunListener() {
                @Override
                public void onNodeStateChange(String nodeId, NodeRunState state) {
                    callback.accept(nodeId, state);
                }
            });
        }

        public Builder onComplete(Consumer<RunTrace> callback) {
            return listener(new RunListener() {
                @Override
                public void onComplete(RunTrace trace) {
                    callback.accept(trace);
                }
            });
        }

        public RunOptions build() {
            return new RunOptions(this);
        }
    }
}
