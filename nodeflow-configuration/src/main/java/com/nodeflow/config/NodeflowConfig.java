package com.nodeflow.config;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration of the execution core, loaded from environment variables.
 * <p>
 * Timeouts: NODEFLOW_NODE_TIMEOUT_MS (scheduler deadline per node), NODEFLOW_SCRIPTLET_TIMEOUT_MS (function
 * and transform nodes without their own {@code timeout}), NODEFLOW_SUBWORKFLOW_TIMEOUT_MS.
 * <p>
 * Scriptlets: NODEFLOW_SCRIPTLET_CACHE_SIZE, NODEFLOW_SCRIPTLET_THREADS.
 * Sub-workflows: NODEFLOW_TRIGGER_BASE_URL, NODEFLOW_MAX_NESTING_DEPTH.
 */
public final class NodeflowConfig {

    private static final String ENV_NODE_TIMEOUT_MS = "NODEFLOW_NODE_TIMEOUT_MS";
    private static final String ENV_SCRIPTLET_TIMEOUT_MS = "NODEFLOW_SCRIPTLET_TIMEOUT_MS";
    private static final String ENV_SCRIPTLET_CACHE_SIZE = "NODEFLOW_SCRIPTLET_CACHE_SIZE";
    private static final String ENV_SCRIPTLET_THREADS = "NODEFLOW_SCRIPTLET_THREADS";
    private static final String ENV_SUBWORKFLOW_TIMEOUT_MS = "NODEFLOW_SUBWORKFLOW_TIMEOUT_MS";
    private static final String ENV_TRIGGER_BASE_URL = "NODEFLOW_TRIGGER_BASE_URL";
    private static final String ENV_MAX_NESTING_DEPTH = "NODEFLOW_MAX_NESTING_DEPTH";

    private static final long DEFAULT_NODE_TIMEOUT_MS = 300_000L;
    private static final long DEFAULT_SCRIPTLET_TIMEOUT_MS = 5_000L;
    private static final int DEFAULT_SCRIPTLET_CACHE_SIZE = 256;
    private static final int DEFAULT_SCRIPTLET_THREADS = 4;
    private static final long DEFAULT_SUBWORKFLOW_TIMEOUT_MS = 30_000L;
    private static final String DEFAULT_TRIGGER_BASE_URL = "http://localhost:5000";
    private static final int DEFAULT_MAX_NESTING_DEPTH = 16;

    private final Duration nodeTimeout;
    private final Duration scriptletTimeout;
    private final int scriptletCacheSize;
    private final int scriptletThreads;
    private final Duration subworkflowTimeout;
    private final String triggerBaseUrl;
    private final int maxNestingDepth;

    private NodeflowConfig(Builder b) {
        this.nodeTimeout = b.nodeTimeout;
        this.scriptletTimeout = b.scriptletTimeout;
        this.scriptletCacheSize = b.scriptletCacheSize;
        this.scriptletThreads = b.scriptletThreads;
        this.subworkflowTimeout = b.subworkflowTimeout;
        this.triggerBaseUrl = b.triggerBaseUrl;
        this.maxNestingDepth = b.maxNestingDepth;
    }

    /** Scheduler deadline applied to every node execution. Default 5 minutes; zero disables it. */
    public Duration getNodeTimeout() {
        return nodeTimeout;
    }

    /** Default scriptlet timeout for function and transform nodes without a {@code timeout}. Default 5s. */
    public Duration getScriptletTimeout() {
        return scriptletTimeout;
    }

    /** Maximum entries of the scriptlet result cache; the oldest entry is evicted on overflow. Default 256. */
    public int getScriptletCacheSize() {
        return scriptletCacheSize;
    }

    /** Worker threads for asynchronous scriptlet bodies. Default 4. */
    public int getScriptletThreads() {
        return scriptletThreads;
    }

    /** Default timeout of sub-workflow trigger nodes. Default 30s. */
    public Duration getSubworkflowTimeout() {
        return subworkflowTimeout;
    }

    /** Base URL of the workflow trigger endpoint ({@code POST {base}/api/workflows/{id}/trigger}). */
    public String getTriggerBaseUrl() {
        return triggerBaseUrl;
    }

    /** Longest sub-workflow call stack allowed before a trigger is refused. Default 16. */
    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public static NodeflowConfig defaults() {
        return builder().build();
    }

    public static NodeflowConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    /** Same as {@link #fromEnvironment()} but reads from the given map (tests, embedded use). */
    public static NodeflowConfig fromMap(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .nodeTimeout(Duration.ofMillis(parseLong(env.get(ENV_NODE_TIMEOUT_MS), DEFAULT_NODE_TIMEOUT_MS)))
                .scriptletTimeout(Duration.ofMillis(parseLong(env.get(ENV_SCRIPTLET_TIMEOUT_MS), DEFAULT_SCRIPTLET_TIMEOUT_MS)))
                .scriptletCacheSize(parseInt(env.get(ENV_SCRIPTLET_CACHE_SIZE), DEFAULT_SCRIPTLET_CACHE_SIZE))
                .scriptletThreads(parseInt(env.get(ENV_SCRIPTLET_THREADS), DEFAULT_SCRIPTLET_THREADS))
                .subworkflowTimeout(Duration.ofMillis(parseLong(env.get(ENV_SUBWORKFLOW_TIMEOUT_MS), DEFAULT_SUBWORKFLOW_TIMEOUT_MS)))
                .triggerBaseUrl(getValue(env.get(ENV_TRIGGER_BASE_URL), DEFAULT_TRIGGER_BASE_URL))
                .maxNestingDepth(parseInt(env.get(ENV_MAX_NESTING_DEPTH), DEFAULT_MAX_NESTING_DEPTH))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed > 0 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static long parseLong(String value, long defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(value.trim());
            return parsed >= 0 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getValue(String value, String defaultValue) {
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "NodeflowConfig{nodeTimeout=" + nodeTimeout
                + ", scriptletTimeout=" + scriptletTimeout
                + ", scriptletCacheSize=" + scriptletCacheSize
                + ", scriptletThreads=" + scriptletThreads
                + ", subworkflowTimeout=" + subworkflowTimeout
                + ", triggerBaseUrl=" + triggerBaseUrl
                + ", maxNestingDepth=" + maxNestingDepth + "}";
    }

    public static final class Builder {
        private Duration nodeTimeout = Duration.ofMillis(DEFAULT_NODE_TIMEOUT_MS);
        private Duration scriptletTimeout = Duration.ofMillis(DEFAULT_SCRIPTLET_TIMEOUT_MS);
        private int scriptletCacheSize = DEFAULT_SCRIPTLET_CACHE_SIZE;
        private int scriptletThreads = DEFAULT_SCRIPTLET_THREADS;
        private Duration subworkflowTimeout = Duration.ofMillis(DEFAULT_SUBWORKFLOW_TIMEOUT_MS);
        private String triggerBaseUrl = DEFAULT_TRIGGER_BASE_URL;
        private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;

        public Builder nodeTimeout(Duration nodeTimeout) {
            this.nodeTimeout = Objects.requireNonNull(nodeTimeout, "nodeTimeout");
            return this;
        }

        public Builder scriptletTimeout(Duration scriptletTimeout) {
            this.scriptletTimeout = Objects.requireNonNull(scriptletTimeout, "scriptletTimeout");
            return this;
        }

        public Builder scriptletCacheSize(int scriptletCacheSize) {
            if (scriptletCacheSize < 1) throw new IllegalArgumentException("scriptletCacheSize must be >= 1");
            this.scriptletCacheSize = scriptletCacheSize;
            return this;
        }

        public Builder scriptletThreads(int scriptletThreads) {
            if (scriptletThreads < 1) throw new IllegalArgumentException("scriptletThreads must be >= 1");
            this.scriptletThreads = scriptletThreads;
            return this;
        }

        public Builder subworkflowTimeout(Duration subworkflowTimeout) {
            this.subworkflowTimeout = Objects.requireNonNull(subworkflowTimeout, "subworkflowTimeout");
            return this;
        }

        public Builder triggerBaseUrl(String triggerBaseUrl) {
            this.triggerBaseUrl = triggerBaseUrl != null && !triggerBaseUrl.isBlank()
                    ? stripTrailingSlash(triggerBaseUrl.trim()) : DEFAULT_TRIGGER_BASE_URL;
            return this;
        }

        public Builder maxNestingDepth(int maxNestingDepth) {
            if (maxNestingDepth < 1) throw new IllegalArgumentException("maxNestingDepth must be >= 1");
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public NodeflowConfig build() {
            return new NodeflowConfig(this);
        }

        private static String stripTrailingSlash(String url) {
            return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        }
    }
}
