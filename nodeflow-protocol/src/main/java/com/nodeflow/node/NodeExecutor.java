package com.nodeflow.node;

import com.nodeflow.envelope.DataEnvelope;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Contract every node type implements.
 * <p>
 * {@link #execute} must not throw and must not complete the future exceptionally: every failure is an
 * error {@link DataEnvelope}. The scheduler treats a thrown exception as a fatal internal error and aborts
 * the run. Given identical config and inputs an executor must produce the same output, apart from timing.
 */
public interface NodeExecutor {

    /** Static ports and default configuration of the node type this executor implements. */
    NodeDefinition definition();

    /**
     * Executes the node.
     *
     * @param config       effective configuration (definition defaults overlaid by the node's config)
     * @param inputsByPort envelopes that arrived, keyed by input port; ports with no input are absent
     * @param context      run, node and call-stack identity
     * @return future of the node's output envelope
     */
    CompletableFuture<DataEnvelope> execute(Map<String, Object> config,
                                            Map<String, DataEnvelope> inputsByPort,
                                            NodeExecutionContext context);

    /** Checks configuration before a run. Default: always valid. */
    default ValidationResult validate(Map<String, Object> config) {
        return ValidationResult.success();
    }

    default String type() {
        return definition().type();
    }
}
