/**
 * Micrometer metrics for node executions and run completions, attached to runs as a
 * {@link com.nodeflow.engine.RunListener}.
 */
package com.nodeflow.features.metrics;
