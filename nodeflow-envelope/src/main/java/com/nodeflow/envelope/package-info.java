/**
 * Data flowing on graph edges.
 * <ul>
 *   <li>{@link com.nodeflow.envelope.DataEnvelope} – items plus execution meta; produced by every node</li>
 *   <li>{@link com.nodeflow.envelope.WorkflowItem} – one unit of payload (json, optional text and binary)</li>
 *   <li>{@link com.nodeflow.envelope.EnvelopeMeta} – timing, status, error, selected output port</li>
 *   <li>{@link com.nodeflow.envelope.EnvelopeJson} – wire codec (ISO-8601 instants, nulls omitted)</li>
 * </ul>
 */
package com.nodeflow.envelope;
