/**
 * Canonical flow document model.
 * <ul>
 *   <li>{@link com.convoflow.schema.model.FlowDocument} – meta, context, global functions, nodes and the edge cache</li>
 *   <li>{@link com.convoflow.schema.model.FlowNode} / {@link com.convoflow.schema.model.NodeData} – a conversation step</li>
 *   <li>{@link com.convoflow.schema.model.FlowFunction} – callable function with routing ({@code next_node_id} or {@link com.convoflow.schema.model.Decision})</li>
 * </ul>
 * All types are immutable; use the {@code with...} and {@code copy()} methods to derive new values.
 */
package com.convoflow.schema.model;
