/**
 * Presentation side of a flow: the canvas graph and how it is kept in step with the document.
 * <ul>
 *   <li>{@code model} – {@link com.convoflow.graph.model.PresentationGraph}, nodes, derived edges</li>
 *   <li>{@code edge} – {@link com.convoflow.graph.edge.EdgeDeriver}, edges from function routing</li>
 *   <li>{@code decision} – synthetic decision nodes and their position write-back</li>
 *   <li>{@code adapter} – {@link com.convoflow.graph.adapter.FlowAdapter}, document to graph and back</li>
 *   <li>{@code edit} – rename, delete, connect and other graph edits</li>
 * </ul>
 */
package com.convoflow.graph;
