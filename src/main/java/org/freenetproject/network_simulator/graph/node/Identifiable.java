package org.freenetproject.network_simulator.graph.node;

/**
 * Anything which can be resolved to a node of a graph: either an identifier or a node.
 */
public interface Identifiable {
	/**
	 * @return identifier of the node referred to.
	 */
	public NodeId getId();
}
