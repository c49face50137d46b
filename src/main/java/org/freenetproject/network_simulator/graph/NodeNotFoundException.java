package org.freenetproject.network_simulator.graph;

import org.freenetproject.network_simulator.graph.node.NodeId;

/**
 * Indicates a reference to a node which is not in the graph.
 */
public class NodeNotFoundException extends GraphException {
	private static final long serialVersionUID = -1;

	public NodeNotFoundException(NodeId id) {
		super("There is no node " + id + " in the graph.");
	}
}
