package org.freenetproject.network_simulator.graph;

import org.freenetproject.network_simulator.graph.node.NodeId;

/**
 * Indicates an attempt to add a node whose identifier is already in the graph.
 */
public class DuplicateNodeException extends GraphException {
	private static final long serialVersionUID = -1;

	public DuplicateNodeException(NodeId id) {
		super("The graph already has a node with identifier " + id + ".");
	}
}
