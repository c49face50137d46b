package org.freenetproject.network_simulator.graph;

import org.freenetproject.network_simulator.graph.node.NodeId;

/**
 * Indicates an attempt to remove an edge which does not exist.
 */
public class MissingEdgeException extends GraphException {
	private static final long serialVersionUID = -1;

	public MissingEdgeException(NodeId from, NodeId to) {
		super("The edge from " + from + " to " + to + " does not exist.");
	}
}
