package org.freenetproject.network_simulator.graph;

import org.freenetproject.network_simulator.graph.node.NodeId;

/**
 * Indicates an attempt to add an edge which already exists.
 */
public class DuplicateEdgeException extends GraphException {
	private static final long serialVersionUID = -1;

	public DuplicateEdgeException(NodeId from, NodeId to) {
		super("The edge from " + from + " to " + to + " already exists.");
	}
}
