package org.freenetproject.network_simulator.graph;

import org.freenetproject.network_simulator.graph.node.NodeId;

public class SelfEdgeNotAllowedException extends GraphException {
	private static final long serialVersionUID = -1;

	public SelfEdgeNotAllowedException(NodeId id) {
		super("The graph does not allow self-edges; got one on " + id + ".");
	}
}
