package org.freenetproject.network_simulator.graph.generator;

import org.freenetproject.network_simulator.graph.Graph;

/**
 * Builds a graph according to a random graph model.
 */
public interface GraphGenerator {
	/**
	 * @param nNodes node count parameter of the model. Must be non-negative.
	 * @param nEdges edge count parameter of the model. Must be non-negative.
	 * @return a new graph.
	 * @throws org.freenetproject.network_simulator.util.InvalidParameterException if the parameters are negative
	 * or cannot be satisfied.
	 */
	public Graph generate(int nNodes, int nEdges);
}
