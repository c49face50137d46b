package org.freenetproject.network_simulator.graph.generator;

import org.apache.commons.math3.random.RandomGenerator;
import org.freenetproject.network_simulator.graph.Graph;
import org.freenetproject.network_simulator.graph.node.GraphNode;
import org.freenetproject.network_simulator.util.InvalidParameterException;

import java.util.ArrayList;

/**
 * Generates undirected graphs without self-edges in which a fixed number of edges join node pairs chosen
 * uniformly at random. Nodes are numbered 0 to N - 1.
 */
public class UniformRandomGenerator implements GraphGenerator {

	private final RandomGenerator random;

	/**
	 * @param random source of entropy for selecting which nodes to connect.
	 */
	public UniformRandomGenerator(RandomGenerator random) {
		this.random = random;
	}

	/**
	 * @return the number of edges in a complete undirected graph without self-edges: n(n - 1) / 2.
	 */
	public static long maxEdges(int nNodes) {
		return (long)nNodes * (nNodes - 1) / 2;
	}

	/**
	 * @param nNodes number of nodes.
	 * @param nEdges number of distinct edges. Must not exceed {@link #maxEdges(int)}.
	 */
	@Override
	public Graph generate(int nNodes, int nEdges) {
		if (nNodes < 0) throw new InvalidParameterException("The number of nodes (" + nNodes + ") must not be negative.");
		if (nEdges < 0) throw new InvalidParameterException("The number of edges (" + nEdges + ") must not be negative.");

		final long max = maxEdges(nNodes);
		if (nEdges > max) {
			throw new InvalidParameterException("The number of edges (" + nEdges + ") is higher than is possible (" +
			                                    max + ") for an undirected graph with " + nNodes + " nodes.");
		}

		final Graph graph = new Graph(true, false);
		final ArrayList<GraphNode> nodes = new ArrayList<GraphNode>(nNodes);
		for (int i = 0; i < nNodes; i++) nodes.add(graph.addNode(new GraphNode(i)));

		// Complete graph: sampling would mostly pick existing edges towards the end.
		if (nEdges == max) {
			for (int i = 0; i < nNodes; i++) {
				for (int j = i + 1; j < nNodes; j++) graph.addEdge(nodes.get(i), nodes.get(j));
			}
			return graph;
		}

		int established = 0;
		while (established < nEdges) {
			// Two distinct nodes: the second index skips over the first.
			final int first = random.nextInt(nNodes);
			int second = random.nextInt(nNodes - 1);
			if (second >= first) second++;

			final GraphNode a = nodes.get(first);
			final GraphNode b = nodes.get(second);
			if (graph.edgeExists(a, b)) continue;

			graph.addEdge(a, b);
			established++;
		}

		assert graph.edgeCount() == nEdges;
		return graph;
	}
}
