package org.freenetproject.network_simulator.graph.generator;

import org.apache.commons.math3.random.RandomGenerator;
import org.freenetproject.network_simulator.graph.Graph;
import org.freenetproject.network_simulator.graph.node.GraphNode;
import org.freenetproject.network_simulator.util.InvalidParameterException;
import org.freenetproject.network_simulator.util.WeightedDistribution;

import java.util.ArrayList;

/**
 * Generates undirected scale-free graphs without self-edges by preferential attachment, as in the
 * Barabasi-Albert model.
 *
 * Given N and M, N unconnected seed nodes 0 to N - 1 are created. Then for each step i = 0 .. N - 1 a node
 * N + i is added and connected to min(M, i + 1) distinct existing nodes. Targets are selected with probability
 * proportional to their degree, or uniformly while no node has any edges. The probabilities are computed once
 * per step, before the new node's edges are added, so edges added earlier in the same step do not change them.
 *
 * Every node added in an earlier step has at least one edge and so a non-zero weight, which guarantees at least
 * i + 1 selectable targets at step i.
 */
public class PreferentialAttachmentGenerator implements GraphGenerator {

	private final RandomGenerator random;

	/**
	 * @param random source of entropy for selecting attachment targets.
	 */
	public PreferentialAttachmentGenerator(RandomGenerator random) {
		this.random = random;
	}

	/**
	 * @param nNodes number of seed nodes; also the number of growth steps, so the graph ends up with twice as
	 *               many nodes.
	 * @param nEdges edges added by each growth step.
	 */
	@Override
	public Graph generate(int nNodes, int nEdges) {
		if (nNodes < 0) throw new InvalidParameterException("The number of nodes (" + nNodes + ") must not be negative.");
		if (nEdges < 0) {
			throw new InvalidParameterException("The number of edges per step (" + nEdges + ") must not be negative.");
		}

		final Graph graph = new Graph(true, false);
		final ArrayList<GraphNode> existing = new ArrayList<GraphNode>(2 * nNodes);
		for (int i = 0; i < nNodes; i++) existing.add(graph.addNode(new GraphNode(i)));

		for (int step = 0; step < nNodes; step++) {
			final GraphNode newcomer = graph.addNode(new GraphNode((long)nNodes + step));
			final WeightedDistribution<GraphNode> targets = attachmentDistribution(existing);

			// Early steps have fewer targets to choose from.
			final int nConnections = Math.min(nEdges, step + 1);
			int connected = 0;
			while (connected < nConnections) {
				final GraphNode target = targets.randomValue();
				if (target.equals(newcomer) || graph.edgeExists(newcomer, target)) continue;

				graph.addEdge(newcomer, target);
				connected++;
			}

			existing.add(newcomer);
		}

		return graph;
	}

	/**
	 * @param candidates nodes which may be attached to.
	 * @return candidates weighted by degree, or uniformly if none has any edges.
	 */
	private WeightedDistribution<GraphNode> attachmentDistribution(ArrayList<GraphNode> candidates) {
		int degreeSum = 0;
		for (GraphNode candidate : candidates) degreeSum += candidate.degree();

		final WeightedDistribution<GraphNode> distribution = new WeightedDistribution<GraphNode>(random);
		for (GraphNode candidate : candidates) {
			distribution.add(candidate, degreeSum == 0 ? 1 : candidate.degree());
		}
		return distribution;
	}
}
