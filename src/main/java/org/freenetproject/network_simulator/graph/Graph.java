package org.freenetproject.network_simulator.graph;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.util.Pair;
import org.freenetproject.network_simulator.graph.node.GraphNode;
import org.freenetproject.network_simulator.graph.node.Identifiable;
import org.freenetproject.network_simulator.graph.node.NodeId;
import org.freenetproject.network_simulator.util.DistributionStats;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Class to represent a directed or undirected graph. Nodes are added explicitly and are never removed; edges
 * are added and removed between nodes already in the graph.
 *
 * In an undirected graph every edge is stored on both of its endpoints. Each mutation either succeeds entirely
 * or throws without changing anything.
 *
 * Functions to evaluate the degree distribution are also provided. Not thread-safe.
 */
public class Graph {
	/**
	 * Nodes by identifier, in the order they were added.
	 */
	private final LinkedHashMap<NodeId, GraphNode> nodes;

	private final boolean undirected;
	private final boolean allowSelfEdges;

	/**
	 * @param undirected If true, edges are undirected. If false, directed.
	 * @param allowSelfEdges If true, a node may have an edge to itself.
	 */
	public Graph(boolean undirected, boolean allowSelfEdges) {
		this.nodes = new LinkedHashMap<NodeId, GraphNode>();
		this.undirected = undirected;
		this.allowSelfEdges = allowSelfEdges;
	}

	/**
	 * Creates an undirected graph without self-edges.
	 */
	public Graph() {
		this(true, false);
	}

	public boolean isUndirected() {
		return undirected;
	}

	public boolean allowsSelfEdges() {
		return allowSelfEdges;
	}

	/**
	 * Adds a node without any edges.
	 *
	 * @param node node to add. It becomes owned by this graph.
	 * @return the added node.
	 * @throws DuplicateNodeException if a node with the same identifier exists.
	 * @throws IllegalArgumentException if the node already has edges.
	 */
	public GraphNode addNode(GraphNode node) {
		if (nodes.containsKey(node.getId())) throw new DuplicateNodeException(node.getId());
		if (node.degree() != 0) {
			throw new IllegalArgumentException("Node " + node + " already has edges; only unconnected nodes can be added.");
		}
		nodes.put(node.getId(), node);
		return node;
	}

	/**
	 * Get the node stored in this graph which has the given identifier. If a node is given, this returns the
	 * graph's own node with the same identifier, which may not be the same object.
	 *
	 * @param node identifier or node to look up.
	 * @return the graph's node.
	 * @throws NodeNotFoundException if there is no such node.
	 */
	public GraphNode getNode(Identifiable node) {
		final GraphNode stored = nodes.get(node.getId());
		if (stored == null) throw new NodeNotFoundException(node.getId());
		return stored;
	}

	/**
	 * @return True if a node with the identifier exists. False otherwise, including for null.
	 */
	public boolean hasNode(Identifiable node) {
		return node != null && nodes.containsKey(node.getId());
	}

	/**
	 * In a directed graph, checks for an edge from the first node to the second. In an undirected graph both
	 * directions must be present.
	 *
	 * @throws NodeNotFoundException if either node is not in the graph.
	 */
	public boolean edgeExists(Identifiable a, Identifiable b) {
		final GraphNode from = getNode(a);
		final GraphNode to = getNode(b);

		if (undirected) return from.hasEdgeTo(to) && to.hasEdgeTo(from);
		return from.hasEdgeTo(to);
	}

	/**
	 * Adds an edge from the first node to the second, and in an undirected graph also from the second to the
	 * first. Both directions are checked before either is added.
	 *
	 * @throws NodeNotFoundException if either node is not in the graph.
	 * @throws SelfEdgeNotAllowedException if both are the same node and self-edges are not allowed.
	 * @throws DuplicateEdgeException if the edge, or in an undirected graph its reverse, already exists.
	 */
	public void addEdge(Identifiable a, Identifiable b) {
		final GraphNode from = getNode(a);
		final GraphNode to = getNode(b);

		final boolean self = from.equals(to);
		if (self && !allowSelfEdges) throw new SelfEdgeNotAllowedException(from.getId());

		if (from.hasEdgeTo(to)) throw new DuplicateEdgeException(from.getId(), to.getId());
		final boolean symmetric = undirected && !self;
		if (symmetric && to.hasEdgeTo(from)) throw new DuplicateEdgeException(to.getId(), from.getId());

		from.addEdge(to);
		if (symmetric) to.addEdge(from);
	}

	/**
	 * Mirror of {@link #addEdge(Identifiable, Identifiable)}.
	 *
	 * @throws NodeNotFoundException if either node is not in the graph.
	 * @throws MissingEdgeException if the edge, or in an undirected graph its reverse, does not exist.
	 */
	public void removeEdge(Identifiable a, Identifiable b) {
		final GraphNode from = getNode(a);
		final GraphNode to = getNode(b);

		if (!from.hasEdgeTo(to)) throw new MissingEdgeException(from.getId(), to.getId());
		final boolean symmetric = undirected && !from.equals(to);
		if (symmetric && !to.hasEdgeTo(from)) throw new MissingEdgeException(to.getId(), from.getId());

		from.removeEdge(to);
		if (symmetric) to.removeEdge(from);
	}

	/**
	 * Get the number of nodes in this graph.
	 *
	 * @return Size of the graph
	 */
	public int size() {
		return nodes.size();
	}

	/**
	 * Count edges in this graph. An undirected edge counts once; directed edges in opposite directions count
	 * separately. A self-edge counts once either way.
	 *
	 * @return Total number of edges
	 */
	public int edgeCount() {
		int adjacencies = 0;
		int selfEdges = 0;
		for (GraphNode node : nodes.values()) {
			adjacencies += node.degree();
			if (node.hasEdgeTo(node)) selfEdges++;
		}

		if (!undirected) return adjacencies;
		// Each non-self edge is stored on both endpoints.
		return (adjacencies - selfEdges) / 2 + selfEdges;
	}

	/**
	 * Find the minimum degree of any node in the graph.
	 *
	 * @return Minimum node degree; 0 for an empty graph.
	 */
	public int minDegree() {
		if (nodes.isEmpty()) return 0;
		int min = Integer.MAX_VALUE;
		for (GraphNode node : nodes.values()) min = Math.min(min, node.degree());
		return min;
	}

	/**
	 * Find the maximum degree of any node in the graph.
	 *
	 * @return Maximum node degree; 0 for an empty graph.
	 */
	public int maxDegree() {
		int max = 0;
		for (GraphNode node : nodes.values()) max = Math.max(max, node.degree());
		return max;
	}

	/**
	 * @return degree of every node, in the order the nodes were added.
	 */
	public int[] degrees() {
		final int[] d = new int[nodes.size()];
		int i = 0;
		for (GraphNode node : nodes.values()) d[i++] = node.degree();
		return d;
	}

	/**
	 * Computes the current degree distribution. Index k holds the number of nodes with degree k; degree 0 and
	 * the maximum degree are always included.
	 *
	 * @return histogram of length maxDegree() + 1.
	 */
	public int[] degreeHistogram() {
		final int[] histogram = new int[maxDegree() + 1];
		for (GraphNode node : nodes.values()) histogram[node.degree()]++;
		return histogram;
	}

	/**
	 * @return the degree histogram divided by the number of nodes; [1.0] for an empty graph.
	 * @see DistributionStats#normalize(int[])
	 */
	public double[] normalizedDegreeDistribution() {
		return DistributionStats.normalize(degreeHistogram());
	}

	/**
	 * @return all nodes, sorted by identifier with integers before strings.
	 */
	public List<GraphNode> nodes() {
		final ArrayList<GraphNode> sorted = new ArrayList<GraphNode>(nodes.values());
		Collections.sort(sorted);
		return sorted;
	}

	/**
	 * Every adjacency as a (source, target) pair, sorted by source and then target. An undirected edge appears
	 * in both orientations; a self-edge appears once.
	 *
	 * @return list of edges.
	 */
	public List<Pair<NodeId, NodeId>> edges() {
		final ArrayList<Pair<NodeId, NodeId>> edges = new ArrayList<Pair<NodeId, NodeId>>();
		for (GraphNode from : nodes()) {
			for (GraphNode to : sortedNeighbours(from)) {
				edges.add(new Pair<NodeId, NodeId>(from.getId(), to.getId()));
			}
		}
		return edges;
	}

	private static List<GraphNode> sortedNeighbours(GraphNode node) {
		final ArrayList<GraphNode> neighbours = new ArrayList<GraphNode>(node.getNeighbours());
		Collections.sort(neighbours);
		return neighbours;
	}

	/**
	 * Prints the graph as a sorted adjacency list. For example:
	 * <pre>
	 * Graph (undirected, no self-edges allowed):
	 *   1 &lt;--&gt; '2'
	 * '0' &lt;--&gt; no edges
	 * '2' &lt;--&gt; 1
	 * </pre>
	 *
	 * @param out stream to print to.
	 */
	public void print(PrintStream out) {
		final String type = (undirected ? "undirected" : "directed") + ", " +
		                    (allowSelfEdges ? "" : "no ") + "self-edges allowed";
		final String marker = undirected ? "<-->" : "-->";

		out.println("Graph (" + type + "):" + (nodes.isEmpty() ? " empty" : ""));

		int width = 0;
		for (GraphNode node : nodes.values()) width = Math.max(width, node.toString().length());
		width += 2;

		for (GraphNode node : nodes()) {
			final StringBuilder line = new StringBuilder();
			final String label = node.toString();
			for (int i = label.length(); i < width; i++) line.append(' ');
			line.append(label).append(' ').append(marker).append(' ');

			final List<GraphNode> neighbours = sortedNeighbours(node);
			if (neighbours.isEmpty()) {
				line.append("no edges");
			} else {
				for (int i = 0; i < neighbours.size(); i++) {
					if (i > 0) line.append(", ");
					line.append(neighbours.get(i));
				}
			}
			out.println(line);
		}
	}

	/**
	 * Print some topology statistics.
	 *
	 * @param out stream to print to.
	 * @param verbose If true, one labelled statistic per line. If false, a single tab-separated row as described
	 *                by {@link #printGraphStatsHeader(PrintStream)}.
	 */
	public void printGraphStats(PrintStream out, boolean verbose) {
		final DescriptiveStatistics degreeStats = degreeStatistics();
		if (verbose) {
			out.println("Graph stats:");
			out.println("Size:			" + size());
			out.println("Edges:			" + edgeCount());
			out.println("Min degree:		" + minDegree());
			out.println("Max degree:		" + maxDegree());
			out.println("Mean degree:		" + degreeStats.getMean());
			out.println("Degree stddev:		" + degreeStats.getStandardDeviation());
			out.println("Degree skewness:	" + degreeStats.getSkewness());
			out.println();
		} else {
			out.print(size() + "\t" + edgeCount() + "\t" + minDegree() + "\t" + maxDegree() + "\t");
			out.println(degreeStats.getMean() + "\t" + degreeStats.getStandardDeviation() + "\t" + degreeStats.getSkewness());
		}
	}

	/**Print column headers for printGraphStats(out, false).*/
	public static void printGraphStatsHeader(PrintStream out) {
		out.println("nNodes\tnEdges\tminDegree\tmaxDegree\tdegreeMean\tdegreeStdDev\tdegreeSkew");
	}

	/**
	 * @return summary statistics over the node degrees. Undefined values are NaN.
	 */
	public DescriptiveStatistics degreeStatistics() {
		final DescriptiveStatistics stats = new DescriptiveStatistics();
		for (int degree : degrees()) stats.addValue(degree);
		return stats;
	}
}
