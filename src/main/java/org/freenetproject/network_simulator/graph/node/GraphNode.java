package org.freenetproject.network_simulator.graph.node;

import org.freenetproject.network_simulator.graph.DuplicateEdgeException;
import org.freenetproject.network_simulator.graph.MissingEdgeException;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A vertex: an identifier and the set of nodes it has edges to.
 *
 * The neighbours are other nodes of the same graph; the graph owns all of them. Changing the neighbours only
 * changes this node, so keeping undirected edges symmetric is up to the graph.
 */
public class GraphNode implements Identifiable, Comparable<GraphNode> {
	private final NodeId id;
	private final LinkedHashSet<GraphNode> neighbours;

	public GraphNode(NodeId id) {
		if (id == null) throw new NullPointerException("Node identifier is null.");
		this.id = id;
		this.neighbours = new LinkedHashSet<GraphNode>();
	}

	public GraphNode(long id) {
		this(NodeId.of(id));
	}

	public GraphNode(String id) {
		this(NodeId.of(id));
	}

	@Override
	public NodeId getId() {
		return id;
	}

	/**
	 * @return number of distinct neighbours.
	 */
	public int degree() {
		return neighbours.size();
	}

	/**
	 * @param other node to consider.
	 * @return True if this node has an edge to the other.
	 */
	public boolean hasEdgeTo(GraphNode other) {
		return neighbours.contains(other);
	}

	/**
	 * Adds an edge from this node to the other.
	 *
	 * @throws DuplicateEdgeException if the edge already exists.
	 */
	public void addEdge(GraphNode other) {
		if (hasEdgeTo(other)) throw new DuplicateEdgeException(this.id, other.id);
		neighbours.add(other);
	}

	/**
	 * Removes the edge from this node to the other.
	 *
	 * @throws MissingEdgeException if there is no such edge.
	 */
	public void removeEdge(GraphNode other) {
		if (!neighbours.remove(other)) throw new MissingEdgeException(this.id, other.id);
	}

	/**
	 * @return read-only view of the neighbours in insertion order.
	 */
	public Set<GraphNode> getNeighbours() {
		return Collections.unmodifiableSet(neighbours);
	}

	@Override
	public int compareTo(GraphNode other) {
		return id.compareTo(other.id);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof GraphNode)) return false;
		return id.equals(((GraphNode)o).id);
	}

	@Override
	public int hashCode() {
		return id.hashCode();
	}

	@Override
	public String toString() {
		return id.toString();
	}
}
