package org.freenetproject.network_simulator.graph;

/**
 * Indicates a graph mutation or query which would violate the graph's structure. Nothing is changed when one
 * of these is thrown.
 */
public abstract class GraphException extends RuntimeException {
	private static final long serialVersionUID = -1;

	GraphException(String message) {
		super(message);
	}
}
