package org.freenetproject.network_simulator;

/**
 * Indicates where the graph comes from.
 */
public enum GraphSource {
	/**
	 * The graph will be loaded from an edge list file.
	 */
	LOAD,
	/**
	 * The graph will be generated with --size nodes and --edges undirected edges between uniformly random pairs.
	 */
	UNIFORM,
	/**
	 * The graph will be grown by preferential attachment from --size seed nodes, adding --edges edges per new
	 * node. The result has twice --size nodes.
	 */
	SCALE_FREE
}
