package org.freenetproject.network_simulator.graph;

import org.apache.commons.math3.util.Pair;
import org.freenetproject.network_simulator.graph.node.GraphNode;
import org.freenetproject.network_simulator.graph.node.NodeId;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads and writes graphs as delimited edge lists. Each row has two columns: the identifier of the source
 * node and that of the target node. Integer identifiers are written bare and string identifiers in single
 * quotes, so 1 and '1' stay distinct. For example, with a tab delimiter:
 * <pre>
 * 1	'P53'
 * 'P53'	1
 * </pre>
 * Unquoted tokens which are not integers, as in hand-written files, are read as strings.
 */
public final class EdgeList {

	public static final String DEFAULT_DELIMITER = "\t";

	private EdgeList() {
	}

	/**
	 * Writes every edge of the graph. Undirected edges are written in both orientations, so reading the
	 * result back gives the same graph. Nodes without edges are not written.
	 *
	 * @param graph graph to write.
	 * @param output writer to write to. Flushed, not closed.
	 * @param delimiter separates the two columns.
	 * @throws IOException Error writing.
	 * @throws IllegalArgumentException if an identifier contains the delimiter or a line break, as it could
	 * not be read back. Checked before anything is written.
	 */
	public static void write(Graph graph, Writer output, String delimiter) throws IOException {
		final List<Pair<NodeId, NodeId>> edges = graph.edges();
		for (Pair<NodeId, NodeId> edge : edges) {
			checkWritable(edge.getFirst(), delimiter);
			checkWritable(edge.getSecond(), delimiter);
		}

		for (Pair<NodeId, NodeId> edge : edges) {
			output.write(edge.getFirst().toString());
			output.write(delimiter);
			output.write(edge.getSecond().toString());
			output.write('\n');
		}
		output.flush();
	}

	private static void checkWritable(NodeId id, String delimiter) {
		final String token = id.toString();
		if (token.contains(delimiter) || token.indexOf('\n') != -1 || token.indexOf('\r') != -1) {
			throw new IllegalArgumentException("Identifier " + token + " cannot be written to an edge list delimited by \""
			        + delimiter + "\".");
		}
	}

	/**
	 * Constructs a graph from an edge list. Rows which do not have exactly two non-blank columns are skipped.
	 * Nodes are created as they are first mentioned. Repeated edges, and self-edges when the graph does not
	 * allow them, are ignored.
	 *
	 * @param input reader to read rows from. Not closed.
	 * @param delimiter separates the two columns.
	 * @param undirected If true, the graph has undirected edges.
	 * @param allowSelfEdges If true, the graph allows self-edges.
	 * @return graph defined by the rows.
	 * @throws IOException Error reading.
	 */
	public static Graph read(BufferedReader input, String delimiter, boolean undirected, boolean allowSelfEdges)
	    throws IOException {
		final Graph graph = new Graph(undirected, allowSelfEdges);
		final Pattern separator = Pattern.compile(Pattern.quote(delimiter));

		String line;
		while ((line = input.readLine()) != null) {
			final String[] columns = separator.split(line, -1);
			if (columns.length != 2) continue;

			final String source = columns[0].trim();
			final String target = columns[1].trim();
			if (source.isEmpty() || target.isEmpty()) continue;

			final NodeId from = resolve(graph, source);
			final NodeId to = resolve(graph, target);
			try {
				graph.addEdge(from, to);
			} catch (DuplicateEdgeException e) {
				// Undirected edges are listed in both orientations.
				continue;
			} catch (SelfEdgeNotAllowedException e) {
				continue;
			}
		}

		return graph;
	}

	private static NodeId resolve(Graph graph, String token) {
		final NodeId id = NodeId.parse(token);
		if (!graph.hasNode(id)) graph.addNode(new GraphNode(id));
		return id;
	}
}
