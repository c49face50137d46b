package org.freenetproject.network_simulator.graph;

import org.apache.commons.math3.random.MersenneTwister;
import org.freenetproject.network_simulator.graph.generator.PreferentialAttachmentGenerator;
import org.freenetproject.network_simulator.graph.generator.UniformRandomGenerator;
import org.freenetproject.network_simulator.graph.node.GraphNode;
import org.freenetproject.network_simulator.graph.node.NodeId;
import org.testng.annotations.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;

/**
 * Test writing and reading edge lists.
 */
public class EdgeListTest {

	private static String write(Graph graph, String delimiter) throws IOException {
		final StringWriter writer = new StringWriter();
		EdgeList.write(graph, writer, delimiter);
		return writer.toString();
	}

	private static Graph read(String text, String delimiter, boolean undirected, boolean allowSelfEdges) throws IOException {
		return EdgeList.read(new BufferedReader(new StringReader(text)), delimiter, undirected, allowSelfEdges);
	}

	/**
	 * Tests that every pair of nodes in the original graph has the same edgeExists() result in the other graph.
	 * Nodes without edges are not written, so only nodes with edges need to be present.
	 */
	private static boolean sameEdges(final Graph original, final Graph other) {
		if (original.edgeCount() != other.edgeCount()) return false;

		for (GraphNode a : original.nodes()) {
			if (a.degree() == 0) continue;
			if (!other.hasNode(a)) return false;
			for (GraphNode b : original.nodes()) {
				if (b.degree() == 0) continue;
				if (original.edgeExists(a, b) != other.edgeExists(a, b)) return false;
			}
		}
		return true;
	}

	@Test
	public void testWrite() throws IOException {
		final Graph graph = new Graph();
		graph.addNode(new GraphNode(1));
		graph.addNode(new GraphNode("A"));
		graph.addNode(new GraphNode(0));
		graph.addEdge(NodeId.of("A"), NodeId.of(1));

		assert write(graph, "\t").equals("1\t'A'\n'A'\t1\n");
	}

	@Test
	public void testWriteDirected() throws IOException {
		final Graph graph = new Graph(false, false);
		graph.addNode(new GraphNode(1));
		graph.addNode(new GraphNode(2));
		graph.addEdge(NodeId.of(2), NodeId.of(1));

		assert write(graph, ",").equals("2,1\n");
	}

	@Test
	public void testReadEmpty() throws IOException {
		final Graph graph = read("", "\t", true, false);
		assert graph.size() == 0;
		assert graph.isUndirected();
		assert !graph.allowsSelfEdges();
	}

	/**
	 * Rows without exactly two non-blank columns are skipped; repeated edges are ignored.
	 */
	@Test
	public void testReadSkipsRows() throws IOException {
		final String text =
		        "1\t2\n" +
		        "\n" +
		        "3\n" +
		        "4\t5\t6\n" +
		        "7\t\n" +
		        "2\t1\n" +
		        "1\t2\n" +
		        " P53 \tMDM2\n";
		final Graph graph = read(text, "\t", true, false);

		assert graph.size() == 4;
		assert graph.edgeCount() == 2;
		assert graph.edgeExists(NodeId.of(1), NodeId.of(2));
		assert graph.edgeExists(NodeId.of("P53"), NodeId.of("MDM2"));
		assert !graph.hasNode(NodeId.of(3));
		assert !graph.hasNode(NodeId.of(7));
	}

	@Test
	public void testReadSelfEdges() throws IOException {
		final Graph disallowed = read("1\t1\n1\t2\n", "\t", true, false);
		assert disallowed.edgeCount() == 1;
		assert !disallowed.edgeExists(NodeId.of(1), NodeId.of(1));

		final Graph allowed = read("1\t1\n1\t2\n", "\t", true, true);
		assert allowed.edgeCount() == 2;
		assert allowed.edgeExists(NodeId.of(1), NodeId.of(1));
	}

	@Test
	public void testReadDirected() throws IOException {
		final Graph graph = read("a;b\nb;a\nb;c\n", ";", false, false);

		assert !graph.isUndirected();
		assert graph.edgeCount() == 3;
		assert graph.edgeExists(NodeId.of("b"), NodeId.of("c"));
		assert !graph.edgeExists(NodeId.of("c"), NodeId.of("b"));
	}

	/**
	 * A graph is the same whether it has been generated this run or read from a written graph.
	 */
	@Test
	public void testRoundTrip() throws IOException {
		final Graph uniform = new UniformRandomGenerator(new MersenneTwister(0)).generate(60, 150);
		assert sameEdges(uniform, read(write(uniform, "\t"), "\t", true, false));

		final Graph scaleFree = new PreferentialAttachmentGenerator(new MersenneTwister(0)).generate(40, 2);
		assert sameEdges(scaleFree, read(write(scaleFree, ","), ",", true, false));
	}

	@Test
	public void testRoundTripDirected() throws IOException {
		final Graph directed = new Graph(false, true);
		for (String name : new String[] { "x", "y", "z" }) directed.addNode(new GraphNode(name));
		directed.addEdge(NodeId.of("x"), NodeId.of("y"));
		directed.addEdge(NodeId.of("y"), NodeId.of("x"));
		directed.addEdge(NodeId.of("z"), NodeId.of("z"));
		directed.addEdge(NodeId.of("z"), NodeId.of("x"));

		assert sameEdges(directed, read(write(directed, "\t"), "\t", false, true));
	}

	/**
	 * String identifiers which look like integers, or which carry spaces, read back as the same strings.
	 */
	@Test
	public void testRoundTripStringIdentifiers() throws IOException {
		final Graph graph = new Graph();
		for (String name : new String[] { "7", "8", " a", "b c" }) graph.addNode(new GraphNode(name));
		graph.addNode(new GraphNode(7));
		graph.addEdge(NodeId.of("7"), NodeId.of("8"));
		graph.addEdge(NodeId.of("7"), NodeId.of(7));
		graph.addEdge(NodeId.of(" a"), NodeId.of("b c"));

		final String text = write(graph, "\t");
		assert text.contains("'7'\t'8'\n");
		assert text.contains("7\t'7'\n");

		final Graph read = read(text, "\t", true, false);
		assert read.size() == 5;
		assert read.hasNode(NodeId.of("7"));
		assert read.hasNode(NodeId.of(7));
		assert read.edgeExists(NodeId.of("7"), NodeId.of("8"));
		assert read.edgeExists(NodeId.of(" a"), NodeId.of("b c"));
		assert !read.hasNode(NodeId.of(8));
		assert sameEdges(graph, read);
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void testWriteDelimiterInIdentifier() throws IOException {
		final Graph graph = new Graph();
		graph.addNode(new GraphNode("b\td"));
		graph.addNode(new GraphNode(1));
		graph.addEdge(NodeId.of(1), NodeId.of("b\td"));

		write(graph, "\t");
	}

	/**
	 * Nothing is written when an identifier cannot be.
	 */
	@Test
	public void testWriteLineBreakInIdentifier() throws IOException {
		final Graph graph = new Graph();
		graph.addNode(new GraphNode(1));
		graph.addNode(new GraphNode(2));
		graph.addNode(new GraphNode("x\ny"));
		graph.addEdge(NodeId.of(1), NodeId.of(2));
		graph.addEdge(NodeId.of(2), NodeId.of("x\ny"));

		final StringWriter writer = new StringWriter();
		boolean thrown = false;
		try {
			EdgeList.write(graph, writer, ",");
		} catch (IllegalArgumentException e) {
			thrown = true;
		}

		assert thrown;
		assert writer.toString().isEmpty();
	}

	/**
	 * Written graphs can be read and written again, producing the same text.
	 */
	@Test
	public void testWriteRead() throws IOException {
		final Graph original = new UniformRandomGenerator(new MersenneTwister(1)).generate(30, 40);
		final String first = write(original, "\t");
		final String second = write(read(first, "\t", true, false), "\t");

		assert first.equals(second);
	}
}
