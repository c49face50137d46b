package org.freenetproject.network_simulator;

import org.apache.commons.cli.ParseException;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.freenetproject.network_simulator.graph.EdgeList;
import org.freenetproject.network_simulator.graph.Graph;
import org.freenetproject.network_simulator.util.DistributionStats;
import org.freenetproject.network_simulator.util.InvalidParameterException;

import java.io.IOException;
import java.io.Writer;

/**
 * Generates or loads a graph and reports on its degree distribution.
 */
public class NetworkSim {

	/**
	 * Main simulator program. Generate or load a graph, print its stats, optionally compare its degree
	 * distribution to a power law, and write the requested output files.
	 *
	 * @param args Command-line arguments; see --help.
	 */
	public static void main(String[] args) throws ParseException, IOException {
		Arguments arguments = Arguments.parse(args);
		if (arguments == null) System.exit(1);

		RandomGenerator rand = new MersenneTwister(arguments.seed);

		long startTime = System.currentTimeMillis();

		// Load the graph; otherwise generate.
		final Graph g;
		if (arguments.graphSource == GraphSource.LOAD) {
			try {
				g = EdgeList.read(arguments.graphInput, arguments.delimiter, !arguments.directed, arguments.selfEdges);
			} finally {
				arguments.graphInput.close();
			}
		} else {
			try {
				g = arguments.getGenerator(rand).generate(arguments.networkSize, arguments.edges);
			} catch (InvalidParameterException e) {
				System.out.println(e.getMessage());
				System.exit(1);
				return;
			}
		}

		if (!arguments.quiet) {
			if (!arguments.verbose) Graph.printGraphStatsHeader(System.out);
			g.printGraphStats(System.out, arguments.verbose);
			System.out.println("Generation took (ms): " + (System.currentTimeMillis() - startTime));
		}

		if (arguments.print && !arguments.quiet) g.print(System.out);

		final double[] observed = g.normalizedDegreeDistribution();
		double[] expected = null;
		if (arguments.compareGamma) {
			expected = DistributionStats.powerLawHistogram(g.maxDegree(), arguments.gamma);
			final double distance = DistributionStats.ksDistance(observed, expected);
			if (!arguments.quiet) {
				System.out.println("Kolmogorov-Smirnov distance to power law with gamma " + arguments.gamma + ": " + distance);
			}
		}

		if (arguments.degreeOutput != null) {
			try {
				writeDegrees(g.degreeHistogram(), observed, expected, arguments.degreeOutput);
			} finally {
				arguments.degreeOutput.close();
			}
		}

		if (arguments.graphOutput != null) {
			try {
				EdgeList.write(g, arguments.graphOutput, arguments.delimiter);
			} finally {
				arguments.graphOutput.close();
			}
			if (arguments.verbose) System.out.println("Wrote " + g.edges().size() + " edge list rows.");
		}

		if (!arguments.quiet) {
			System.out.println("Total time taken (ms): " + (System.currentTimeMillis() - startTime));
		}
	}

	/**
	 * Writes "[degree] [count] [normalized]" lines, with the expected value as a fourth column if given. Intended
	 * for plotting.
	 *
	 * @param histogram node count per degree.
	 * @param normalized histogram normalized to the network size.
	 * @param expected expected normalized value per degree; may be null.
	 * @param output where to write. Not closed.
	 */
	static void writeDegrees(int[] histogram, double[] normalized, double[] expected, Writer output) throws IOException {
		for (int degree = 0; degree < histogram.length; degree++) {
			final StringBuilder line = new StringBuilder();
			line.append(degree).append(' ').append(histogram[degree]).append(' ').append(normalized[degree]);
			if (expected != null && degree < expected.length) line.append(' ').append(expected[degree]);
			output.write(line.append('\n').toString());
		}
		output.flush();
	}
}
