package org.freenetproject.network_simulator;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.math3.random.RandomGenerator;
import org.freenetproject.network_simulator.graph.EdgeList;
import org.freenetproject.network_simulator.graph.generator.GraphGenerator;
import org.freenetproject.network_simulator.graph.generator.PreferentialAttachmentGenerator;
import org.freenetproject.network_simulator.graph.generator.UniformRandomGenerator;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.Writer;

import static org.freenetproject.network_simulator.util.File.readableFile;
import static org.freenetproject.network_simulator.util.File.writableFile;

/**
 * Parses arguments, determines any errors, and provides access to the values.
 *
 * Static methods parse and validate arguments; an instance stores the values on its fields.
 */
public class Arguments {

	public final boolean quiet, verbose, print, directed, selfEdges, compareGamma;
	public final int seed, networkSize, edges;
	public final double gamma;
	public final String delimiter;
	public final GraphSource graphSource;
	public final BufferedReader graphInput;
	public final Writer degreeOutput, graphOutput;

	private Arguments(boolean quiet, boolean verbose, boolean print, boolean directed, boolean selfEdges, boolean compareGamma,
	                  int seed, int networkSize, int edges,
	                  double gamma,
	                  String delimiter,
	                  GraphSource graphSource,
	                  BufferedReader graphInput,
	                  Writer degreeOutput, Writer graphOutput) {

		this.quiet = quiet;
		this.verbose = verbose;
		this.print = print;
		this.directed = directed;
		this.selfEdges = selfEdges;
		this.compareGamma = compareGamma;
		this.seed = seed;
		this.networkSize = networkSize;
		this.edges = edges;
		this.gamma = gamma;
		this.delimiter = delimiter;
		this.graphSource = graphSource;
		this.graphInput = graphInput;
		this.degreeOutput = degreeOutput;
		this.graphOutput = graphOutput;
	}

	/**
	 * @param random Randomness source for the generator.
	 * @return generator for the selected model, or null when the graph is loaded.
	 */
	public GraphGenerator getGenerator(RandomGenerator random) {
		switch (graphSource) {
			case UNIFORM: return new UniformRandomGenerator(random);
			case SCALE_FREE: return new PreferentialAttachmentGenerator(random);
			default: return null;
		}
	}

	static Options generateOptions() {
		Options options = new Options();
		//Overall
		options.addOption("D", "output-degree", true, "Output file for the degree distribution as \"[degree] [count] [normalized]\\n\", with the power law appended when --gamma is given.");
		options.addOption("q", "quiet", false, "No output to stdout. Messages about arguments are still output.");
		options.addOption("v", "verbose", false, "Progress updates.");
		options.addOption("h", "help", false, "Display this message.");
		options.addOption("V", "version", false, "Display software version.");
		options.addOption("S", "seed", true, "Seed used by psuedorandom number generator.");
		options.addOption("p", "print", false, "Print the graph as a sorted adjacency list.");

		//Graphs: generation
		options.addOption("s", "size", true, "Number of nodes. For --scale-free-graph this is the number of seed nodes, and as many are added by growth.");
		options.addOption("e", "edges", true, "Number of edges. For --scale-free-graph this is the number of edges added with each new node.");
		options.addOption("u", "uniform-graph", false, "Generate an undirected graph with --edges edges between uniformly random pairs of nodes.");
		options.addOption("a", "scale-free-graph", false, "Generate an undirected graph by preferential attachment.");

		//Graphs: files
		options.addOption("G", "load-graph", true, "Path to load an edge list from.");
		options.addOption("g", "save-graph", true, "Path to save the graph to as an edge list.");
		options.addOption("d", "directed", false, "Treat a loaded edge list as directed.");
		options.addOption("x", "self-edges", false, "Allow self-edges in a loaded edge list. If not specified they are skipped.");
		options.addOption("t", "delimiter", true, "Column delimiter of edge lists. Default is a tab; \"\\t\" is also accepted.");

		//Analysis
		options.addOption("k", "gamma", true, "Compare the normalized degree distribution to a power law with this exponent and print the Kolmogorov-Smirnov distance.");

		return options;
	}

	/**
	 * Parses command line arguments and validates them.
	 *
	 * @param args Arguments to parse.
	 * @return An Arguments instance with the parsed arguments, or null in the case of an error.
	 * @throws ParseException Failed to parse command line.
	 * @throws IOException Failed to close a file opened before a later one failed to open.
	 */
	public static Arguments parse(String[] args) throws ParseException, IOException {
		final Options options = generateOptions();
		final CommandLineParser parser = new GnuParser();
		final CommandLine cmd = parser.parse(options, args);

		if (cmd.hasOption("help")) {
			HelpFormatter formatter = new HelpFormatter();
			formatter.printHelp( "java -jar simulator.jar", options );
			return null;
		}

		if (cmd.hasOption("version")) {
			System.out.println("Network Simulator v 0.0.1-dev");
			return null;
		}

		//Check that required arguments are specified and that combinations make sense.
		if (cmd.hasOption("quiet") && cmd.hasOption("verbose")) {
			System.out.println("Quiet with verbose does not make sense.");
			return null;
		}
		if (cmd.hasOption("quiet") && !(cmd.hasOption("output-degree") || cmd.hasOption("save-graph"))) {
			System.out.println("Simulation will produce no output: --quiet is specified, but not any option which outputs to a file.");
			return null;
		}

		/*
		 * Determine the graph source to use, and if exactly one was specified. Allowing more than one would make
		 * it ambiguous which one was used.
		 */
		int validGeneration = 0;
		GraphSource graphSource = null;
		if (cmd.hasOption("load-graph")) {
			validGeneration++;
			graphSource = GraphSource.LOAD;
		}

		if (cmd.hasOption("uniform-graph")) {
			validGeneration++;
			graphSource = GraphSource.UNIFORM;
		}

		if (cmd.hasOption("scale-free-graph")) {
			validGeneration++;
			graphSource = GraphSource.SCALE_FREE;
		}

		if (validGeneration != 1) {
			System.out.println("Either zero or too many graph sources specified.");
			System.out.println("Valid graph sources are:");
			System.out.println(" * --load-graph, optionally with --directed and --self-edges");
			System.out.println(" * --uniform-graph with --size and --edges");
			System.out.println(" * --scale-free-graph with --size and --edges");
			return null;
		}

		// By this point a single valid graph source should be specified.
		assert graphSource != null;

		if (graphSource != GraphSource.LOAD) {
			if (!cmd.hasOption("size") || !cmd.hasOption("edges")) {
				System.out.println("Network size and edges must both be specified. (--size, --edges)");
				return null;
			}
			if (cmd.hasOption("directed") || cmd.hasOption("self-edges")) {
				System.out.println("--directed and --self-edges only apply to --load-graph; generated graphs are undirected without self-edges.");
				return null;
			}
		}

		final Integer seed = integerOption(cmd, "seed", 0);
		final Integer networkSize = integerOption(cmd, "size", 0);
		final Integer edges = integerOption(cmd, "edges", 0);
		if (seed == null || networkSize == null || edges == null) return null;

		final double gamma;
		if (cmd.hasOption("gamma")) {
			try {
				gamma = Double.parseDouble(cmd.getOptionValue("gamma"));
			} catch (NumberFormatException e) {
				System.out.println("--gamma must be a number; got \"" + cmd.getOptionValue("gamma") + "\".");
				return null;
			}
		} else {
			gamma = 0.0;
		}

		String delimiter = cmd.getOptionValue("delimiter", EdgeList.DEFAULT_DELIMITER);
		if (delimiter.equals("\\t")) delimiter = "\t";
		if (delimiter.isEmpty()) {
			System.out.println("The delimiter must not be empty.");
			return null;
		}

		//Check if input files can be read.
		final BufferedReader graphInput;
		try {
			graphInput = readableFile("load-graph", cmd);
		} catch (FileNotFoundException e) {
			return null;
		}

		//Check that output files exist and are writable or can be created. Close what was opened on failure.
		final Writer degreeOutput, graphOutput;
		try {
			degreeOutput = writableFile("output-degree", cmd);
		} catch (FileNotFoundException e) {
			close(graphInput);
			return null;
		}
		try {
			graphOutput = writableFile("save-graph", cmd);
		} catch (FileNotFoundException e) {
			close(graphInput);
			close(degreeOutput);
			return null;
		}

		return new Arguments(cmd.hasOption("quiet"), cmd.hasOption("verbose"), cmd.hasOption("print"), cmd.hasOption("directed"), cmd.hasOption("self-edges"), cmd.hasOption("gamma"),
		                     seed, networkSize, edges,
		                     gamma,
		                     delimiter,
		                     graphSource,
		                     graphInput,
		                     degreeOutput, graphOutput);
	}

	private static void close(Closeable file) throws IOException {
		if (file != null) file.close();
	}

	/**
	 * @return the option's value, the default if it is not specified, or null after printing a message if it is
	 * not an integer.
	 */
	private static Integer integerOption(CommandLine cmd, String option, int defaultValue) {
		if (!cmd.hasOption(option)) return defaultValue;
		try {
			return Integer.valueOf(cmd.getOptionValue(option));
		} catch (NumberFormatException e) {
			System.out.println("--" + option + " must be an integer; got \"" + cmd.getOptionValue(option) + "\".");
			return null;
		}
	}
}
