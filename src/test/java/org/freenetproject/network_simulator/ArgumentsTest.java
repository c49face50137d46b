package org.freenetproject.network_simulator;

import org.apache.commons.cli.ParseException;
import org.apache.commons.math3.random.MersenneTwister;
import org.freenetproject.network_simulator.graph.generator.PreferentialAttachmentGenerator;
import org.freenetproject.network_simulator.graph.generator.UniformRandomGenerator;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;

/**
 * Tests argument parsing and validation.
 */
public class ArgumentsTest {

	@Test
	public void testUniform() throws ParseException, IOException {
		final Arguments arguments = Arguments.parse(new String[] { "--uniform-graph", "--size", "100", "--edges", "250", "--seed", "7" });

		assert arguments != null;
		assert arguments.graphSource == GraphSource.UNIFORM;
		assert arguments.networkSize == 100;
		assert arguments.edges == 250;
		assert arguments.seed == 7;
		assert !arguments.compareGamma;
		assert arguments.delimiter.equals("\t");
		assert arguments.graphInput == null;
		assert arguments.degreeOutput == null;
		assert arguments.getGenerator(new MersenneTwister(0)) instanceof UniformRandomGenerator;
	}

	@Test
	public void testScaleFree() throws ParseException, IOException {
		final Arguments arguments = Arguments.parse(new String[] { "-a", "-s", "10", "-e", "2", "--gamma", "2.5", "--print" });

		assert arguments != null;
		assert arguments.graphSource == GraphSource.SCALE_FREE;
		assert arguments.compareGamma;
		assert arguments.gamma == 2.5;
		assert arguments.print;
		assert arguments.seed == 0;
		assert arguments.getGenerator(new MersenneTwister(0)) instanceof PreferentialAttachmentGenerator;
	}

	@Test
	public void testLoad() throws ParseException, IOException {
		final File edges = File.createTempFile("edges", ".tsv");
		edges.deleteOnExit();

		final Arguments arguments = Arguments.parse(new String[] { "--load-graph", edges.getPath(), "--directed", "--self-edges", "--delimiter", "\\t" });

		assert arguments != null;
		assert arguments.graphSource == GraphSource.LOAD;
		assert arguments.directed;
		assert arguments.selfEdges;
		assert arguments.delimiter.equals("\t");
		assert arguments.graphInput != null;
		assert arguments.getGenerator(new MersenneTwister(0)) == null;
		arguments.graphInput.close();
	}

	@Test
	public void testInvalid() throws ParseException, IOException {
		// No graph source.
		assert Arguments.parse(new String[] { "--size", "10", "--edges", "5" }) == null;
		// Two graph sources.
		assert Arguments.parse(new String[] { "--uniform-graph", "--scale-free-graph", "--size", "10", "--edges", "5" }) == null;
		// Missing size or edges.
		assert Arguments.parse(new String[] { "--uniform-graph", "--edges", "5" }) == null;
		assert Arguments.parse(new String[] { "--scale-free-graph", "--size", "5" }) == null;
		// Not integers.
		assert Arguments.parse(new String[] { "--uniform-graph", "--size", "ten", "--edges", "5" }) == null;
		assert Arguments.parse(new String[] { "--uniform-graph", "--size", "10", "--edges", "5", "--gamma", "steep" }) == null;
		// Load options on a generated graph.
		assert Arguments.parse(new String[] { "--uniform-graph", "--size", "10", "--edges", "5", "--directed" }) == null;
		// Quiet without any file output.
		assert Arguments.parse(new String[] { "--uniform-graph", "--size", "10", "--edges", "5", "--quiet" }) == null;
		assert Arguments.parse(new String[] { "--uniform-graph", "--size", "10", "--edges", "5", "--quiet", "--verbose" }) == null;
		// File which does not exist.
		assert Arguments.parse(new String[] { "--load-graph", "does/not/exist.tsv" }) == null;
		// Help and version do not run anything.
		assert Arguments.parse(new String[] { "--help" }) == null;
		assert Arguments.parse(new String[] { "--version" }) == null;
	}

	/**
	 * Files opened before an output file fails to open are closed again.
	 */
	@Test
	public void testUnwritableOutputClosesInput() throws ParseException, IOException {
		final File edges = File.createTempFile("edges", ".tsv");
		edges.deleteOnExit();
		final File degrees = File.createTempFile("degrees", ".dat");
		degrees.deleteOnExit();
		final File directory = edges.getParentFile();

		assert Arguments.parse(new String[] { "--load-graph", edges.getPath(), "--output-degree", degrees.getPath(), "--save-graph", directory.getPath() }) == null;

		// Closed files can be deleted on every platform.
		assert edges.delete();
		assert degrees.delete();
	}
}
