package org.freenetproject.network_simulator.util;

import org.apache.commons.cli.CommandLine;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Convenience file methods.
 */
public class File {
	/**
	 * Opens the file named by an option for reading as UTF-8 text.
	 *
	 * @param option option to check for a path to a file.
	 * @param cmd command line to check for the given option.
	 * @return a reader of the file, or null if the option is not specified.
	 * @throws FileNotFoundException if the option was specified but the file was not found.
	 */
	public static BufferedReader readableFile(final String option, final CommandLine cmd) throws FileNotFoundException {
		if (!cmd.hasOption(option)) return null;
		final java.io.File file = new java.io.File(cmd.getOptionValue(option));
		try {
			return new BufferedReader(new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8));
		} catch (FileNotFoundException e) {
			System.out.println("Cannot read \"" + file.getAbsolutePath() + "\" as a file.");
			throw e;
		}
	}

	/**
	 * Opens the file named by an option for writing as UTF-8 text, replacing any contents.
	 *
	 * @param option option to check for a path to a file.
	 * @param cmd command line to check for the given option.
	 * @return a writer to the file, or null if the option is not specified.
	 * @throws FileNotFoundException if the option was specified but the file cannot be opened.
	 */
	public static Writer writableFile(final String option, final CommandLine cmd) throws FileNotFoundException {
		if (!cmd.hasOption(option)) return null;
		final java.io.File file = new java.io.File(cmd.getOptionValue(option));
		try {
			return new BufferedWriter(new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8));
		} catch (FileNotFoundException e) {
			System.out.println("Unable to open \"" + file.getAbsolutePath() + "\" for output:");
			e.printStackTrace();
			throw e;
		}
	}
}
