package org.freenetproject.network_simulator.util;

import org.apache.commons.math3.util.MathArrays;

import java.util.Arrays;

/**
 * Statistics over degree distributions. All functions are pure.
 */
public final class DistributionStats {

	private DistributionStats() {
	}

	/**
	 * Divides each bucket by the total count, which for a degree histogram is the number of nodes.
	 *
	 * @param histogram counts per degree.
	 * @return normalized histogram; [1.0] if the total count is zero, as for an empty graph.
	 */
	public static double[] normalize(int[] histogram) {
		long total = 0;
		for (int count : histogram) total += count;
		if (total == 0) return new double[] { 1.0 };

		final double[] normalized = new double[histogram.length];
		for (int i = 0; i < histogram.length; i++) normalized[i] = histogram[i] / (double)total;
		return normalized;
	}

	/**
	 * @return running prefix sum, of the same length as the input.
	 */
	public static double[] cumulative(double[] sequence) {
		final double[] cumulative = new double[sequence.length];
		double sum = 0.0;
		for (int i = 0; i < sequence.length; i++) {
			sum += sequence[i];
			cumulative[i] = sum;
		}
		return cumulative;
	}

	/**
	 * @see #cumulative(double[])
	 */
	public static long[] cumulative(int[] sequence) {
		final long[] cumulative = new long[sequence.length];
		long sum = 0;
		for (int i = 0; i < sequence.length; i++) {
			sum += sequence[i];
			cumulative[i] = sum;
		}
		return cumulative;
	}

	/**
	 * Generates a power law histogram P(k) proportional to k^-gamma for k = 1..maxDegree, normalized so that the
	 * sum of k * P(k) over that range is 1. Degree 0 is included with 0.0.
	 *
	 * @param maxDegree highest degree included.
	 * @param gamma slope of the power law.
	 * @return histogram of length maxDegree + 1.
	 * @throws InvalidParameterException if maxDegree is negative.
	 */
	public static double[] powerLawHistogram(int maxDegree, double gamma) {
		if (maxDegree < 0) {
			throw new InvalidParameterException("Maximum degree must be non-negative; got " + maxDegree + ".");
		}

		final double[] histogram = new double[maxDegree + 1];
		double normalization = 0.0;
		for (int k = 1; k <= maxDegree; k++) {
			histogram[k] = Math.pow(k, -gamma);
			normalization += k * histogram[k];
		}
		for (int k = 1; k <= maxDegree; k++) histogram[k] /= normalization;

		return histogram;
	}

	/**
	 * Computes the Kolmogorov-Smirnov distance between two histograms: the largest absolute difference between
	 * their cumulative distributions. Only indexes present in both are compared; pad the shorter histogram with
	 * zeros first to compare over the full range.
	 *
	 * @throws EmptyInputException if either histogram is empty.
	 */
	public static double ksDistance(double[] histogramA, double[] histogramB) {
		if (histogramA.length == 0 || histogramB.length == 0) {
			throw new EmptyInputException("Histograms must not be empty; got lengths " + histogramA.length +
			                              " and " + histogramB.length + ".");
		}

		final int overlap = Math.min(histogramA.length, histogramB.length);
		final double[] cumulativeA = Arrays.copyOf(cumulative(histogramA), overlap);
		final double[] cumulativeB = Arrays.copyOf(cumulative(histogramB), overlap);
		return MathArrays.distanceInf(cumulativeA, cumulativeB);
	}

	/**
	 * @see #ksDistance(double[], double[])
	 */
	public static double ksDistance(int[] histogramA, int[] histogramB) {
		return ksDistance(toDouble(histogramA), toDouble(histogramB));
	}

	/**
	 * @return copy of the histogram extended with zeros to the given length, or unchanged if already as long.
	 */
	public static double[] pad(double[] histogram, int length) {
		if (histogram.length >= length) return histogram.clone();
		return Arrays.copyOf(histogram, length);
	}

	private static double[] toDouble(int[] values) {
		final double[] converted = new double[values.length];
		for (int i = 0; i < values.length; i++) converted[i] = values[i];
		return converted;
	}
}
