package org.freenetproject.network_simulator.util;

import org.apache.commons.math3.random.RandomGenerator;

import java.util.ArrayList;

/**
 * Selects from a weighted distribution. Not thread-safe.
 *
 * @param <T> type of the values selected.
 */
public class WeightedDistribution<T> {

	private final ArrayList<T> values;

	/**
	 * Running total of occurrences up to and including the value at the same index. Strictly increasing,
	 * as values with no occurrences are not stored.
	 */
	private final ArrayList<Integer> cumulativeOccurrences;

	private int totalOccurrences;
	private final RandomGenerator random;

	/**
	 * @param random Used for random values.
	 */
	public WeightedDistribution(RandomGenerator random) {
		this.values = new ArrayList<T>();
		this.cumulativeOccurrences = new ArrayList<Integer>();
		this.totalOccurrences = 0;
		this.random = random;
	}

	/**
	 * Adds a value which will be selected with probability proportional to its occurrences. A value with
	 * no occurrences is never selected.
	 *
	 * @param value value to add.
	 * @param occurrences weight of the value. Must be non-negative.
	 */
	public void add(T value, int occurrences) {
		if (occurrences < 0) {
			throw new IllegalArgumentException("Occurrences must be non-negative; got " + occurrences + " for " + value + ".");
		}
		if (occurrences == 0) return;

		totalOccurrences += occurrences;
		values.add(value);
		cumulativeOccurrences.add(totalOccurrences);
	}

	/**
	 * @return sum of all occurrences added.
	 */
	public int getTotalOccurrences() {
		return totalOccurrences;
	}

	/**
	 * @return Random value selected with probability proportional to its occurrences relative the total number of
	 * occurrences.
	 * @throws IllegalStateException if no value has any occurrences.
	 */
	public T randomValue() {
		if (totalOccurrences == 0) throw new IllegalStateException("Cannot select from an empty distribution.");

		// The first value whose running total exceeds the draw.
		final int rand = random.nextInt(totalOccurrences);
		int low = 0, high = values.size() - 1;
		while (low < high) {
			final int mid = (low + high) >>> 1;
			if (cumulativeOccurrences.get(mid) > rand) high = mid;
			else low = mid + 1;
		}
		return values.get(low);
	}
}
