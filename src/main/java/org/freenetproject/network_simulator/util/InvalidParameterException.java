package org.freenetproject.network_simulator.util;

/**
 * Indicates a negative or infeasible count or bound given to a generator or statistic.
 */
public class InvalidParameterException extends IllegalArgumentException {
	private static final long serialVersionUID = -1;

	public InvalidParameterException(String message) {
		super(message);
	}
}
