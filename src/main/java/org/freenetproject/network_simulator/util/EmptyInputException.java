package org.freenetproject.network_simulator.util;

/**
 * Indicates a statistic requested over an empty sequence.
 */
public class EmptyInputException extends IllegalArgumentException {
	private static final long serialVersionUID = -1;

	public EmptyInputException(String message) {
		super(message);
	}
}
