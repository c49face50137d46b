package org.freenetproject.network_simulator.graph.node;

import java.util.regex.Pattern;

/**
 * Node identifier which is either an integer or a string.
 *
 * Integer identifiers sort numerically and before any string identifier; string identifiers sort
 * lexicographically among themselves. An integer identifier is never equal to a string identifier, so
 * 1 and "1" are distinct nodes.
 */
public final class NodeId implements Identifiable, Comparable<NodeId> {

	private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");

	private final long number;

	/**
	 * Null for integer identifiers.
	 */
	private final String name;

	private NodeId(long number, String name) {
		this.number = number;
		this.name = name;
	}

	public static NodeId of(long number) {
		return new NodeId(number, null);
	}

	public static NodeId of(String name) {
		if (name == null) throw new NullPointerException("Identifier name is null.");
		return new NodeId(0, name);
	}

	/**
	 * Reads an identifier as it appears in an edge list.
	 *
	 * @param token identifier text, as written by {@link #toString()} or by hand.
	 * @return a string identifier if the token is enclosed in single quotes, an integer identifier if it is a
	 * decimal integer which fits in a long, otherwise a string identifier of the token as is.
	 */
	public static NodeId parse(String token) {
		if (token.length() >= 2 && token.startsWith("'") && token.endsWith("'")) {
			return of(token.substring(1, token.length() - 1));
		}
		if (INTEGER.matcher(token).matches()) {
			try {
				return of(Long.parseLong(token));
			} catch (NumberFormatException e) {
				// Too large for a long.
				return of(token);
			}
		}
		return of(token);
	}

	public boolean isNumeric() {
		return name == null;
	}

	@Override
	public NodeId getId() {
		return this;
	}

	@Override
	public int compareTo(NodeId other) {
		if (this.isNumeric() != other.isNumeric()) return this.isNumeric() ? -1 : 1;
		if (isNumeric()) return Long.compare(this.number, other.number);
		return this.name.compareTo(other.name);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof NodeId)) return false;

		final NodeId other = (NodeId)o;
		if (isNumeric()) return other.isNumeric() && this.number == other.number;
		return !other.isNumeric() && this.name.equals(other.name);
	}

	@Override
	public int hashCode() {
		return isNumeric() ? Long.valueOf(number).hashCode() : 31 * name.hashCode() + 1;
	}

	/**
	 * @return integers as is, strings in single quotes to keep 1 and '1' apart. {@link #parse(String)} reads
	 * this form back to an equal identifier.
	 */
	@Override
	public String toString() {
		return isNumeric() ? Long.toString(number) : "'" + name + "'";
	}
}
