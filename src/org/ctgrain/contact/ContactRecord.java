package org.ctgrain.contact;

import java.util.Arrays;

import org.ctgrain.volume.Connectivity;

/**
 * Which particles touch which, for one label volume and connectivity.
 *
 * <p>
 * Each unordered pair of touching particles is held once, however many voxel
 * faces, edges or corners they share. A particle's contact count is the
 * number of distinct particles it touches. Immutable.
 * </p>
 */
public final class ContactRecord {

	private final Connectivity connectivity;

	/** pairs packed as (smaller id << 32 | larger id), sorted */
	private final long[] pairs;

	/** indexed by particle id, 0 unused */
	private final int[] contactCounts;

	ContactRecord(final Connectivity connectivity, final long[] sortedPairs, final int maxLabel) {
		this.connectivity = connectivity;
		this.pairs = sortedPairs;
		this.contactCounts = new int[maxLabel + 1];
		for (final long pair : sortedPairs) {
			contactCounts[first(pair)]++;
			contactCounts[second(pair)]++;
		}
	}

	static long pack(final int a, final int b) {
		final int lo = Math.min(a, b);
		final int hi = Math.max(a, b);
		return ((long) lo << 32) | (hi & 0xffffffffL);
	}

	private static int first(final long pair) {
		return (int) (pair >>> 32);
	}

	private static int second(final long pair) {
		return (int) pair;
	}

	public Connectivity getConnectivity() {
		return connectivity;
	}

	/**
	 * @return number of distinct touching pairs
	 */
	public int getPairCount() {
		return pairs.length;
	}

	/**
	 * @return true if particles a and b touch, in either order
	 */
	public boolean touches(final int a, final int b) {
		if (a == b || a <= 0 || b <= 0)
			return false;
		return Arrays.binarySearch(pairs, pack(a, b)) >= 0;
	}

	/**
	 * @return every touching pair as {smaller id, larger id}, sorted
	 */
	public int[][] getPairs() {
		final int[][] out = new int[pairs.length][];
		for (int i = 0; i < pairs.length; i++)
			out[i] = new int[] { first(pairs[i]), second(pairs[i]) };
		return out;
	}

	/**
	 * @return number of distinct particles touching <code>id</code>; 0 for
	 *         an isolated or unknown particle
	 */
	public int getContactCount(final int id) {
		if (id <= 0 || id >= contactCounts.length)
			return 0;
		return contactCounts[id];
	}

	/**
	 * @return contact counts indexed by particle id
	 */
	public int[] getContactCounts() {
		return contactCounts.clone();
	}

	/**
	 * @return ids of the particles touching <code>id</code>, ascending
	 */
	public int[] getNeighbours(final int id) {
		final int[] out = new int[getContactCount(id)];
		int n = 0;
		for (final long pair : pairs) {
			if (first(pair) == id)
				out[n++] = second(pair);
			else if (second(pair) == id)
				out[n++] = first(pair);
		}
		Arrays.sort(out);
		return out;
	}
}
