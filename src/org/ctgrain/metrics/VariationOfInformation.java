package org.ctgrain.metrics;

import java.util.HashMap;
import java.util.Map;

import org.ctgrain.volume.InvalidInputException;
import org.ctgrain.volume.LabelVolume;

/**
 * Variation of information between two labellings of the same stack,
 * VI = H(X) + H(Y) - 2 I(X; Y) in bits. 0 means the labellings describe the
 * same partition.
 *
 * <p>
 * Meila M (2007) Comparing clusterings - an information based distance.
 * Journal of Multivariate Analysis 98: 873-895.
 * </p>
 */
public class VariationOfInformation {

	/**
	 * VI over the voxels where either labelling has a particle
	 *
	 * @see #compute(LabelVolume, LabelVolume, boolean)
	 */
	public static double compute(final LabelVolume a, final LabelVolume b) {
		return compute(a, b, true);
	}

	/**
	 * @param a
	 *            first labelling
	 * @param b
	 *            second labelling, same shape
	 * @param ignoreBackground
	 *            if true, only voxels labelled in a or b take part
	 * @return VI in bits, &ge; 0; 0 when no voxel takes part
	 * @throws InvalidInputException
	 *             if the shapes differ
	 */
	public static double compute(final LabelVolume a, final LabelVolume b, final boolean ignoreBackground) {
		if (a.getWidth() != b.getWidth() || a.getHeight() != b.getHeight() || a.getDepth() != b.getDepth())
			throw new InvalidInputException("Label volumes differ in shape: " + a.getWidth() + "x" + a.getHeight()
					+ "x" + a.getDepth() + " and " + b.getWidth() + "x" + b.getHeight() + "x" + b.getDepth());
		final long[] countA = new long[a.getMaxLabel() + 1];
		final long[] countB = new long[b.getMaxLabel() + 1];
		final Map<Long, long[]> joint = new HashMap<Long, long[]>();
		long n = 0;
		for (int z = 0; z < a.getDepth(); z++) {
			final int[] sa = a.getSlice(z);
			final int[] sb = b.getSlice(z);
			for (int i = 0; i < sa.length; i++) {
				final int la = sa[i];
				final int lb = sb[i];
				if (ignoreBackground && la == 0 && lb == 0)
					continue;
				countA[la]++;
				countB[lb]++;
				final Long key = ((long) la << 32) | (lb & 0xffffffffL);
				long[] c = joint.get(key);
				if (c == null) {
					c = new long[1];
					joint.put(key, c);
				}
				c[0]++;
				n++;
			}
		}
		if (n == 0)
			return 0;
		final double hA = entropy(countA, n);
		final double hB = entropy(countB, n);
		double mutual = 0;
		for (final Map.Entry<Long, long[]> e : joint.entrySet()) {
			final long key = e.getKey();
			final double pxy = (double) e.getValue()[0] / n;
			final double px = (double) countA[(int) (key >>> 32)] / n;
			final double py = (double) countB[(int) key] / n;
			mutual += pxy * log2(pxy / (px * py));
		}
		return Math.max(0, hA + hB - 2 * mutual);
	}

	private static double entropy(final long[] counts, final long n) {
		double h = 0;
		for (final long c : counts) {
			if (c == 0)
				continue;
			final double p = (double) c / n;
			h -= p * log2(p);
		}
		return h;
	}

	private static double log2(final double v) {
		return Math.log(v) / Math.log(2);
	}
}
