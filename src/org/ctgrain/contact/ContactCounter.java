package org.ctgrain.contact;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import org.ctgrain.util.Multithreader;
import org.ctgrain.volume.Connectivity;
import org.ctgrain.volume.InvalidInputException;
import org.ctgrain.volume.LabelVolume;

import ij.IJ;

/**
 * Finds touching particles in a label volume.
 *
 * <p>
 * Every labelled voxel looks at the neighbours that precede it in raster
 * order; a neighbour with a different non-zero label records the pair. Since
 * adjacency is symmetric this sees every voxel pair once. Slices are scanned
 * in parallel, each into its own pair set, and the sets are merged at the end.
 * </p>
 */
public class ContactCounter {

	/**
	 * @param labels
	 *            particle labels
	 * @param connectivity
	 *            neighbourhood in which two voxels touch
	 * @return pairs and per-particle contact counts
	 */
	public static ContactRecord count(final LabelVolume labels, final Connectivity connectivity) {
		if (labels == null)
			throw new InvalidInputException("No label volume");
		if (connectivity == null)
			throw new InvalidInputException("No contact connectivity");
		final int w = labels.getWidth();
		final int h = labels.getHeight();
		final int d = labels.getDepth();
		final int[][] offsets = connectivity.getBackwardOffsets();

		@SuppressWarnings("unchecked")
		final Set<Long>[] slicePairs = new Set[d];
		IJ.showStatus("Counting contacts...");
		Multithreader.forEachIndex(d, new Multithreader.IndexTask() {
			@Override
			public void process(final int z) {
				final Set<Long> pairs = new HashSet<Long>();
				final int[] lz = labels.getSlice(z);
				for (int y = 0; y < h; y++) {
					final int rowIndex = y * w;
					for (int x = 0; x < w; x++) {
						final int id = lz[rowIndex + x];
						if (id == 0)
							continue;
						for (final int[] o : offsets) {
							final int nX = x + o[0];
							final int nY = y + o[1];
							final int nZ = z + o[2];
							if (nX < 0 || nX >= w || nY < 0 || nY >= h || nZ < 0)
								continue;
							final int other = labels.get(nX, nY, nZ);
							if (other != 0 && other != id)
								pairs.add(ContactRecord.pack(id, other));
						}
					}
				}
				slicePairs[z] = pairs;
			}
		});

		final Set<Long> all = new HashSet<Long>();
		for (final Set<Long> pairs : slicePairs)
			all.addAll(pairs);
		final long[] sorted = new long[all.size()];
		int i = 0;
		for (final Long pair : all)
			sorted[i++] = pair;
		Arrays.sort(sorted);
		return new ContactRecord(connectivity, sorted, labels.getMaxLabel());
	}
}
