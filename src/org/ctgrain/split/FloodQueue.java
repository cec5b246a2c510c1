package org.ctgrain.split;

import java.util.Arrays;

/**
 * Binary min-heap of voxels for priority flooding.
 *
 * <p>
 * Entries are ordered by key, then by insertion order, so voxels at the same
 * height are flooded first-in first-out and the result does not depend on
 * heap internals. Stored in parallel primitive arrays to avoid one object per
 * voxel.
 * </p>
 */
class FloodQueue {

	private int[] keys;
	private long[] ages;
	private long[] voxels;
	private int size;
	private long age;

	FloodQueue(final int initialCapacity) {
		final int capacity = Math.max(16, initialCapacity);
		keys = new int[capacity];
		ages = new long[capacity];
		voxels = new long[capacity];
	}

	boolean isEmpty() {
		return size == 0;
	}

	int size() {
		return size;
	}

	void add(final int key, final long voxel) {
		if (size == keys.length) {
			final int capacity = keys.length * 2;
			keys = Arrays.copyOf(keys, capacity);
			ages = Arrays.copyOf(ages, capacity);
			voxels = Arrays.copyOf(voxels, capacity);
		}
		int i = size++;
		final long a = age++;
		// sift up
		while (i > 0) {
			final int parent = (i - 1) >>> 1;
			if (!less(key, a, keys[parent], ages[parent]))
				break;
			move(parent, i);
			i = parent;
		}
		keys[i] = key;
		ages[i] = a;
		voxels[i] = voxel;
	}

	/**
	 * @return voxel with the smallest key, oldest first among equal keys
	 */
	long poll() {
		if (size == 0)
			throw new IllegalStateException("Flood queue is empty");
		final long top = voxels[0];
		size--;
		if (size > 0) {
			final int key = keys[size];
			final long a = ages[size];
			final long voxel = voxels[size];
			int i = 0;
			// sift down
			while (true) {
				int child = 2 * i + 1;
				if (child >= size)
					break;
				if (child + 1 < size && less(keys[child + 1], ages[child + 1], keys[child], ages[child]))
					child++;
				if (!less(keys[child], ages[child], key, a))
					break;
				move(child, i);
				i = child;
			}
			keys[i] = key;
			ages[i] = a;
			voxels[i] = voxel;
		}
		return top;
	}

	private void move(final int from, final int to) {
		keys[to] = keys[from];
		ages[to] = ages[from];
		voxels[to] = voxels[from];
	}

	private static boolean less(final int k1, final long a1, final int k2, final long a2) {
		return k1 < k2 || (k1 == k2 && a1 < a2);
	}
}
