package org.ctgrain.split;

import org.ctgrain.util.Multithreader;
import org.ctgrain.volume.Volume;

import ij.IJ;

/* Bob Dougherty 8/10/2007
 Euclidean distance map, three separable passes


 License:
 Copyright (c) 2007, OptiNav, Inc.
 All rights reserved.

 Redistribution and use in source and binary forms, with or without
 modification, are permitted provided that the following conditions
 are met:

 Redistributions of source code must retain the above copyright
 notice, this list of conditions and the following disclaimer.
 Redistributions in binary form must reproduce the above copyright
 notice, this list of conditions and the following disclaimer in the
 documentation and/or other materials provided with the distribution.
 Neither the name of OptiNav, Inc. nor the names of its contributors
 may be used to endorse or promote products derived from this software
 without specific prior written permission.

 THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS
 "AS IS" AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT
 LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR
 A PARTICULAR PURPOSE ARE DISCLAIMED.  IN NO EVENT SHALL THE COPYRIGHT OWNER OR
 CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL,
 EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT LIMITED TO,
 PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR
 PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF
 LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT (INCLUDING
 NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
 SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.

 */
/**
 * Squared Euclidean distance from every foreground voxel to the nearest
 * background voxel.
 *
 * <p>
 * Saito and Toriwaki's separable transform: the first pass scans rows, the
 * second columns and the third runs along z. Rows and columns are processed
 * slice by slice in parallel, the z pass is parallel over rows. Distances are
 * kept squared and integral so that comparisons against a radius are exact.
 * </p>
 *
 * <p>
 * Saito T, Toriwaki J (1994) New algorithms for Euclidean distance
 * transformation of an n-dimensional digitized picture with applications.
 * Pattern Recognition 27: 1551-1565.
 * </p>
 *
 * @author Bob Dougherty
 * @author Michael Doube
 */
public class DistanceTransform {

	/**
	 * Compute the squared distance map
	 *
	 * @param volume
	 *            binary foreground
	 * @param outsideIsBackground
	 *            if true, voxels beyond the stack edges count as background;
	 *            otherwise only background inside the stack is considered
	 * @return <code>[z][y * w + x]</code> squared distances, 0 on background.
	 *         If <code>outsideIsBackground</code> is false and the stack holds
	 *         no background at all, foreground voxels get a value larger than
	 *         any real distance.
	 */
	public static int[][] squaredDistances(final Volume volume, final boolean outsideIsBackground) {
		final int w = volume.getWidth();
		final int h = volume.getHeight();
		final int d = volume.getDepth();
		final int wh = w * h;
		final int n = Math.max(w, Math.max(h, d));
		final int noResult = 3 * (n + 1) * (n + 1);

		final int[][] s = new int[d][wh];

		// Transformation 1: distance to background along x
		IJ.showStatus("EDT transformation 1/3");
		Multithreader.forEachIndex(d, new Multithreader.IndexTask() {
			@Override
			public void process(final int k) {
				final int[] sk = s[k];
				final boolean[] dk = volume.getSlice(k);
				final boolean[] background = new boolean[w];
				for (int j = 0; j < h; j++) {
					final int wj = w * j;
					for (int i = 0; i < w; i++)
						background[i] = !dk[i + wj];
					for (int i = 0; i < w; i++) {
						int min = outsideIsBackground ? edgeDistance(i, w) : noResult;
						for (int x = i; x < w; x++) {
							if (background[x]) {
								final int test = (i - x) * (i - x);
								if (test < min)
									min = test;
								break;
							}
						}
						for (int x = i - 1; x >= 0; x--) {
							if (background[x]) {
								final int test = (i - x) * (i - x);
								if (test < min)
									min = test;
								break;
							}
						}
						sk[i + wj] = min;
					}
				}
			}
		});

		// Transformation 2: along y
		IJ.showStatus("EDT transformation 2/3");
		Multithreader.forEachIndex(d, new Multithreader.IndexTask() {
			@Override
			public void process(final int k) {
				final int[] sk = s[k];
				final int[] tempInt = new int[h];
				final int[] tempS = new int[h];
				for (int i = 0; i < w; i++) {
					boolean nonempty = false;
					for (int j = 0; j < h; j++) {
						tempS[j] = sk[i + w * j];
						if (tempS[j] > 0)
							nonempty = true;
					}
					if (!nonempty)
						continue;
					for (int j = 0; j < h; j++) {
						int min = outsideIsBackground ? edgeDistance(j, h) : noResult;
						for (int y = 0; y < h; y++) {
							final int test = tempS[y] + (j - y) * (j - y);
							if (test < min)
								min = test;
						}
						tempInt[j] = min;
					}
					for (int j = 0; j < h; j++)
						sk[i + w * j] = tempInt[j];
				}
			}
		});

		// Transformation 3: along z, foreground only
		IJ.showStatus("EDT transformation 3/3");
		Multithreader.forEachIndex(h, new Multithreader.IndexTask() {
			@Override
			public void process(final int j) {
				final int wj = w * j;
				final int[] tempInt = new int[d];
				final int[] tempS = new int[d];
				for (int i = 0; i < w; i++) {
					boolean nonempty = false;
					for (int k = 0; k < d; k++) {
						tempS[k] = s[k][i + wj];
						if (tempS[k] > 0)
							nonempty = true;
					}
					if (!nonempty)
						continue;
					int zStart = 0;
					while ((zStart < (d - 1)) && (tempS[zStart] == 0))
						zStart++;
					if (zStart > 0)
						zStart--;
					int zStop = d - 1;
					while ((zStop > 0) && (tempS[zStop] == 0))
						zStop--;
					if (zStop < (d - 1))
						zStop++;
					for (int k = 0; k < d; k++) {
						if (!volume.get(i, j, k)) {
							tempInt[k] = 0;
							continue;
						}
						int min = outsideIsBackground ? edgeDistance(k, d) : noResult;
						final int zBegin = Math.min(zStart, k);
						final int zEnd = Math.max(zStop, k);
						for (int z = zBegin; z <= zEnd; z++) {
							final int test = tempS[z] + (k - z) * (k - z);
							if (test < min)
								min = test;
						}
						tempInt[k] = min;
					}
					for (int k = 0; k < d; k++)
						s[k][i + wj] = tempInt[k];
				}
			}
		});
		return s;
	}

	/**
	 * Erode the foreground with a Euclidean ball. Everything outside the
	 * stack is background.
	 *
	 * @param volume
	 *            binary foreground
	 * @param radius
	 *            ball radius in voxels, 0 returns a copy of the foreground
	 * @return packed slices of the surviving voxels
	 */
	public static boolean[][] erode(final Volume volume, final int radius) {
		return threshold(squaredDistances(volume, true), radius);
	}

	/**
	 * Voxels whose squared distance to the background exceeds
	 * <code>radius²</code>, that is, the centres of every ball of that radius
	 * that fits inside the foreground
	 */
	static boolean[][] threshold(final int[][] squaredDistances, final int radius) {
		final long r2 = (long) radius * radius;
		final boolean[][] eroded = new boolean[squaredDistances.length][];
		for (int z = 0; z < squaredDistances.length; z++) {
			final int[] sz = squaredDistances[z];
			final boolean[] ez = new boolean[sz.length];
			for (int i = 0; i < sz.length; i++)
				ez[i] = sz[i] > r2;
			eroded[z] = ez;
		}
		return eroded;
	}

	/** squared distance from index i to the nearest voxel outside [0, n) */
	private static int edgeDistance(final int i, final int n) {
		final int before = i + 1;
		final int after = n - i;
		final int m = Math.min(before, after);
		return m * m;
	}
}
