package org.ctgrain.split;

import org.ctgrain.volume.Connectivity;
import org.ctgrain.volume.InvalidInputException;
import org.ctgrain.volume.LabelVolume;
import org.ctgrain.volume.Volume;

import ij.IJ;

/**
 * Splits touching particles by eroding the foreground into seeds and growing
 * the seeds back with a watershed.
 *
 * <ol>
 * <li>Erode with a Euclidean ball of the given radius; everything outside the
 * stack is background.</li>
 * <li>Label the surviving seed blobs.</li>
 * <li>Flood the negated distance map of the uneroded foreground from the
 * seeds, restricted to the foreground.</li>
 * <li>Renumber particles 1..n in raster order of their first voxel.</li>
 * </ol>
 *
 * <p>
 * Particles that erode away completely have no seed and are absent from the
 * result. Both distance maps depend only on the volume, so an instance bound
 * to one volume computes them once and reuses them for every radius.
 * Instances are safe to share between threads.
 * </p>
 */
public class ParticleSplitter {

	/** Neighbourhood used to grow seeds back to the particle boundary */
	public static final Connectivity DEFAULT_FLOOD_CONNECTIVITY = Connectivity.SIX;

	private final Volume volume;
	private final Connectivity floodConnectivity;

	/** squared distances with the stack edge as background, for erosion */
	private int[][] erosionMap;

	/** squared distances to background inside the stack, for flooding */
	private int[][] landscape;

	public ParticleSplitter(final Volume volume) {
		this(volume, DEFAULT_FLOOD_CONNECTIVITY);
	}

	public ParticleSplitter(final Volume volume, final Connectivity floodConnectivity) {
		if (volume == null)
			throw new InvalidInputException("No volume to split");
		if (floodConnectivity == null)
			throw new InvalidInputException("No flood connectivity");
		this.volume = volume;
		this.floodConnectivity = floodConnectivity;
	}

	/**
	 * Split a volume once, without keeping the distance maps
	 *
	 * @see #split(int, Connectivity)
	 */
	public static LabelVolume split(final Volume volume, final int radius, final Connectivity seedConnectivity) {
		return new ParticleSplitter(volume).split(radius, seedConnectivity);
	}

	/**
	 * Label the particles of the bound volume
	 *
	 * @param radius
	 *            erosion radius in voxels, 0 for no erosion
	 * @param seedConnectivity
	 *            neighbourhood joining eroded voxels into one seed
	 * @return new label volume
	 * @throws InvalidInputException
	 *             if radius is negative
	 */
	public LabelVolume split(final int radius, final Connectivity seedConnectivity) {
		if (radius < 0)
			throw new InvalidInputException("Erosion radius must not be negative: " + radius);
		if (seedConnectivity == null)
			throw new InvalidInputException("No seed connectivity");
		final int w = volume.getWidth();
		final int h = volume.getHeight();

		IJ.showStatus("Eroding with radius " + radius + "...");
		final boolean[][] seedMask = DistanceTransform.threshold(getErosionMap(), radius);
		final int[][] seeds = ParticleLabeller.label(seedMask, w, h, seedConnectivity);
		final int[][] labels = SeededWatershed.flood(getLandscape(), seeds, volume, floodConnectivity);
		final int n = ParticleLabeller.minimiseLabels(labels, maxLabel(seeds));
		if (IJ.debugMode)
			IJ.log("Radius " + radius + ": " + n + " particles");
		return new LabelVolume(labels, w, h);
	}

	public Volume getVolume() {
		return volume;
	}

	public Connectivity getFloodConnectivity() {
		return floodConnectivity;
	}

	private synchronized int[][] getErosionMap() {
		if (erosionMap == null)
			erosionMap = DistanceTransform.squaredDistances(volume, true);
		return erosionMap;
	}

	private synchronized int[][] getLandscape() {
		if (landscape == null)
			landscape = DistanceTransform.squaredDistances(volume, false);
		return landscape;
	}

	private static int maxLabel(final int[][] labels) {
		int max = 0;
		for (final int[] slice : labels)
			for (final int p : slice)
				if (p > max)
					max = p;
		return max;
	}
}
