package org.ctgrain.metrics;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.ctgrain.volume.LabelVolume;
import org.junit.Test;

public class ParticleVolumesTest {

	@Test
	public void testBackgroundAndGapsIgnored() {
		final ParticleVolumes v = new ParticleVolumes(new long[] { 7, 10, 0, 30 });
		assertEquals(2, v.getParticleCount());
		assertEquals(40, v.getTotalVolume());
		assertEquals(30, v.getLargestVolume());
		assertEquals(0.75, v.getLargestRatio(), 1e-12);
		assertArrayEquals(new long[] { 10, 30 }, v.getVolumes());
	}

	@Test
	public void testFromLabels() {
		final ParticleVolumes v = new ParticleVolumes(LabelVolume.fromArray(new int[][][] { { { 1, 0, 2, 2, 2 } } }));
		assertEquals(2, v.getParticleCount());
		assertEquals(4, v.getTotalVolume());
		assertEquals(0.75, v.getLargestRatio(), 1e-12);
	}

	@Test
	public void testNoParticles() {
		final ParticleVolumes v = new ParticleVolumes(new long[] { 12 });
		assertEquals(0, v.getParticleCount());
		assertEquals(0, v.getLargestRatio(), 0);
		assertEquals(0, v.getMaxEquivalentRadius(), 0);
	}

	@Test
	public void testEquivalentRadius() {
		assertEquals(2.0, ParticleVolumes.equivalentRadius(4.0 / 3 * Math.PI * 8), 1e-12);
		assertEquals(0, ParticleVolumes.equivalentRadius(0), 0);
	}
}
