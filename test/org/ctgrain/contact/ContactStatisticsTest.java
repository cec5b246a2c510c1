package org.ctgrain.contact;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import org.ctgrain.volume.Connectivity;
import org.ctgrain.volume.LabelVolume;
import org.junit.Test;

public class ContactStatisticsTest {

	@Test
	public void testDistribution() {
		final ContactStatistics s = ContactStatistics.of(new int[] { 4, 1, 3, 2 });
		assertEquals(4, s.getParticleCount());
		assertEquals(2.5, s.getMean(), 1e-12);
		assertEquals(2.5, s.getMedian(), 1e-12);
		assertEquals(Math.sqrt(1.25), s.getStandardDeviation(), 1e-12);
		assertEquals(1, s.getMin());
		assertEquals(4, s.getMax());
		assertEquals(1.75, s.getLowerQuartile(), 1e-12);
		assertEquals(3.25, s.getUpperQuartile(), 1e-12);
	}

	@Test
	public void testSingleValue() {
		final ContactStatistics s = ContactStatistics.of(new int[] { 6 });
		assertEquals(6, s.getMedian(), 0);
		assertEquals(0, s.getStandardDeviation(), 0);
		assertEquals(6, s.getLowerQuartile(), 0);
	}

	@Test
	public void testEmptySetIsZero() {
		assertSame(ContactStatistics.EMPTY, ContactStatistics.of(new int[0]));
		assertEquals(0, ContactStatistics.EMPTY.getMean(), 0);
		assertEquals(0, ContactStatistics.EMPTY.getParticleCount());
	}

	@Test
	public void testOnlySelectedParticlesCount() {
		final LabelVolume labels = LabelVolume.fromArray(new int[][][] { { { 1, 2, 3, 0, 4 } } });
		final ContactRecord record = ContactCounter.count(labels, Connectivity.SIX);
		final ContactStatistics s = ContactStatistics.of(record, new int[] { 2, 4 });
		assertEquals(2, s.getParticleCount());
		assertEquals(1.0, s.getMean(), 1e-12);
		assertEquals(0, s.getMin());
		assertEquals(2, s.getMax());
	}
}
